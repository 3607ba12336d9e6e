package org.learningjava.photosearch.domain.model.photo;

import java.util.Comparator;

/**
 * One ranked hit. Lower {@code distance} means more similar.
 */
public record SearchResult(
        String photoPath,
        String aspectName,
        double distance,
        String description
) {

    /** Ascending distance, ties broken by path then aspect so orderings are repeatable. */
    public static final Comparator<SearchResult> BY_DISTANCE = Comparator
            .comparingDouble(SearchResult::distance)
            .thenComparing(SearchResult::photoPath)
            .thenComparing(SearchResult::aspectName);
}
