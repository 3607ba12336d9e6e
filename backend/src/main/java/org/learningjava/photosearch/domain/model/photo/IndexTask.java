package org.learningjava.photosearch.domain.model.photo;

import java.nio.file.Path;

/**
 * Immutable input of one worker step: index {@code photo} under {@code aspectName}.
 */
public record IndexTask(Path photo, String aspectName, String prompt, boolean skipExisting) {

    /** Records are keyed by absolute, normalized paths so relative and absolute roots agree. */
    public String photoPath() {
        return keyOf(photo);
    }

    public static String keyOf(Path photo) {
        return photo.toAbsolutePath().normalize().toString();
    }
}
