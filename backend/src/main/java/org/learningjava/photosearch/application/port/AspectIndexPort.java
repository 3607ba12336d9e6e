package org.learningjava.photosearch.application.port;

import org.learningjava.photosearch.domain.model.photo.PhotoRecord;
import org.learningjava.photosearch.domain.model.photo.SearchResult;

import java.util.List;
import java.util.Set;

/**
 * Persistent mapping from (photoPath, aspectName) to one {@link PhotoRecord}, with
 * nearest-neighbour ranking over the embeddings.
 *
 * <p>Implementations must serialize writes to the same key and allow writes to distinct keys
 * to proceed in parallel. Reads see an unspecified point-in-time snapshot.</p>
 */
public interface AspectIndexPort {

    void ensureSchema();

    /** Insert or wholesale-replace the record for (photoPath, aspectName). */
    void upsert(String photoPath, String aspectName, float[] embedding, String description);

    /**
     * At most {@code k} results in ascending distance; {@code aspectFilter == null} ranks every aspect.
     * Never fails because nothing matched.
     */
    List<SearchResult> query(float[] embedding, int k, String aspectFilter);

    /** Deletes one key, or every aspect of the photo when {@code aspectName} is null. */
    int delete(String photoPath, String aspectName);

    boolean contains(String photoPath, String aspectName);

    List<PhotoRecord> findByPhoto(String photoPath);

    Set<String> listPhotoPaths();

    long count();

    void clear();
}
