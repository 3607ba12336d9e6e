package org.learningjava.photosearch.domain.error;

/**
 * Base exception for indexing and search failures.
 *
 * <p>All photo search exceptions extend this class, so callers that only need a
 * success/failure signal can catch it in one place.</p>
 */
public class PhotoSearchException extends RuntimeException {

    public PhotoSearchException(String message) {
        super(message);
    }

    public PhotoSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
