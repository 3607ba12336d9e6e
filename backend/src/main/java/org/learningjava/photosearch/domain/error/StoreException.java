package org.learningjava.photosearch.domain.error;

/**
 * Thrown when the vector store is unreachable or rejects an operation.
 */
public class StoreException extends PhotoSearchException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
