package org.learningjava.photosearch.domain.error;

/**
 * Thrown when the model-serving endpoint is unreachable, times out or returns a malformed response.
 * Never retried implicitly.
 */
public class ProviderException extends PhotoSearchException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
