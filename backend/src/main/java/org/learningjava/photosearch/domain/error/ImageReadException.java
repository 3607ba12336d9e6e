package org.learningjava.photosearch.domain.error;

/**
 * Thrown when an image file is missing, unreadable or cannot be decoded.
 */
public class ImageReadException extends PhotoSearchException {

    public ImageReadException(String message) {
        super(message);
    }

    public ImageReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
