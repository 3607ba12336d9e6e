package org.learningjava.photosearch.domain.model.photo;

/**
 * Normalized image ready for transport: RGB, longer edge at most 1024 px, PNG encoded as Base64.
 */
public record CanonicalImage(String base64Png, int width, int height) {

    public CanonicalImage {
        if (base64Png == null || base64Png.isEmpty()) {
            throw new IllegalArgumentException("base64Png must not be empty");
        }
    }
}
