package org.learningjava.photosearch.domain.model.photo;

/**
 * A search request carrying image bytes, free text, or both. The image wins when both are present.
 */
public record PhotoQuery(byte[] image, String text, String aspectFilter, int k) {

    public static PhotoQuery ofText(String text, String aspectFilter, int k) {
        return new PhotoQuery(null, text, aspectFilter, k);
    }

    public static PhotoQuery ofImage(byte[] image, String aspectFilter, int k) {
        return new PhotoQuery(image, null, aspectFilter, k);
    }

    public boolean hasImage() {
        return image != null && image.length > 0;
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
