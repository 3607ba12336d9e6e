package org.learningjava.photosearch.domain.model.photo;

/**
 * Result of indexing one photo under one aspect. Failures are values, not exceptions.
 */
public record IndexOutcome(String photoPath, String aspectName, Kind kind, String message) {

    public enum Kind {
        INDEXED,
        SKIPPED,
        IMAGE_ERROR,
        PROVIDER_ERROR,
        STORE_ERROR,
        INTERNAL_ERROR;

        public boolean isSuccess() {
            return this == INDEXED || this == SKIPPED;
        }
    }

    public static IndexOutcome indexed(String photoPath, String aspectName) {
        return new IndexOutcome(photoPath, aspectName, Kind.INDEXED,
                "Indexed " + photoPath + " [" + aspectName + "]");
    }

    public static IndexOutcome skipped(String photoPath, String aspectName) {
        return new IndexOutcome(photoPath, aspectName, Kind.SKIPPED,
                "Skipped " + photoPath + " [" + aspectName + "]: already indexed");
    }

    public static IndexOutcome failed(String photoPath, String aspectName, Kind kind, String message) {
        if (kind.isSuccess()) {
            throw new IllegalArgumentException("Not a failure kind: " + kind);
        }
        return new IndexOutcome(photoPath, aspectName, kind,
                "Error processing " + photoPath + " [" + aspectName + "]: " + message);
    }

    public boolean success() {
        return kind.isSuccess();
    }
}
