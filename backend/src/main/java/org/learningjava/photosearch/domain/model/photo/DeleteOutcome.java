package org.learningjava.photosearch.domain.model.photo;

/**
 * {@code deleted == 0} means nothing matched; it is not an error.
 */
public record DeleteOutcome(String photoPath, String aspectName, int deleted) {

    public boolean found() {
        return deleted > 0;
    }

    public String message() {
        String target = aspectName == null ? photoPath + " (all aspects)" : photoPath + " [" + aspectName + "]";
        return found()
                ? "Deleted " + deleted + " record(s) for " + target
                : "No records found for " + target;
    }
}
