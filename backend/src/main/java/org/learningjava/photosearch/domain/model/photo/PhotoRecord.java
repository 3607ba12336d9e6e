package org.learningjava.photosearch.domain.model.photo;

import java.util.Arrays;
import java.util.Objects;

public record PhotoRecord(
        String photoPath,
        String aspectName,
        String description,
        float[] embedding
) {

    public PhotoRecord {
        Objects.requireNonNull(photoPath, "photoPath");
        Objects.requireNonNull(aspectName, "aspectName");
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    public EntryId entryId() {
        return EntryId.of(photoPath, aspectName);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhotoRecord other)) return false;
        return photoPath.equals(other.photoPath)
                && aspectName.equals(other.aspectName)
                && Objects.equals(description, other.description)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(photoPath, aspectName, description, Arrays.hashCode(embedding));
    }

    @Override
    public String toString() {
        return "PhotoRecord{" + photoPath + "#" + aspectName + ", dim=" + embedding.length + "}";
    }
}
