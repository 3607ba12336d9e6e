package org.learningjava.photosearch.domain.model.photo;

public record DescribedEmbedding(String description, float[] embedding) {

    public DescribedEmbedding {
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }
}
