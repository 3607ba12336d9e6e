package org.learningjava.photosearch.application.port;

public interface EmbeddingPort {
    float[] embed(String text);
    String model();
}
