package org.learningjava.photosearch.config;

import okhttp3.OkHttpClient;
import org.learningjava.photosearch.application.port.AspectIndexPort;
import org.learningjava.photosearch.application.port.EmbeddingPort;
import org.learningjava.photosearch.application.port.ImageDescriptionPort;
import org.learningjava.photosearch.application.port.ModelCatalogPort;
import org.learningjava.photosearch.domain.service.embedding.EmbeddingProvider;
import org.learningjava.photosearch.infrastructure.adapter.out.memory.InMemoryAspectIndexAdapter;
import org.learningjava.photosearch.infrastructure.adapter.out.ollama.OllamaDescriptionAdapter;
import org.learningjava.photosearch.infrastructure.adapter.out.ollama.OllamaEmbeddingAdapter;
import org.learningjava.photosearch.infrastructure.adapter.out.ollama.OllamaModelsService;
import org.learningjava.photosearch.infrastructure.adapter.out.weaviate.WeaviateAspectIndexAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    //objects with external dependencies
    @Bean
    OkHttpClient ollamaHttpClient(PhotoSearchProperties props) {
        return new OkHttpClient.Builder()
                .connectTimeout(props.getOllama().getConnectTimeout())
                .writeTimeout(Duration.ofSeconds(60))              // base64 images
                .readTimeout(props.getOllama().getReadTimeout())    // vision models can take a while
                .build();
    }

    @Bean
    EmbeddingPort embedding(OkHttpClient ollamaHttpClient, PhotoSearchProperties props) {
        return new OllamaEmbeddingAdapter(ollamaHttpClient, props.getOllama().getUrl(),
                props.getOllama().getEmbeddingModel());
    }

    @Bean
    ImageDescriptionPort describer(OkHttpClient ollamaHttpClient, PhotoSearchProperties props) {
        return new OllamaDescriptionAdapter(ollamaHttpClient, props.getOllama().getUrl(),
                props.getOllama().getVisionModel());
    }

    @Bean
    ModelCatalogPort models(PhotoSearchProperties props) {
        SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout((int) props.getOllama().getConnectTimeout().toMillis());
        rf.setReadTimeout((int) props.getOllama().getReadTimeout().toMillis());
        return new OllamaModelsService(new RestTemplate(rf), props.getOllama().getUrl());
    }

    @Bean
    EmbeddingProvider embeddingProvider(ImageDescriptionPort describer,
                                        EmbeddingPort embedding,
                                        ModelCatalogPort models,
                                        PhotoSearchProperties props) {
        return new EmbeddingProvider(describer, embedding, models, props.getDefaultPrompt());
    }

    @Bean(initMethod = "ensureSchema")
    AspectIndexPort aspectIndex(PhotoSearchProperties props) {
        var store = props.getStore();
        if (store.getType() == PhotoSearchProperties.StoreType.MEMORY) {
            String snapshot = store.getMemory().getSnapshotPath();
            Path file = (snapshot == null || snapshot.isBlank()) ? null : Path.of(snapshot);
            log.info("Using in-memory aspect index (snapshot={})", file);
            return new InMemoryAspectIndexAdapter(file);
        }
        var w = store.getWeaviate();
        log.info("Using Weaviate aspect index at {} (class={})", w.getUrl(), w.getClassName());
        OkHttpClient http = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(30))
                .build();
        return new WeaviateAspectIndexAdapter(http, w.getUrl(), w.getApiKey(), w.getClassName(), w.getMaxResults());
    }
}
