package org.learningjava.photosearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Everything the components need, bound once from {@code photosearch.*} and passed in by {@link AppConfig}.
 */
@Component
@ConfigurationProperties(prefix = "photosearch")
public class PhotoSearchProperties {

    public enum StoreType { WEAVIATE, MEMORY }

    private final Ollama ollama = new Ollama();
    private final Indexing indexing = new Indexing();
    private final Search search = new Search();
    private final Store store = new Store();
    private String defaultPrompt = "Describe this image in detail:";

    public Ollama getOllama() { return ollama; }
    public Indexing getIndexing() { return indexing; }
    public Search getSearch() { return search; }
    public Store getStore() { return store; }
    public String getDefaultPrompt() { return defaultPrompt; }
    public void setDefaultPrompt(String v) { this.defaultPrompt = v; }

    public static class Ollama {
        private String url = "http://localhost:11434";
        private String visionModel = "llava-phi3:latest";
        private String embeddingModel;                // null = same as visionModel
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofMinutes(3);

        public String getUrl() { return url; }
        public void setUrl(String v) { this.url = v; }
        public String getVisionModel() { return visionModel; }
        public void setVisionModel(String v) { this.visionModel = v; }
        public String getEmbeddingModel() {
            return (embeddingModel == null || embeddingModel.isBlank()) ? visionModel : embeddingModel;
        }
        public void setEmbeddingModel(String v) { this.embeddingModel = v; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration v) { this.connectTimeout = v; }
        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration v) { this.readTimeout = v; }
    }

    public static class Indexing {
        private int concurrency = 4;
        private boolean skipExisting = false;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int v) { this.concurrency = v; }
        public boolean isSkipExisting() { return skipExisting; }
        public void setSkipExisting(boolean v) { this.skipExisting = v; }
    }

    public static class Search {
        private int defaultK = 5;

        public int getDefaultK() { return defaultK; }
        public void setDefaultK(int v) { this.defaultK = v; }
    }

    public static class Store {
        private StoreType type = StoreType.WEAVIATE;
        private final Weaviate weaviate = new Weaviate();
        private final Memory memory = new Memory();

        public StoreType getType() { return type; }
        public void setType(StoreType v) { this.type = v; }
        public Weaviate getWeaviate() { return weaviate; }
        public Memory getMemory() { return memory; }
    }

    public static class Weaviate {
        private String url = "http://localhost:8080";
        private String apiKey = "";
        private String className = "PhotoAspect";
        private int maxResults = 10_000;   // must not exceed the server's QUERY_MAXIMUM_RESULTS

        public String getUrl() { return url; }
        public void setUrl(String v) { this.url = v; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String v) { this.apiKey = v; }
        public String getClassName() { return className; }
        public void setClassName(String v) { this.className = v; }
        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int v) { this.maxResults = v; }
    }

    public static class Memory {
        private String snapshotPath;   // null or blank = no persistence

        public String getSnapshotPath() { return snapshotPath; }
        public void setSnapshotPath(String v) { this.snapshotPath = v; }
    }
}
