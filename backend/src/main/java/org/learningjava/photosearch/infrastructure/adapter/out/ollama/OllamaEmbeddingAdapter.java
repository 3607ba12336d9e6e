package org.learningjava.photosearch.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.learningjava.photosearch.application.port.EmbeddingPort;
import org.learningjava.photosearch.domain.error.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class OllamaEmbeddingAdapter implements EmbeddingPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final String model;

    public OllamaEmbeddingAdapter(String baseUrl, String model) {
        this(new OkHttpClient(), baseUrl, model);
    }

    public OllamaEmbeddingAdapter(OkHttpClient http, String baseUrl, String model) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
    }

    private static String preview(String text) {
        return text.replace("\n", " ").substring(0, Math.min(40, text.length()));
    }

    @Override public String model() { return model; }

    @Override public float[] embed(String text) { return embedOne(text); }

    private float[] embedOne(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        long t0 = System.nanoTime();
        try {
            ObjectNode body = om.createObjectNode();
            body.put("model", model);
            body.put("prompt", text); // Ollama expects "prompt"

            Request req = new Request.Builder()
                    .url(baseUrl + "/api/embeddings")
                    .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                    .build();

            try (Response resp = http.newCall(req).execute()) {
                long latencyMs = Math.max(1L, Math.round((System.nanoTime() - t0) / 1_000_000.0));

                if (!resp.isSuccessful()) {
                    String b = resp.body() != null ? resp.body().string() : "";
                    log.warn("Ollama embed failed: HTTP {} {}", resp.code(), resp.message());
                    throw new IOException("HTTP " + resp.code() + " - " + resp.message() + " | body=" + b);
                }
                String s = resp.body() != null ? resp.body().string() : "{}";
                if (log.isDebugEnabled()) log.debug("Ollama raw embedding response: {}", preview(s));

                JsonNode json = om.readTree(s);
                float[] v;

                if (json.has("embedding")) {
                    v = toFloatArray(json.get("embedding"));
                } else if (json.has("embeddings") && json.get("embeddings").isArray() && json.get("embeddings").size() > 0) {
                    JsonNode first = json.get("embeddings").get(0);
                    v = first.isArray()
                            ? toFloatArray(first)
                            : toFloatArray(first.get("embedding"));
                } else {
                    log.warn("Unexpected embeddings payload from Ollama: {}", preview(s));
                    throw new IOException("Unexpected embeddings payload from Ollama");
                }
                if (v.length == 0) {
                    throw new IOException("Ollama returned an empty embedding");
                }

                log.debug("Embedding dim={} in {} ms for text preview='{}...'", v.length, latencyMs, preview(text));
                return v;
            }
        } catch (IOException e) {
            log.error("Embedding failed for model '{}' at {}: {}", model, baseUrl, e.getMessage());
            throw new ProviderException("Embedding failed for model '" + model + "' at " + baseUrl +
                    ": " + e.getMessage(), e);
        }
    }

    private float[] toFloatArray(JsonNode arr) throws IOException {
        if (arr == null || !arr.isArray()) throw new IOException("Expected numeric array, got: " + arr);
        float[] v = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) {
            JsonNode n = arr.get(i);
            if (!n.isNumber()) throw new IOException("Non-numeric embedding component at " + i + ": " + n);
            v[i] = (float) n.asDouble();
        }
        return v;
    }
}
