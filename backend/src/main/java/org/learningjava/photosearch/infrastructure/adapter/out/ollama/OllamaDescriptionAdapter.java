package org.learningjava.photosearch.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.photosearch.application.port.ImageDescriptionPort;
import org.learningjava.photosearch.domain.error.ProviderException;
import org.learningjava.photosearch.domain.model.photo.CanonicalImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Generates a text description of an image with a vision model via {@code /api/generate}.
 * The response is streamed as NDJSON; {@code response} fragments are concatenated until {@code done}.
 */
public class OllamaDescriptionAdapter implements ImageDescriptionPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaDescriptionAdapter.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final String model;

    public OllamaDescriptionAdapter(OkHttpClient http, String baseUrl, String model) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
    }

    @Override
    public String model() { return model; }

    @Override
    public String describe(CanonicalImage image, String prompt) {
        try {
            return doGenerate(image, prompt);
        } catch (IOException e) {
            log.warn("Ollama describe failed for model '{}': {}", model, e.getMessage());
            throw new ProviderException(wrap("Ollama describe failed for model '" + model + "'", e), e);
        }
    }

    private String doGenerate(CanonicalImage image, String prompt) throws IOException {
        var body = Map.of(
                "model", model,
                "prompt", prompt,
                "images", List.of(image.base64Png()),
                "stream", true
        );

        var req = new Request.Builder()
                .url(baseUrl + "/api/generate")
                .header("Accept", "application/x-ndjson")
                .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                .build();

        long t0 = System.nanoTime();
        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                String bodyStr = resp.body() != null ? resp.body().string() : "";
                throw new IOException("HTTP " + resp.code() + " - " + resp.message() + " | body=" + bodyStr);
            }
            if (resp.body() == null) {
                throw new IOException("Empty response body");
            }

            StringBuilder text = new StringBuilder();
            boolean done = false;
            try (BufferedReader reader = new BufferedReader(resp.body().charStream())) {
                String line;
                while (!done && (line = reader.readLine()) != null) {
                    if (line.isBlank()) continue;
                    JsonNode chunk = parseLine(line);
                    if (chunk.has("error")) {
                        throw new IOException("Ollama error: " + chunk.get("error").asText());
                    }
                    text.append(chunk.path("response").asText(""));
                    done = chunk.path("done").asBoolean(false);
                }
            }

            String description = text.toString().trim();
            if (log.isDebugEnabled()) {
                long ms = Math.round((System.nanoTime() - t0) / 1_000_000.0);
                log.debug("Description from '{}' in {} ms (done={}): {} chars", model, ms, done, description.length());
            }
            if (description.isEmpty()) {
                throw new IOException("Model returned no description text");
            }
            return description;
        }
    }

    private JsonNode parseLine(String line) throws IOException {
        try {
            return om.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed NDJSON line: " + line, e);
        }
    }

    private static String wrap(String prefix, Exception e) {
        String msg = e.getMessage();
        if (msg == null) msg = e.toString();
        msg = msg.replaceAll("\\s+", " ").trim();
        return prefix + ": " + msg;
    }
}
