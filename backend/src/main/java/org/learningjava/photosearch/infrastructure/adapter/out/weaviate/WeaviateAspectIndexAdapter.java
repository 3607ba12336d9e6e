package org.learningjava.photosearch.infrastructure.adapter.out.weaviate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.learningjava.photosearch.application.port.AspectIndexPort;
import org.learningjava.photosearch.domain.error.StoreException;
import org.learningjava.photosearch.domain.model.photo.EntryId;
import org.learningjava.photosearch.domain.model.photo.PhotoRecord;
import org.learningjava.photosearch.domain.model.photo.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Aspect index stored as one Weaviate class with vectorizer {@code none}.
 * Object ids are {@link EntryId}s, so a batch write with the same key replaces the object.
 * Weaviate itself rejects vectors whose length differs from the existing ones.
 */
public class WeaviateAspectIndexAdapter implements AspectIndexPort {

    private static final Logger log = LoggerFactory.getLogger(WeaviateAspectIndexAdapter.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    static final String SCHEMA_RESOURCE = "weaviate.photo.schema.json";
    private static final int PAGE_SIZE = 500;
    private static final int MAX_ASPECTS_PER_PHOTO = 1000;
    public static final int DEFAULT_MAX_RESULTS = 10_000;   // Weaviate's QUERY_MAXIMUM_RESULTS default

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    private final String baseUrl;     // e.g. http://localhost:8080
    private final String apiKey;      // optional
    private final String className;   // e.g. "PhotoAspect"
    private final int maxResults;     // upper bound for a query's limit

    public WeaviateAspectIndexAdapter(OkHttpClient http, String baseUrl, String apiKey, String className) {
        this(http, baseUrl, apiKey, className, DEFAULT_MAX_RESULTS);
    }

    public WeaviateAspectIndexAdapter(OkHttpClient http, String baseUrl, String apiKey, String className,
                                      int maxResults) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be >= 1");
        }
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.className = className;
        this.maxResults = maxResults;
    }

    // ---------- PORT IMPLEMENTATION ----------

    @Override
    public void ensureSchema() {
        JsonNode desired = desiredClass();
        JsonNode live = requestOrNull("GET", "/v1/schema/" + className, null);
        if (live == null) {
            log.warn("Weaviate class '{}' missing → creating", className);
            request("POST", "/v1/schema", desired);
            return;
        }
        if (!normalizeClass(desired).equals(normalizeClass(live))) {
            log.warn("Weaviate class '{}' differs → dropping & recreating", className);
            request("DELETE", "/v1/schema/" + className, null);
            request("POST", "/v1/schema", desired);
        } else {
            log.info("Weaviate class '{}' is up to date", className);
        }
    }

    @Override
    public void upsert(String photoPath, String aspectName, float[] embedding, String description) {
        if (embedding == null || embedding.length == 0) {
            throw new StoreException("Refusing to store an empty embedding for " + photoPath + " [" + aspectName + "]");
        }
        EntryId id = EntryId.of(photoPath, aspectName);

        ObjectNode obj = om.createObjectNode();
        obj.put("class", className);
        obj.put("id", id.value());

        ObjectNode props = om.createObjectNode();
        props.put("photoPath", photoPath);
        props.put("aspectName", aspectName);
        props.put("description", description == null ? "" : description);
        obj.set("properties", props);
        obj.set("vector", floatArray(embedding));

        ArrayNode objects = om.createArrayNode().add(obj);
        ObjectNode body = om.createObjectNode();
        body.set("objects", objects);

        JsonNode resp = request("POST", "/v1/batch/objects", body);
        String error = firstBatchError(resp);
        if (error != null) {
            throw new StoreException("Weaviate rejected " + photoPath + " [" + aspectName + "]: " + error);
        }
        log.debug("Upserted {} [{}] as {}", photoPath, aspectName, id);
    }

    @Override
    public List<SearchResult> query(float[] embedding, int k, String aspectFilter) {
        if (k <= 0) return List.of();
        int limit = Math.min(k, maxResults);

        String where = aspectFilter == null ? "" : "where: " + equalFilter("aspectName", aspectFilter) + ",";
        String gql = """
                {
                  Get {
                    %s(
                      %s
                      nearVector: { vector: %s },
                      limit: %d
                    ) {
                      photoPath
                      aspectName
                      description
                      _additional { distance }
                    }
                  }
                }""".formatted(className, where, toJsonArray(embedding), limit);

        List<SearchResult> out = new ArrayList<>();
        for (JsonNode n : graphQlGet(gql)) {
            out.add(new SearchResult(
                    n.path("photoPath").asText(),
                    n.path("aspectName").asText(),
                    n.path("_additional").path("distance").asDouble(0.0),
                    n.path("description").asText("")
            ));
        }
        out.sort(SearchResult.BY_DISTANCE);
        return out;
    }

    @Override
    public int delete(String photoPath, String aspectName) {
        if (aspectName != null) {
            String id = EntryId.of(photoPath, aspectName).value();
            JsonNode resp = requestOrNull("DELETE", "/v1/objects/" + className + "/" + id, null);
            return resp == null ? 0 : 1;
        }

        ObjectNode match = om.createObjectNode();
        match.put("class", className);
        match.set("where", whereEqual("photoPath", photoPath));
        ObjectNode body = om.createObjectNode();
        body.set("match", match);
        body.put("output", "minimal");

        JsonNode resp = request("DELETE", "/v1/batch/objects", body);
        JsonNode results = resp.path("results");
        if (results.path("failed").asInt(0) > 0) {
            throw new StoreException("Weaviate failed to delete " + results.path("failed").asInt()
                    + " aspect(s) of " + photoPath);
        }
        return results.path("successful").asInt(0);
    }

    @Override
    public boolean contains(String photoPath, String aspectName) {
        String id = EntryId.of(photoPath, aspectName).value();
        return requestOrNull("GET", "/v1/objects/" + className + "/" + id, null) != null;
    }

    @Override
    public List<PhotoRecord> findByPhoto(String photoPath) {
        String gql = """
                {
                  Get {
                    %s(
                      where: %s,
                      limit: %d
                    ) {
                      photoPath
                      aspectName
                      description
                      _additional { vector }
                    }
                  }
                }""".formatted(className, equalFilter("photoPath", photoPath), MAX_ASPECTS_PER_PHOTO);

        List<PhotoRecord> out = new ArrayList<>();
        for (JsonNode n : graphQlGet(gql)) {
            out.add(new PhotoRecord(
                    n.path("photoPath").asText(),
                    n.path("aspectName").asText(),
                    n.path("description").asText(""),
                    readVector(n.path("_additional").path("vector"))
            ));
        }
        out.sort(Comparator.comparing(PhotoRecord::aspectName));
        return out;
    }

    @Override
    public Set<String> listPhotoPaths() {
        Set<String> paths = new TreeSet<>();
        String after = null;
        while (true) {
            String cursor = after == null ? "" : "after: " + quote(after) + ",";
            String gql = """
                    {
                      Get {
                        %s(
                          %s
                          limit: %d
                        ) {
                          photoPath
                          _additional { id }
                        }
                      }
                    }""".formatted(className, cursor, PAGE_SIZE);

            List<JsonNode> page = graphQlGet(gql);
            for (JsonNode n : page) paths.add(n.path("photoPath").asText());
            if (page.size() < PAGE_SIZE) break;
            after = page.get(page.size() - 1).path("_additional").path("id").asText();
        }
        return paths;
    }

    @Override
    public long count() {
        String gql = "{ Aggregate { %s { meta { count } } } }".formatted(className);
        JsonNode resp = graphQl(gql);
        JsonNode arr = resp.path("data").path("Aggregate").path(className);
        if (!arr.isArray() || arr.isEmpty()) return 0L;
        return arr.get(0).path("meta").path("count").asLong(0L);
    }

    @Override
    public void clear() {
        log.warn("Clearing Weaviate class '{}'", className);
        requestOrNull("DELETE", "/v1/schema/" + className, null);
        request("POST", "/v1/schema", desiredClass());
    }

    // ---------- INTERNALS ----------

    private List<JsonNode> graphQlGet(String gql) {
        JsonNode arr = graphQl(gql).path("data").path("Get").path(className);
        List<JsonNode> out = new ArrayList<>();
        if (arr.isArray()) arr.forEach(out::add);
        return out;
    }

    private JsonNode graphQl(String gql) {
        ObjectNode body = om.createObjectNode().put("query", gql);
        JsonNode resp = request("POST", "/v1/graphql", body);
        JsonNode errors = resp.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new StoreException("Weaviate GraphQL error: " + errors.get(0).path("message").asText(errors.toString()));
        }
        return resp;
    }

    private String firstBatchError(JsonNode resp) {
        if (!resp.isArray()) return null;
        for (JsonNode item : resp) {
            JsonNode errs = item.path("result").path("errors").path("error");
            if (errs.isArray() && !errs.isEmpty()) {
                return errs.get(0).path("message").asText(errs.toString());
            }
        }
        return null;
    }

    private String equalFilter(String property, String value) {
        return "{ path: [\"%s\"], operator: Equal, valueText: %s }".formatted(property, quote(value));
    }

    private ObjectNode whereEqual(String property, String value) {
        ObjectNode where = om.createObjectNode();
        where.set("path", om.createArrayNode().add(property));
        where.put("operator", "Equal");
        where.put("valueText", value);
        return where;
    }

    // JSON string literals are valid GraphQL string literals
    private String quote(String value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot encode filter value: " + value, e);
        }
    }

    private JsonNode desiredClass() {
        try (var in = Thread.currentThread().getContextClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            ObjectNode root = (ObjectNode) om.readTree(in);
            root.put("class", className);
            return root;
        } catch (IOException e) {
            throw new StoreException("Cannot load " + SCHEMA_RESOURCE, e);
        }
    }

    private ObjectNode normalizeClass(JsonNode c) {
        ObjectNode out = om.createObjectNode();
        out.put("class", c.path("class").asText());
        out.put("vectorizer", c.path("vectorizer").asText("none"));

        Map<String, List<String>> props = new TreeMap<>();
        JsonNode arr = c.path("properties");
        if (arr.isArray()) {
            for (JsonNode p : arr) {
                String name = p.path("name").asText();
                List<String> types = new ArrayList<>();
                JsonNode dt = p.path("dataType");
                if (dt.isArray()) for (JsonNode t : dt) types.add(t.asText());
                props.put(name, types);
            }
        }
        ArrayNode propsArr = om.createArrayNode();
        for (var e : props.entrySet()) {
            ObjectNode pn = om.createObjectNode();
            pn.put("name", e.getKey());
            ArrayNode dts = om.createArrayNode();
            for (String t : e.getValue()) dts.add(t);
            pn.set("dataType", dts);
            propsArr.add(pn);
        }
        out.set("properties", propsArr);
        return out;
    }

    private ArrayNode floatArray(float[] v) {
        ArrayNode a = om.createArrayNode();
        for (float f : v) a.add(f);
        return a;
    }

    private float[] readVector(JsonNode arr) {
        if (arr == null || !arr.isArray()) return new float[0];
        float[] v = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) v[i] = (float) arr.get(i).asDouble();
        return v;
    }

    private String toJsonArray(float[] v) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < v.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(Double.toString(v[i]));
        }
        sb.append(']');
        return sb.toString();
    }

    private JsonNode request(String method, String path, Object body) {
        JsonNode resp = requestOrNull(method, path, body);
        if (resp == null) {
            throw new StoreException("Weaviate " + method + " " + path + " failed: 404");
        }
        return resp;
    }

    /** Same as {@link #request} but a 404 yields {@code null}. */
    private JsonNode requestOrNull(String method, String path, Object body) {
        try {
            Request.Builder b = new Request.Builder().url(baseUrl + path);
            if (apiKey != null && !apiKey.isBlank()) {
                b.addHeader("Authorization", "Bearer " + apiKey);
            }
            if (body != null) {
                byte[] json = om.writeValueAsBytes(body);
                b.method(method, RequestBody.create(json, JSON));
            } else {
                b.method(method, null);
            }

            try (Response resp = http.newCall(b.build()).execute()) {
                String respBody = resp.body() != null ? resp.body().string() : "";
                if (resp.code() == 404) {
                    return null;
                }
                if (!resp.isSuccessful()) {
                    throw new StoreException("Weaviate " + method + " " + path + " failed: " + resp.code()
                            + " body=" + respBody);
                }
                return respBody.isEmpty() ? om.createObjectNode() : om.readTree(respBody);
            }
        } catch (IOException e) {
            throw new StoreException("Weaviate " + method + " " + path + " failed: " + e.getMessage(), e);
        }
    }
}
