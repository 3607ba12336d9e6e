package org.learningjava.photosearch.infrastructure.adapter.out.ollama;

import org.learningjava.photosearch.application.port.ModelCatalogPort;
import org.learningjava.photosearch.domain.error.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.*;

public class OllamaModelsService implements ModelCatalogPort {
    private static final Logger log = LoggerFactory.getLogger(OllamaModelsService.class);

    private final RestTemplate rest;
    private final String baseUrl;

    public OllamaModelsService(RestTemplate rest, String baseUrl) {
        this.rest = rest;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public List<String> listModels() {
        // GET /api/tags returns installed models
        String url = baseUrl + "/api/tags";
        Map<?, ?> resp;
        try {
            resp = rest.getForObject(url, Map.class);
        } catch (RestClientException e) {
            log.warn("Ollama tags fetch failed ({})", e.toString());
            throw new ProviderException("Cannot list models at " + url + ": " + e.getMessage(), e);
        }

        Object data = resp == null ? null : resp.get("models");
        if (!(data instanceof List<?> list)) {
            throw new ProviderException("Unexpected /api/tags payload from " + url);
        }

        List<String> out = new ArrayList<>();
        for (Object o : list) {
            if (!(o instanceof Map<?, ?> m)) continue;
            Object name = m.get("name");          // e.g. "llava-phi3:latest"
            if (name != null) out.add(String.valueOf(name));
        }
        Collections.sort(out);
        return out;
    }
}
