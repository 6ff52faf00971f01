package com.kmg.tagger.service.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.tagger.config.TaggerProperties;
import com.kmg.tagger.model.PreparedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ollama client. The model is resolved once (explicit setting, then the first preferred model
 * the server has, then a pull) and reused for every image of the run.
 */
public class OllamaVisionClient implements VisionInference {
    private static final Logger log = LoggerFactory.getLogger(OllamaVisionClient.class);

    private final RestClient client;
    private final RestClient pullClient;
    private final TaggerProperties.Inference settings;
    private final String modelOverride;
    private volatile String resolvedModel;

    public OllamaVisionClient(RestClient client, RestClient pullClient, TaggerProperties.Inference settings) {
        this(client, pullClient, settings, settings.getModel());
    }

    private OllamaVisionClient(RestClient client, RestClient pullClient, TaggerProperties.Inference settings,
                               String modelOverride) {
        this.client = client;
        this.pullClient = pullClient;
        this.settings = settings;
        this.modelOverride = modelOverride == null || modelOverride.isBlank() ? null : modelOverride;
    }

    @Override
    public OllamaVisionClient withModel(String model) {
        return new OllamaVisionClient(client, pullClient, settings, model);
    }

    @Override
    public boolean checkConnection() {
        try {
            client.get().uri("/api/tags").retrieve().toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            log.debug("Connection check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void ensureReady() {
        requireModel();
    }

    @Override
    public void warmUp() {
        String model = requireModel();
        long start = System.currentTimeMillis();
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", model);
            payload.put("prompt", "");
            payload.put("stream", false);
            client.post().uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Model {} loaded in {} ms", model, System.currentTimeMillis() - start);
        } catch (RestClientException e) {
            log.warn("Warm-up failed for {}: {}", model, e.getMessage());
        }
    }

    @Override
    public String analyze(PreparedImage image, String prompt) {
        String model = requireModel();

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", settings.getTemperature());
        options.put("num_predict", settings.getMaxTokens());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", prompt);
        payload.put("images", List.of(image.base64Data()));
        payload.put("stream", false);
        payload.put("options", options);

        try {
            JsonNode body = client.post().uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw new InferenceFailedException("Inference failed: HTTP " + response.getStatusCode().value());
                    })
                    .body(JsonNode.class);
            return body == null ? "" : body.path("response").asText("");
        } catch (InferenceFailedException e) {
            throw e;
        } catch (RestClientException e) {
            throw new InferenceFailedException("Connection failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        String model = resolvedModel != null ? resolvedModel : modelOverride;
        return "ollama" + (model == null ? "" : " (" + model + ")");
    }

    String requireModel() {
        String model = resolveModel();
        if (model != null) {
            return model;
        }
        String toPull = settings.getPreferredModels().get(0);
        if (pull(toPull)) {
            resolvedModel = toPull;
            return toPull;
        }
        throw new InferenceUnavailableException("No vision model available");
    }

    String resolveModel() {
        String cached = resolvedModel;
        if (cached != null) {
            return cached;
        }
        if (modelOverride != null) {
            resolvedModel = modelOverride;
            return modelOverride;
        }

        Set<String> available = listModels();
        for (String preferred : settings.getPreferredModels()) {
            if (available.contains(preferred)) {
                log.info("Using vision model: {}", preferred);
                resolvedModel = preferred;
                return preferred;
            }
            String base = preferred.split(":", 2)[0];
            for (String name : available) {
                if (name.startsWith(base)) {
                    log.info("Using vision model: {}", name);
                    resolvedModel = name;
                    return name;
                }
            }
        }
        log.warn("No vision model found. Available: {}", available);
        return null;
    }

    private Set<String> listModels() {
        Set<String> names = new LinkedHashSet<>();
        try {
            JsonNode body = client.get().uri("/api/tags").retrieve().body(JsonNode.class);
            if (body != null) {
                for (JsonNode model : body.path("models")) {
                    String name = model.path("name").asText("");
                    if (!name.isEmpty()) {
                        names.add(name);
                    }
                }
            }
        } catch (RestClientException e) {
            log.error("Failed to list models: {}", e.getMessage());
        }
        return names;
    }

    private boolean pull(String model) {
        log.info("Vision model not found. Pulling {}...", model);
        try {
            JsonNode body = pullClient.post().uri("/api/pull")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("name", model, "stream", false))
                    .retrieve()
                    .body(JsonNode.class);
            if (body != null && body.hasNonNull("status")) {
                log.info("  {}", body.get("status").asText());
            }
            return true;
        } catch (RestClientException e) {
            log.error("Failed to pull model: {}", e.getMessage());
            return false;
        }
    }
}
