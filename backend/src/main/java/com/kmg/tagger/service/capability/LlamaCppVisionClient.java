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
import java.util.List;
import java.util.Map;

/**
 * llama.cpp server with a multimodal model loaded ({@code /completion}).
 */
public class LlamaCppVisionClient implements VisionInference {
    private static final Logger log = LoggerFactory.getLogger(LlamaCppVisionClient.class);

    private final RestClient client;
    private final TaggerProperties.Inference settings;

    public LlamaCppVisionClient(RestClient client, TaggerProperties.Inference settings) {
        this.client = client;
        this.settings = settings;
    }

    @Override
    public boolean checkConnection() {
        try {
            client.get().uri("/health").retrieve().toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            log.debug("Connection check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void warmUp() {
        log.debug("llama.cpp server keeps its model loaded; warm-up skipped.");
    }

    @Override
    public String analyze(PreparedImage image, String prompt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", "[img-1]\n" + prompt);
        payload.put("image_data", List.of(Map.of("data", image.base64Data(), "id", 1)));
        payload.put("temperature", settings.getTemperature());
        payload.put("n_predict", settings.getMaxTokens());

        try {
            JsonNode body = client.post().uri("/completion")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw new InferenceFailedException("Inference failed: HTTP " + response.getStatusCode().value());
                    })
                    .body(JsonNode.class);
            return body == null ? "" : body.path("content").asText("");
        } catch (InferenceFailedException e) {
            throw e;
        } catch (RestClientException e) {
            throw new InferenceFailedException("Connection failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "llama.cpp (" + settings.getServerUrl() + ")";
    }
}
