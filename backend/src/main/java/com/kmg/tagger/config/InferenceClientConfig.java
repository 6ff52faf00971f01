package com.kmg.tagger.config;

import com.kmg.tagger.service.capability.LlamaCppVisionClient;
import com.kmg.tagger.service.capability.OllamaVisionClient;
import com.kmg.tagger.service.capability.VisionInference;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class InferenceClientConfig {

    @Bean
    public VisionInference visionInference(TaggerProperties properties, RestClient.Builder builder) {
        TaggerProperties.Inference inference = properties.getInference();
        RestClient client = build(builder, inference.getServerUrl(), Duration.ofSeconds(inference.getTimeoutSeconds()));

        return switch (inference.getBackend()) {
            case OLLAMA -> new OllamaVisionClient(
                    client,
                    build(builder, inference.getServerUrl(), Duration.ofSeconds(inference.getPullTimeoutSeconds())),
                    inference
            );
            case LLAMA_CPP -> new LlamaCppVisionClient(client, inference);
        };
    }

    private RestClient build(RestClient.Builder builder, String baseUrl, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        requestFactory.setReadTimeout(readTimeout);
        return builder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
