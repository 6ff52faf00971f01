package com.kmg.tagger.service.capability;

import com.kmg.tagger.config.TaggerProperties;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.PreparedImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaVisionClientTest {
    private static final String TAGS = "http://ollama/api/tags";
    private static final String GENERATE = "http://ollama/api/generate";

    private MockRestServiceServer server;
    private MockRestServiceServer pullServer;
    private OllamaVisionClient client;
    private final PreparedImage image = new PreparedImage(ImageItem.of(Path.of("car.jpg")), "AAAA", 3);

    @BeforeEach
    void setup() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://ollama");
        RestClient.Builder pullBuilder = RestClient.builder().baseUrl("http://ollama");
        server = MockRestServiceServer.bindTo(builder).build();
        pullServer = MockRestServiceServer.bindTo(pullBuilder).build();
        client = new OllamaVisionClient(builder.build(), pullBuilder.build(), new TaggerProperties.Inference());
    }

    @Test
    void analyzeSendsImageToFirstPreferredModelTheServerHas() {
        server.expect(requestTo(TAGS))
                .andRespond(withSuccess("{\"models\": [{\"name\": \"llava:7b\"}, {\"name\": \"llama3\"}]}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(GENERATE))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("llava:7b"))
                .andExpect(jsonPath("$.images[0]").value("AAAA"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.options.num_predict").value(500))
                .andRespond(withSuccess("{\"response\": \"{\\\"car_detected\\\": true}\"}", MediaType.APPLICATION_JSON));

        String answer = client.analyze(image, "Describe the car");

        assertThat(answer).isEqualTo("{\"car_detected\": true}");
        server.verify();
    }

    @Test
    void resolvedModelIsReusedAcrossImages() {
        server.expect(requestTo(TAGS))
                .andRespond(withSuccess("{\"models\": [{\"name\": \"llava:7b\"}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(GENERATE)).andRespond(withSuccess("{\"response\": \"a\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(GENERATE)).andRespond(withSuccess("{\"response\": \"b\"}", MediaType.APPLICATION_JSON));

        assertThat(client.analyze(image, "p")).isEqualTo("a");
        assertThat(client.analyze(image, "p")).isEqualTo("b");
        server.verify();
    }

    @Test
    void taggedVariantOfPreferredModelMatchesByBaseName() {
        server.expect(requestTo(TAGS))
                .andRespond(withSuccess("{\"models\": [{\"name\": \"minicpm-v:latest\"}]}", MediaType.APPLICATION_JSON));

        assertThat(client.resolveModel()).isEqualTo("minicpm-v:latest");
    }

    @Test
    void explicitModelSkipsDiscovery() {
        OllamaVisionClient custom = client.withModel("custom-vision:1");
        server.expect(requestTo(GENERATE))
                .andExpect(jsonPath("$.model").value("custom-vision:1"))
                .andRespond(withSuccess("{\"response\": \"ok\"}", MediaType.APPLICATION_JSON));

        assertThat(custom.analyze(image, "p")).isEqualTo("ok");
        assertThat(custom.describe()).isEqualTo("ollama (custom-vision:1)");
        server.verify();
    }

    @Test
    void missingModelIsPulled() {
        server.expect(requestTo(TAGS)).andRespond(withSuccess("{\"models\": []}", MediaType.APPLICATION_JSON));
        pullServer.expect(requestTo("http://ollama/api/pull"))
                .andExpect(jsonPath("$.name").value("qwen2.5vl:7b"))
                .andRespond(withSuccess("{\"status\": \"success\"}", MediaType.APPLICATION_JSON));

        client.ensureReady();

        assertThat(client.describe()).isEqualTo("ollama (qwen2.5vl:7b)");
        pullServer.verify();
    }

    @Test
    void failedPullMeansNoModel() {
        server.expect(requestTo(TAGS)).andRespond(withSuccess("{\"models\": []}", MediaType.APPLICATION_JSON));
        pullServer.expect(requestTo("http://ollama/api/pull")).andRespond(withServerError());

        assertThatThrownBy(client::ensureReady)
                .isInstanceOf(VisionInference.InferenceUnavailableException.class)
                .hasMessageContaining("No vision model available");
    }

    @Test
    void serverErrorDuringInferenceFailsTheItem() {
        OllamaVisionClient custom = client.withModel("llava");
        server.expect(requestTo(GENERATE)).andRespond(withServerError());

        assertThatThrownBy(() -> custom.analyze(image, "p"))
                .isInstanceOf(VisionInference.InferenceFailedException.class);
    }

    @Test
    void lostConnectionDuringInferenceFailsTheItem() {
        OllamaVisionClient custom = client.withModel("llava");
        server.expect(requestTo(GENERATE)).andRespond(withException(new IOException("Connection reset")));

        assertThatThrownBy(() -> custom.analyze(image, "p"))
                .isInstanceOf(VisionInference.InferenceFailedException.class)
                .hasMessageStartingWith("Connection failed");
    }

    @Test
    void connectionCheckReportsUnreachableServer() {
        server.expect(requestTo(TAGS)).andRespond(withException(new IOException("Connection refused")));

        assertThat(client.checkConnection()).isFalse();
    }

    @Test
    void connectionCheckSucceeds() {
        server.expect(requestTo(TAGS)).andRespond(withSuccess("{\"models\": []}", MediaType.APPLICATION_JSON));

        assertThat(client.checkConnection()).isTrue();
    }
}
