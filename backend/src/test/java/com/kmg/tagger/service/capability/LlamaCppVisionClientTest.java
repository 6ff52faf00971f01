package com.kmg.tagger.service.capability;

import com.kmg.tagger.config.TaggerProperties;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.PreparedImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LlamaCppVisionClientTest {
    private MockRestServiceServer server;
    private LlamaCppVisionClient client;

    @BeforeEach
    void setup() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://llama");
        server = MockRestServiceServer.bindTo(builder).build();
        TaggerProperties.Inference settings = new TaggerProperties.Inference();
        settings.setMaxTokens(256);
        client = new LlamaCppVisionClient(builder.build(), settings);
    }

    @Test
    void analyzeReferencesImageSlotInPrompt() {
        server.expect(requestTo("http://llama/completion"))
                .andExpect(jsonPath("$.prompt").value("[img-1]\nWhat car is this?"))
                .andExpect(jsonPath("$.image_data[0].data").value("QUJD"))
                .andExpect(jsonPath("$.image_data[0].id").value(1))
                .andExpect(jsonPath("$.n_predict").value(256))
                .andRespond(withSuccess("{\"content\": \"Make: Porsche\"}", MediaType.APPLICATION_JSON));

        String answer = client.analyze(new PreparedImage(ImageItem.of(Path.of("a.jpg")), "QUJD", 3),
                "What car is this?");

        assertThat(answer).isEqualTo("Make: Porsche");
        server.verify();
    }

    @Test
    void healthEndpointDecidesConnection() {
        server.expect(requestTo("http://llama/health")).andRespond(withSuccess());

        assertThat(client.checkConnection()).isTrue();
    }

    @Test
    void unreachableServerFailsInference() {
        server.expect(requestTo("http://llama/completion")).andRespond(withException(new IOException("refused")));

        assertThatThrownBy(() -> client.analyze(new PreparedImage(ImageItem.of(Path.of("a.jpg")), "QUJD", 3), "p"))
                .isInstanceOf(VisionInference.InferenceFailedException.class);
    }
}
