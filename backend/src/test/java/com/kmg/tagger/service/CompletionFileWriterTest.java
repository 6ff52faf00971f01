package com.kmg.tagger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionFileWriterTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void firstRunStartsTheSequence() throws Exception {
        Path file = dir.resolve("complete.json");
        CompletionFileWriter writer = new CompletionFileWriter(file, objectMapper);

        writer.write(new CompletionFileWriter.RunCounts(10, 8, 1, 1), 16.0, false);

        JsonNode data = objectMapper.readTree(file.toFile());
        assertThat(data.path("completed").asBoolean()).isTrue();
        assertThat(data.path("sequence").asInt()).isEqualTo(1);
        assertThat(data.path("dry_run").asBoolean()).isFalse();
        assertThat(data.path("stats").path("total_images").asInt()).isEqualTo(10);
        assertThat(data.path("stats").path("no_car").asInt()).isEqualTo(1);
        assertThat(data.path("stats").path("avg_time_per_image").asDouble()).isEqualTo(2.0);
    }

    @Test
    void consecutiveRunsAccumulate() throws Exception {
        Path file = dir.resolve("complete.json");
        CompletionFileWriter writer = new CompletionFileWriter(file, objectMapper);

        writer.write(new CompletionFileWriter.RunCounts(4, 4, 0, 0), 8.0, false);
        writer.write(new CompletionFileWriter.RunCounts(2, 1, 1, 0), 10.0, true);

        JsonNode data = objectMapper.readTree(file.toFile());
        assertThat(data.path("sequence").asInt()).isEqualTo(2);
        assertThat(data.path("dry_run").asBoolean()).isTrue();
        assertThat(data.path("stats").path("total_images").asInt()).isEqualTo(6);
        assertThat(data.path("stats").path("successful").asInt()).isEqualTo(5);
        assertThat(data.path("stats").path("failed").asInt()).isEqualTo(1);
        assertThat(data.path("stats").path("total_time").asDouble()).isEqualTo(10.0);
    }

    @Test
    void unreadablePreviousFileIsReplaced() throws Exception {
        Path file = dir.resolve("complete.json");
        Files.writeString(file, "{broken");
        CompletionFileWriter writer = new CompletionFileWriter(file, objectMapper);

        writer.write(new CompletionFileWriter.RunCounts(1, 1, 0, 0), 1.5, false);

        JsonNode data = objectMapper.readTree(file.toFile());
        assertThat(data.path("sequence").asInt()).isEqualTo(1);
        assertThat(data.path("stats").path("successful").asInt()).isEqualTo(1);
    }

    @Test
    void noSuccessfulImagesMeansZeroAverage() throws Exception {
        Path file = dir.resolve("nested/complete.json");
        new CompletionFileWriter(file, objectMapper).write(new CompletionFileWriter.RunCounts(3, 0, 3, 0), 0.0, false);

        assertThat(objectMapper.readTree(file.toFile()).path("stats").path("avg_time_per_image").asDouble())
                .isZero();
    }
}
