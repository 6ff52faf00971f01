package com.kmg.tagger.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.tagger.config.TaggerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the completion marker the Lightroom plugin polls for. Counts accumulate across
 * consecutive runs until the plugin removes the file; total time comes from the progress store,
 * which already accumulates.
 */
@Service
public class CompletionFileWriter {
    private static final Logger log = LoggerFactory.getLogger(CompletionFileWriter.class);

    private final Path completionFile;
    private final ObjectMapper objectMapper;

    @Autowired
    public CompletionFileWriter(TaggerProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getOutput().getCompletionFile()), objectMapper);
    }

    CompletionFileWriter(Path completionFile, ObjectMapper objectMapper) {
        this.completionFile = completionFile;
        this.objectMapper = objectMapper;
    }

    public Path completionFile() {
        return completionFile;
    }

    public void write(RunCounts run, double cumulativeTotalTime, boolean dryRun) {
        try {
            RunCounts previous = RunCounts.ZERO;
            int sequence = 1;
            if (Files.exists(completionFile)) {
                try {
                    JsonNode existing = objectMapper.readTree(completionFile.toFile());
                    sequence = existing.path("sequence").asInt(0) + 1;
                    JsonNode stats = existing.path("stats");
                    previous = new RunCounts(
                            stats.path("total_images").asInt(0),
                            stats.path("successful").asInt(0),
                            stats.path("failed").asInt(0),
                            stats.path("no_car").asInt(0));
                } catch (IOException e) {
                    log.debug("Ignoring unreadable completion file {}: {}", completionFile, e.getMessage());
                }
            }

            RunCounts total = previous.plus(run);
            double average = total.successful() > 0 ? cumulativeTotalTime / total.successful() : 0.0;

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("total_images", total.totalImages());
            stats.put("successful", total.successful());
            stats.put("failed", total.failed());
            stats.put("no_car", total.noCar());
            stats.put("avg_time_per_image", average);
            stats.put("total_time", cumulativeTotalTime);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("completed", true);
            data.put("sequence", sequence);
            data.put("timestamp", LocalDateTime.now().toString());
            data.put("stats", stats);
            data.put("dry_run", dryRun);

            if (completionFile.getParent() != null) {
                Files.createDirectories(completionFile.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(completionFile.toFile(), data);
            log.debug("Wrote completion file: {}", completionFile);
        } catch (IOException e) {
            log.warn("Failed to write completion file: {}", e.getMessage());
        }
    }

    public record RunCounts(int totalImages, int successful, int failed, int noCar) {
        static final RunCounts ZERO = new RunCounts(0, 0, 0, 0);

        RunCounts plus(RunCounts other) {
            return new RunCounts(
                    totalImages + other.totalImages,
                    successful + other.successful,
                    failed + other.failed,
                    noCar + other.noCar);
        }
    }
}
