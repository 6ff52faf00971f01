package com.kmg.tagger.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.tagger.config.TaggerProperties;
import org.springframework.stereotype.Repository;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the progress file that belongs to a job directory: the input folder itself, or the
 * parent folder when the input is a single file.
 */
@Repository
public class ProgressStoreFactory {
    private final TaggerProperties properties;
    private final ObjectMapper objectMapper;

    public ProgressStoreFactory(TaggerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ProgressStore open(Path inputPath) {
        return new ProgressStore(jobDirectory(inputPath).resolve(properties.getProgress().getFileName()), objectMapper);
    }

    public Path jobDirectory(Path inputPath) {
        Path normalized = inputPath.toAbsolutePath().normalize();
        if (Files.isRegularFile(normalized) && normalized.getParent() != null) {
            return normalized.getParent();
        }
        return normalized;
    }

    public JobDirectoryLock lock(Path inputPath) {
        return JobDirectoryLock.acquire(jobDirectory(inputPath).resolve(properties.getProgress().getLockFileName()));
    }
}
