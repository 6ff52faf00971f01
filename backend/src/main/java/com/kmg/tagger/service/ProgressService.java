package com.kmg.tagger.service;

import com.kmg.tagger.dto.ProgressView;
import com.kmg.tagger.repo.JobDirectoryLock;
import com.kmg.tagger.repo.ProgressStore;
import com.kmg.tagger.repo.ProgressStoreFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class ProgressService {
    private final ProgressStoreFactory storeFactory;

    public ProgressService(ProgressStoreFactory storeFactory) {
        this.storeFactory = storeFactory;
    }

    public ProgressView view(String pathStr) {
        Path path = existing(pathStr);
        ProgressStore store = storeFactory.open(path);
        return toView(path, store);
    }

    public ProgressView reset(String pathStr) {
        Path path = existing(pathStr);
        try (JobDirectoryLock ignored = storeFactory.lock(path)) {
            ProgressStore store = storeFactory.open(path);
            store.reset();
            return toView(path, store);
        }
    }

    private ProgressView toView(Path path, ProgressStore store) {
        return new ProgressView(
                storeFactory.jobDirectory(path).toString(),
                store.stateFile().toString(),
                store.stats(),
                store.failedRecords()
        );
    }

    private Path existing(String pathStr) {
        if (pathStr == null || pathStr.isBlank()) {
            throw new IllegalArgumentException("Path is required.");
        }
        Path path = Path.of(pathStr).toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Path not found: " + path);
        }
        return path;
    }
}
