package com.kmg.tagger.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.JobState;
import com.kmg.tagger.model.ProgressRecord;
import com.kmg.tagger.model.ProgressStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Progress of one job directory, kept in a single JSON file. Every mutating call rewrites the
 * whole file before it returns, so a crash never loses an item that was already recorded.
 * <p>
 * One instance owns the file for the lifetime of a run; concurrent writers are not supported.
 */
public class ProgressStore {
    private static final Logger log = LoggerFactory.getLogger(ProgressStore.class);

    private final Path stateFile;
    private final ObjectMapper objectMapper;
    private JobState state;

    public ProgressStore(Path stateFile, ObjectMapper objectMapper) {
        this.stateFile = stateFile.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.state = load();
    }

    public Path stateFile() {
        return stateFile;
    }

    public synchronized boolean isProcessed(ImageItem item) {
        return isProcessed(item, true);
    }

    public synchronized boolean isProcessed(ImageItem item, boolean verifySignature) {
        ProgressRecord entry = state.getProcessed().get(item.key());
        if (entry == null) {
            return false;
        }
        if (verifySignature) {
            String current = item.contentSignature();
            if (current.isEmpty()) {
                log.debug("Cannot read file, treating as unprocessed: {}", item.key());
                return false;
            }
            if (!current.equals(entry.signature())) {
                log.debug("File changed since processing: {}", item.key());
                return false;
            }
        }
        return true;
    }

    public synchronized void markProcessed(ImageItem item, List<String> keywords, double inferenceTime,
                                           Map<String, Object> metadata) {
        String key = item.key();
        state.getProcessed().put(key, ProgressRecord.processed(
                item.path().toString(),
                item.contentSignature(),
                StateTime.nowText(),
                keywords,
                inferenceTime,
                metadata
        ));

        JobState.Stats stats = state.getStats();
        stats.setTotalProcessed(stats.getTotalProcessed() + 1);
        stats.setTotalTime(stats.getTotalTime() + inferenceTime);

        if (state.getFailed().remove(key) != null) {
            stats.setTotalFailed(stats.getTotalFailed() - 1);
        }

        save();
    }

    public synchronized void markFailed(ImageItem item, String error) {
        String key = item.key();
        ProgressRecord previous = state.getFailed().get(key);
        int attempts = previous == null ? 1 : previous.attemptCount() + 1;
        state.getProcessed().remove(key);
        state.getFailed().put(key, ProgressRecord.failed(item.path().toString(), StateTime.nowText(), error, attempts));

        JobState.Stats stats = state.getStats();
        stats.setTotalFailed(stats.getTotalFailed() + 1);

        save();
    }

    public synchronized void reset() {
        state = JobState.empty(StateTime.nowText());
        save();
        log.info("Progress tracking reset for {}", stateFile);
    }

    public synchronized ProgressStats stats() {
        JobState.Stats stats = state.getStats();
        double avg = stats.getTotalProcessed() > 0 ? stats.getTotalTime() / stats.getTotalProcessed() : 0.0;
        return new ProgressStats(
                state.getProcessed().size(),
                state.getFailed().size(),
                stats.getTotalProcessed(),
                stats.getTotalFailed(),
                stats.getTotalTime(),
                avg
        );
    }

    public synchronized Map<String, ProgressRecord> failedRecords() {
        return new LinkedHashMap<>(state.getFailed());
    }

    public synchronized Map<String, List<String>> processedKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        state.getProcessed().forEach((key, entry) ->
                keywords.put(key, entry.keywords() == null ? List.of() : entry.keywords()));
        return keywords;
    }

    public synchronized ProgressRecord processedRecord(String key) {
        return state.getProcessed().get(key);
    }

    public synchronized ProgressRecord failedRecord(String key) {
        return state.getFailed().get(key);
    }

    public synchronized String report() {
        ProgressStats stats = stats();
        List<String> lines = new ArrayList<>();
        lines.add("=".repeat(50));
        lines.add("Processing Progress Report");
        lines.add("=".repeat(50));
        lines.add("Processed: " + stats.processedCount() + " images");
        lines.add("Failed: " + stats.failedCount() + " images");
        lines.add(String.format("Total time: %.1f seconds", stats.totalTime()));
        lines.add(String.format("Average time per image: %.1f seconds", stats.avgTime()));
        if (!state.getFailed().isEmpty()) {
            lines.add("");
            lines.add("Failed images:");
            state.getFailed().forEach((key, entry) -> lines.add("  - " + key + ": " + entry.error()));
        }
        return String.join("\n", lines);
    }

    private JobState load() {
        if (Files.exists(stateFile)) {
            try {
                JobState loaded = objectMapper.readValue(stateFile.toFile(), JobState.class);
                if (loaded == null) {
                    throw new IOException("Progress file is empty");
                }
                log.debug("Loaded progress: {} images", loaded.getProcessed().size());
                return loaded;
            } catch (IOException e) {
                log.warn("Failed to load progress file {}, starting fresh: {}", stateFile, e.getMessage());
            }
        }
        return JobState.empty(StateTime.nowText());
    }

    private void save() {
        state.setUpdated(StateTime.nowText());
        Path temp = null;
        try {
            Path parent = stateFile.getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, stateFile.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            try {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ProgressStoreException("Failed to save progress to " + stateFile, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.debug("Could not remove temporary progress file {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    public static class ProgressStoreException extends RuntimeException {
        public ProgressStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
