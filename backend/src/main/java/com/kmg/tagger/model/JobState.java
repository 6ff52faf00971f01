package com.kmg.tagger.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The whole progress file. Read and written as one unit.
 */
public class JobState {
    public static final int SCHEMA_VERSION = 1;

    private int version = SCHEMA_VERSION;
    private String created;
    private String updated;
    private Map<String, ProgressRecord> processed = new LinkedHashMap<>();
    private Map<String, ProgressRecord> failed = new LinkedHashMap<>();
    private Stats stats = new Stats();

    public static JobState empty(String createdAt) {
        JobState state = new JobState();
        state.setCreated(createdAt);
        return state;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public String getCreated() {
        return created;
    }

    public void setCreated(String created) {
        this.created = created;
    }

    public String getUpdated() {
        return updated;
    }

    public void setUpdated(String updated) {
        this.updated = updated;
    }

    public Map<String, ProgressRecord> getProcessed() {
        return processed;
    }

    public void setProcessed(Map<String, ProgressRecord> processed) {
        this.processed = processed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(processed);
    }

    public Map<String, ProgressRecord> getFailed() {
        return failed;
    }

    public void setFailed(Map<String, ProgressRecord> failed) {
        this.failed = failed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(failed);
    }

    public Stats getStats() {
        return stats;
    }

    public void setStats(Stats stats) {
        this.stats = stats == null ? new Stats() : stats;
    }

    public static class Stats {
        private int totalProcessed;
        private int totalFailed;
        private double totalTime;

        public int getTotalProcessed() {
            return totalProcessed;
        }

        public void setTotalProcessed(int totalProcessed) {
            this.totalProcessed = totalProcessed;
        }

        public int getTotalFailed() {
            return totalFailed;
        }

        public void setTotalFailed(int totalFailed) {
            this.totalFailed = totalFailed;
        }

        public double getTotalTime() {
            return totalTime;
        }

        public void setTotalTime(double totalTime) {
            this.totalTime = totalTime;
        }
    }
}
