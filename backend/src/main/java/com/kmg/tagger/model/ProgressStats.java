package com.kmg.tagger.model;

public record ProgressStats(
        int processedCount,
        int failedCount,
        int totalProcessed,
        int totalFailed,
        double totalTime,
        double avgTime
) {
}
