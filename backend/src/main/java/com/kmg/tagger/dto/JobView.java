package com.kmg.tagger.dto;

import com.kmg.tagger.model.JobStatus;

public record JobView(
        String id,
        String inputPath,
        JobStatus status,
        String createdAt,
        String startedAt,
        String endedAt,
        int totalImages,
        int processedImages,
        int successful,
        int failed,
        int noSubject,
        int skipped,
        int sequences,
        String lastError
) {
}
