package com.kmg.tagger.dto;

import com.kmg.tagger.model.ProgressRecord;
import com.kmg.tagger.model.ProgressStats;

import java.util.Map;

public record ProgressView(
        String jobDirectory,
        String stateFile,
        ProgressStats stats,
        Map<String, ProgressRecord> failed
) {
}
