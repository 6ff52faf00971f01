package com.kmg.tagger.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Durable state of one image in the progress file. Processed entries carry the signature,
 * keywords and timing; failed entries carry the error and attempt count.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressRecord(
        String path,
        String signature,
        String processedAt,
        List<String> keywords,
        Double inferenceTime,
        Map<String, Object> metadata,
        String failedAt,
        String error,
        Integer attempts
) {
    public static ProgressRecord processed(String path, String signature, String processedAt,
                                           List<String> keywords, double inferenceTime, Map<String, Object> metadata) {
        return new ProgressRecord(
                path,
                signature,
                processedAt,
                keywords == null ? List.of() : List.copyOf(keywords),
                inferenceTime,
                metadata == null ? Map.of() : metadata,
                null,
                null,
                null
        );
    }

    public static ProgressRecord failed(String path, String failedAt, String error, int attempts) {
        return new ProgressRecord(path, null, null, null, null, null, failedAt, error, attempts);
    }

    public int attemptCount() {
        return attempts == null ? 0 : attempts;
    }
}
