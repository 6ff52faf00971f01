package com.kmg.tagger.model;

import java.util.List;

/**
 * Terminal outcome of one image in a pipeline run.
 */
public record ItemResult(
        ImageItem item,
        boolean success,
        List<String> keywords,
        String error,
        double inferenceTime,
        boolean subjectDetected,
        String targetPath,
        VehicleMetadata metadata
) {
    public ItemResult {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static ItemResult success(ImageItem item, List<String> keywords, double inferenceTime,
                                     boolean subjectDetected, String targetPath, VehicleMetadata metadata) {
        return new ItemResult(item, true, keywords, null, inferenceTime, subjectDetected, targetPath, metadata);
    }

    public static ItemResult failure(ImageItem item, String error, double inferenceTime) {
        return new ItemResult(item, false, List.of(), error, inferenceTime, false, null, null);
    }
}
