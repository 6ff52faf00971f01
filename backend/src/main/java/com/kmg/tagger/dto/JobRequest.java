package com.kmg.tagger.dto;

import com.kmg.tagger.model.Profile;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Options of one tagging run. Unset values fall back to the application configuration.
 */
public record JobRequest(
        @NotBlank String inputPath,
        Profile profile,
        boolean fuzzyNumbers,
        String outputDir,
        boolean resume,
        boolean reset,
        boolean dryRun,
        @Min(1) Integer maxImages,
        boolean warmUp,
        boolean detectSequences,
        @DecimalMin("0.0") Double sequenceThreshold,
        boolean sequenceDryRun,
        boolean skipSequenceSharpness,
        String model
) {
    public Profile profileOrDefault() {
        return profile == null ? Profile.RACING_PORSCHE : profile;
    }
}
