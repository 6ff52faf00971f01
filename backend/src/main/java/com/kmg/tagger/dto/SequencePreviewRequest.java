package com.kmg.tagger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

public record SequencePreviewRequest(
        @NotBlank String path,
        @DecimalMin("0.0") Double thresholdSeconds,
        boolean scoreSharpness
) {
}
