package com.kmg.tagger.dto;

import java.util.List;

public record SequenceView(
        String id,
        List<String> frames,
        List<String> timestamps,
        List<Double> sharpnessScores,
        int bestFrameIndex,
        String bestFrame
) {
}
