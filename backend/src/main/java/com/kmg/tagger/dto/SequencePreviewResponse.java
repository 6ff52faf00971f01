package com.kmg.tagger.dto;

import java.util.List;

public record SequencePreviewResponse(
        int imageCount,
        int sequenceCount,
        int framesInSequences,
        List<SequenceView> sequences,
        String preview
) {
}
