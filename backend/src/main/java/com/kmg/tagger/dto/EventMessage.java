package com.kmg.tagger.dto;

public record EventMessage(
        String type,
        String jobId,
        String message,
        String timestamp,
        Object payload
) {
}
