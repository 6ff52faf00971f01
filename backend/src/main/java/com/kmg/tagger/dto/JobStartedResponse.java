package com.kmg.tagger.dto;

public record JobStartedResponse(String jobId) {
}
