package com.kmg.tagger.dto;

public record FolderStatsResponse(
        String path,
        int imageCount,
        int rawCount
) {
}
