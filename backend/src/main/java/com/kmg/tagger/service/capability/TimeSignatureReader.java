package com.kmg.tagger.service.capability;

import com.kmg.tagger.model.ImageItem;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Reads capture instants. Items without a usable timestamp are left out of the result.
 */
public interface TimeSignatureReader {

    Map<ImageItem, LocalDateTime> readCaptureInstants(List<ImageItem> items);

    default boolean isAvailable() {
        return true;
    }
}
