package com.kmg.tagger.service.capability;

import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.LuminanceBuffer;

import java.util.Optional;

/**
 * Produces a luminance buffer for one image, or empty when none can be decoded.
 */
public interface PixelBufferExtractor {

    Optional<LuminanceBuffer> extract(ImageItem item);

    default boolean isAvailable() {
        return true;
    }

    /**
     * Whether this extractor has what it needs for the given file's format.
     */
    default boolean isAvailableFor(ImageItem item) {
        return isAvailable();
    }
}
