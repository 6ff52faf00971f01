package com.kmg.tagger.service.capability;

import java.nio.file.Path;
import java.util.List;

/**
 * Attaches keywords to an image or its XMP sidecar. Repeating an identical call leaves the
 * target unchanged.
 */
public interface MetadataWriter {

    void write(Path target, List<String> keywords, Path sourceImage, boolean merge);

    default boolean isAvailable() {
        return true;
    }

    class MetadataWriteException extends RuntimeException {
        public MetadataWriteException(String message) {
            super(message);
        }

        public MetadataWriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
