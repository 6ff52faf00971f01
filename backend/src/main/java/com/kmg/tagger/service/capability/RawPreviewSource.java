package com.kmg.tagger.service.capability;

import com.kmg.tagger.model.ImageItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Pulls the embedded JPEG out of a RAW file, best quality first.
 */
@Component
public class RawPreviewSource {
    private static final Logger log = LoggerFactory.getLogger(RawPreviewSource.class);
    private static final List<String> PREVIEW_TAGS = List.of("-JpgFromRaw", "-OtherImage", "-PreviewImage");
    static final int MIN_PREVIEW_BYTES = 10_000;

    private final ExiftoolRunner exiftool;

    public RawPreviewSource(ExiftoolRunner exiftool) {
        this.exiftool = exiftool;
    }

    public boolean isAvailable() {
        return exiftool.isAvailable();
    }

    public Optional<byte[]> extract(ImageItem item) {
        if (!exiftool.isAvailable()) {
            return Optional.empty();
        }
        for (String tag : PREVIEW_TAGS) {
            try {
                ExiftoolRunner.ExiftoolResult result = exiftool.run(List.of(tag, "-b", item.path().toString()));
                if (result.exitCode() == 0 && result.stdout().length > MIN_PREVIEW_BYTES) {
                    log.debug("Extracted {} byte preview ({}) from {}", result.stdout().length, tag, item.name());
                    return Optional.of(result.stdout());
                }
            } catch (IOException e) {
                log.warn("Failed to extract {} from {}: {}", tag, item.name(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}
