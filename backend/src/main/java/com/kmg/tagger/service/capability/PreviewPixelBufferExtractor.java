package com.kmg.tagger.service.capability;

import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.LuminanceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;

/**
 * Decodes JPEG/PNG/TIFF directly with ImageIO; RAW files go through their embedded preview.
 */
@Component
public class PreviewPixelBufferExtractor implements PixelBufferExtractor {
    private static final Logger log = LoggerFactory.getLogger(PreviewPixelBufferExtractor.class);

    private final RawPreviewSource rawPreviewSource;

    public PreviewPixelBufferExtractor(RawPreviewSource rawPreviewSource) {
        this.rawPreviewSource = rawPreviewSource;
    }

    @Override
    public boolean isAvailableFor(ImageItem item) {
        return !item.isRaw() || rawPreviewSource.isAvailable();
    }

    @Override
    public Optional<LuminanceBuffer> extract(ImageItem item) {
        try {
            BufferedImage image;
            if (item.isRaw()) {
                Optional<byte[]> preview = rawPreviewSource.extract(item);
                if (preview.isEmpty()) {
                    log.warn("Could not extract preview from {}", item.name());
                    return Optional.empty();
                }
                image = ImageIO.read(new ByteArrayInputStream(preview.get()));
            } else {
                image = ImageIO.read(item.path().toFile());
            }
            if (image == null) {
                log.warn("Could not read image: {}", item.name());
                return Optional.empty();
            }
            return Optional.of(LuminanceBuffer.fromImage(image));
        } catch (IOException e) {
            log.warn("Could not decode {}: {}", item.name(), e.getMessage());
            return Optional.empty();
        }
    }
}
