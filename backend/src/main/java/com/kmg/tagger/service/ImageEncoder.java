package com.kmg.tagger.service;

import com.kmg.tagger.config.TaggerProperties;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.PreparedImage;
import com.kmg.tagger.service.capability.RawPreviewSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Base64;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;

/**
 * Prepare stage of the tagging pipeline: turns an image into the base64 JPEG payload sent to the
 * vision model, normalized so the longest edge fits the configured size.
 */
@Service
public class ImageEncoder implements PipelinedProcessor.Preparer<PreparedImage> {
    private static final Logger log = LoggerFactory.getLogger(ImageEncoder.class);
    private static final Set<String> NEEDS_PROCESSING = Set.of("tif", "tiff", "png", "bmp");

    private final RawPreviewSource rawPreviewSource;
    private final int normalizeSize;
    private final long reencodeThresholdBytes;
    private final float jpegQuality;

    public ImageEncoder(RawPreviewSource rawPreviewSource, TaggerProperties properties) {
        this.rawPreviewSource = rawPreviewSource;
        this.normalizeSize = properties.getImage().getNormalizeSize();
        this.reencodeThresholdBytes = properties.getImage().getReencodeThresholdBytes();
        this.jpegQuality = properties.getImage().getJpegQuality();
    }

    @Override
    public PreparedImage prepare(ImageItem item) throws IOException {
        String extension = item.extension();

        if (item.isRaw()) {
            Optional<byte[]> preview = rawPreviewSource.extract(item);
            if (preview.isPresent()) {
                return encoded(item, fitPreview(item, preview.get()));
            }
            log.warn("Could not extract preview from {}, will try conversion", item.name());
        }

        if (item.isRaw() || NEEDS_PROCESSING.contains(extension)) {
            Optional<byte[]> normalized = normalize(item);
            if (normalized.isPresent()) {
                return encoded(item, normalized.get());
            }
            log.warn("Could not normalize {}, using original", item.name());
        }

        if (Files.size(item.path()) > reencodeThresholdBytes) {
            Optional<byte[]> normalized = normalize(item);
            if (normalized.isPresent()) {
                return encoded(item, normalized.get());
            }
        }

        return encoded(item, Files.readAllBytes(item.path()));
    }

    private byte[] fitPreview(ImageItem item, byte[] preview) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(preview));
            if (image != null && Math.max(image.getWidth(), image.getHeight()) > normalizeSize) {
                return toJpeg(resize(image));
            }
        } catch (IOException e) {
            log.debug("Using embedded preview of {} unchanged: {}", item.name(), e.getMessage());
        }
        return preview;
    }

    private Optional<byte[]> normalize(ImageItem item) {
        try {
            BufferedImage image = ImageIO.read(item.path().toFile());
            if (image == null) {
                log.debug("No image reader for {}", item.name());
                return Optional.empty();
            }
            return Optional.of(toJpeg(resize(image)));
        } catch (IOException e) {
            log.debug("Failed to normalize {}: {}", item.name(), e.getMessage());
            return Optional.empty();
        }
    }

    BufferedImage resize(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        double scale = Math.min(1.0, (double) normalizeSize / Math.max(width, height));
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));

        BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }

    private byte[] toJpeg(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    private PreparedImage encoded(ImageItem item, byte[] data) {
        return new PreparedImage(item, Base64.getEncoder().encodeToString(data), data.length);
    }
}
