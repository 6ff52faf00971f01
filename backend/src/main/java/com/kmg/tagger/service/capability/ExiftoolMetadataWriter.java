package com.kmg.tagger.service.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes keywords to {@code Subject} and {@code XMP-lr:HierarchicalSubject}. Both fields are
 * list-typed, so exiftool skips values that are already present when appending.
 */
@Component
public class ExiftoolMetadataWriter implements MetadataWriter {
    private static final Logger log = LoggerFactory.getLogger(ExiftoolMetadataWriter.class);

    private final ExiftoolRunner exiftool;

    public ExiftoolMetadataWriter(ExiftoolRunner exiftool) {
        this.exiftool = exiftool;
    }

    @Override
    public boolean isAvailable() {
        return exiftool.isAvailable();
    }

    @Override
    public void write(Path target, List<String> keywords, Path sourceImage, boolean merge) {
        if (keywords.isEmpty()) {
            log.debug("No keywords to write for {}", target);
            return;
        }
        if (!exiftool.isAvailable()) {
            throw new MetadataWriteException("exiftool not found, cannot write keywords");
        }

        try {
            createSidecarIfMissing(target, sourceImage);

            List<String> paths = HierarchicalKeywords.expand(keywords);
            List<String> args = new ArrayList<>();
            args.add("-overwrite_original");
            if (!merge) {
                args.add("-Subject=");
                args.add("-XMP-lr:HierarchicalSubject=");
            }
            for (String path : paths) {
                args.add("-Subject-=" + path);
                args.add("-Subject+=" + path);
            }
            for (String path : paths) {
                args.add("-XMP-lr:HierarchicalSubject-=" + path);
                args.add("-XMP-lr:HierarchicalSubject+=" + path);
            }
            args.add(target.toString());

            ExiftoolRunner.ExiftoolResult result = exiftool.run(args);
            if (result.exitCode() != 0) {
                throw new MetadataWriteException("exiftool error writing " + target + ": " + result.stderr());
            }
            log.debug("Wrote {} keyword paths to {}", paths.size(), target);
        } catch (IOException e) {
            throw new MetadataWriteException("Failed to write keywords to " + target, e);
        }
    }

    private void createSidecarIfMissing(Path target, Path sourceImage) throws IOException {
        if (!target.getFileName().toString().toLowerCase().endsWith(".xmp") || Files.exists(target)) {
            return;
        }
        if (sourceImage == null || !Files.exists(sourceImage)) {
            return;
        }
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        ExiftoolRunner.ExiftoolResult created = exiftool.run(List.of("-o", target.toString(), sourceImage.toString()));
        if (created.exitCode() != 0) {
            log.warn("Could not create sidecar {} from {}: {}", target, sourceImage, created.stderr());
        }
    }
}
