package com.kmg.tagger.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * One source image. The key is the file name so progress survives moving the folder;
 * the content signature is read from the file system every time it is asked for.
 */
public record ImageItem(Path path) {
    public static final Set<String> RAW_EXTENSIONS = Set.of(
            "nef", "cr2", "cr3", "arw", "raf", "orf", "rw2", "dng", "raw");

    public ImageItem {
        if (path == null) {
            throw new IllegalArgumentException("Image path is required.");
        }
        path = path.toAbsolutePath().normalize();
    }

    public static ImageItem of(Path path) {
        return new ImageItem(path);
    }

    public String key() {
        return path.getFileName().toString();
    }

    public String name() {
        return key();
    }

    public String extension() {
        String name = key();
        int idx = name.lastIndexOf('.');
        return idx < 0 ? "" : name.substring(idx + 1).toLowerCase(Locale.ROOT);
    }

    public boolean isRaw() {
        return RAW_EXTENSIONS.contains(extension());
    }

    /**
     * Size and modification time as {@code size:lastModifiedMillis}, or an empty string
     * when the file cannot be read.
     */
    public String contentSignature() {
        try {
            long size = Files.size(path);
            long modified = Files.getLastModifiedTime(path).toMillis();
            return size + ":" + modified;
        } catch (IOException e) {
            return "";
        }
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
