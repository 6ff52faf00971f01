package com.kmg.tagger.service;

import com.kmg.tagger.dto.FolderStatsResponse;
import com.kmg.tagger.model.ImageItem;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds the images of a job: every supported file under a folder, or a single file.
 */
@Service
public class ImageScanner {
    static final Set<String> SUPPORTED = Set.of(
            "jpg", "jpeg", "png", "tif", "tiff",
            "nef", "cr2", "cr3", "arw", "dng", "raf", "orf", "rw2");
    private static final String LIGHTROOM_PREVIEWS = ".lrdata";

    public FolderStatsResponse computeStats(String pathStr) {
        Path path = normalize(pathStr);
        List<ImageItem> images = listSupportedImages(path);
        int raw = (int) images.stream().filter(ImageItem::isRaw).count();
        return new FolderStatsResponse(path.toString(), images.size(), raw);
    }

    public List<ImageItem> listSupportedImages(String pathStr) {
        return listSupportedImages(normalize(pathStr));
    }

    public List<ImageItem> listSupportedImages(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Path not found: " + path);
        }
        if (Files.isRegularFile(path)) {
            if (!isSupported(path)) {
                throw new IllegalArgumentException("Unsupported file type: " + path.getFileName());
            }
            return List.of(ImageItem.of(path));
        }
        try (Stream<Path> stream = Files.walk(path)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .filter(p -> !p.toString().contains(LIGHTROOM_PREVIEWS))
                    .sorted(Comparator.comparing(Path::toString))
                    .distinct()
                    .map(ImageItem::of)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list images: " + e.getMessage(), e);
        }
    }

    boolean isSupported(Path path) {
        String name = path.getFileName().toString();
        int idx = name.lastIndexOf('.');
        if (idx < 0) {
            return false;
        }
        String ext = name.substring(idx + 1).toLowerCase();
        return SUPPORTED.contains(ext);
    }

    private Path normalize(String pathStr) {
        if (pathStr == null || pathStr.isBlank()) {
            throw new IllegalArgumentException("Path is required.");
        }
        return Path.of(pathStr).toAbsolutePath().normalize();
    }
}
