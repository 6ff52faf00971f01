package com.kmg.tagger.service.capability;

import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;

/**
 * Keyword paths in the pipe-separated form Lightroom shows as a tree.
 */
public final class HierarchicalKeywords {
    public static final String ROOT = "AI Keywords";

    private HierarchicalKeywords() {
    }

    /**
     * Expands {@code Category:Value} keywords into every level of the hierarchy, root included:
     * {@code AI Keywords}, {@code AI Keywords|Make}, {@code AI Keywords|Make|Porsche}. Keywords
     * without a category are ignored. The result is sorted and distinct.
     */
    public static List<String> expand(List<String> keywords) {
        TreeSet<String> paths = new TreeSet<>();
        paths.add(ROOT);
        for (String keyword : keywords) {
            int colon = keyword.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String category = keyword.substring(0, colon);
            String value = keyword.substring(colon + 1);
            paths.add(ROOT + "|" + category);
            paths.add(ROOT + "|" + category + "|" + value);
        }
        return List.copyOf(paths);
    }

    /**
     * RAW files get an XMP sidecar ({@code <stem>.xmp}, beside the image or in the output
     * directory); everything else is written in place.
     */
    public static Path targetFor(Path image, Path outputDir, boolean raw) {
        if (!raw) {
            return image;
        }
        String name = image.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Path dir = outputDir != null ? outputDir : image.getParent();
        return dir.resolve(stem + ".xmp");
    }
}
