package com.kmg.tagger.service;

import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.Sequence;
import com.kmg.tagger.service.capability.HierarchicalKeywords;
import com.kmg.tagger.service.capability.MetadataWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tags every frame of a sequence with {@code Sequence:<id>} and the best frame additionally with
 * {@code Sequence:Best}. Existing keywords are kept.
 */
@Service
public class SequenceTagWriter {
    private static final Logger log = LoggerFactory.getLogger(SequenceTagWriter.class);
    public static final String BEST = "Sequence:Best";

    private final MetadataWriter metadataWriter;

    public SequenceTagWriter(MetadataWriter metadataWriter) {
        this.metadataWriter = metadataWriter;
    }

    /**
     * @return number of frames that could not be written
     */
    public int writeAll(List<Sequence> sequences, Path outputDir) {
        int failures = 0;
        for (Sequence sequence : sequences) {
            failures += write(sequence, outputDir);
        }
        return failures;
    }

    public int write(Sequence sequence, Path outputDir) {
        int failures = 0;
        for (int i = 0; i < sequence.frameCount(); i++) {
            ImageItem frame = sequence.frames().get(i);
            List<String> keywords = keywordsFor(sequence, i);
            Path target = HierarchicalKeywords.targetFor(frame.path(), outputDir, frame.isRaw());
            try {
                metadataWriter.write(target, keywords, frame.path(), true);
            } catch (RuntimeException e) {
                failures++;
                log.error("Error writing sequence keywords to {}: {}", frame.name(), e.getMessage());
            }
        }
        return failures;
    }

    static List<String> keywordsFor(Sequence sequence, int frameIndex) {
        List<String> keywords = new ArrayList<>();
        keywords.add("Sequence:" + sequence.id());
        if (frameIndex == sequence.bestFrameIndex()) {
            keywords.add(BEST);
        }
        return keywords;
    }
}
