package com.kmg.tagger.service;

import com.kmg.tagger.model.FrameScore;
import com.kmg.tagger.model.Sequence;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text summary of detected sequences, printed instead of writing anything in a sequence
 * dry run.
 */
@Component
public class SequencePreviewFormatter {
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final String RULE = "=".repeat(60);
    private static final int FULL_LISTING_LIMIT = 6;
    private static final int EDGE_FRAMES = 3;

    public String format(List<Sequence> sequences) {
        if (sequences.isEmpty()) {
            return "No sequences detected.";
        }

        int totalFrames = sequences.stream().mapToInt(Sequence::frameCount).sum();
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n')
                .append("SEQUENCE DETECTION PREVIEW\n")
                .append(RULE).append('\n')
                .append("Sequences found: ").append(sequences.size()).append('\n')
                .append("Total frames in sequences: ").append(totalFrames).append('\n')
                .append(String.format(Locale.ROOT, "Average frames per sequence: %.1f%n",
                        (double) totalFrames / sequences.size()))
                .append(RULE).append("\n\n");

        for (int i = 0; i < sequences.size(); i++) {
            appendSequence(out, i + 1, sequences.get(i));
        }
        return out.toString().stripTrailing();
    }

    private void appendSequence(StringBuilder out, int number, Sequence sequence) {
        out.append("Sequence ").append(number).append(": ").append(sequence.id()).append('\n');
        out.append("  Frames: ").append(sequence.frameCount()).append('\n');
        out.append("  Time span: ")
                .append(TIME.format(sequence.timestamps().get(0)))
                .append(" - ")
                .append(TIME.format(sequence.timestamps().get(sequence.frameCount() - 1)))
                .append('\n');

        if (sequence.isScored()) {
            List<Double> scores = sequence.sharpnessScores();
            double min = scores.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            double max = scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            out.append(String.format(Locale.ROOT, "  Best frame: %s (sharpness: %.2f)%n",
                    sequence.bestFrame().name(), scores.get(sequence.bestFrameIndex())));
            out.append(String.format(Locale.ROOT, "  Sharpness range: %.2f - %.2f%n", min, max));
        }

        int count = sequence.frameCount();
        if (count <= FULL_LISTING_LIMIT) {
            for (int j = 0; j < count; j++) {
                appendFrame(out, sequence, j);
            }
        } else {
            for (int j = 0; j < EDGE_FRAMES; j++) {
                appendFrame(out, sequence, j);
            }
            out.append("    ... (").append(count - 2 * EDGE_FRAMES).append(" more frames)\n");
            for (int j = count - EDGE_FRAMES; j < count; j++) {
                appendFrame(out, sequence, j);
            }
        }
        out.append('\n');
    }

    private void appendFrame(StringBuilder out, Sequence sequence, int index) {
        out.append("    ").append(sequence.frames().get(index).name());
        if (sequence.isScored()) {
            FrameScore score = sequence.frameScores().get(index);
            out.append(score.scored() ? String.format(Locale.ROOT, " (%.2f)", score.value()) : " (unreadable)");
            if (index == sequence.bestFrameIndex()) {
                out.append(" [BEST]");
            }
        }
        out.append('\n');
    }
}
