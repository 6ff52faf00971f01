package com.kmg.tagger.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A burst of at least two frames whose consecutive capture gaps are within the detection
 * threshold. Frames and timestamps are parallel lists sorted by capture time.
 */
public class Sequence {
    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final String id;
    private final List<ImageItem> frames;
    private final List<LocalDateTime> timestamps;
    private List<FrameScore> scores = List.of();
    private int bestFrameIndex;

    public Sequence(List<ImageItem> frames, List<LocalDateTime> timestamps) {
        if (frames.size() != timestamps.size()) {
            throw new IllegalArgumentException("Frames and timestamps must have the same length.");
        }
        if (frames.size() < 2) {
            throw new IllegalArgumentException("A sequence needs at least two frames.");
        }
        this.frames = List.copyOf(frames);
        this.timestamps = List.copyOf(timestamps);
        this.id = idFor(timestamps.get(0));
    }

    public static String idFor(LocalDateTime firstFrameTimestamp) {
        return "SEQ_" + ID_FORMAT.format(firstFrameTimestamp);
    }

    public String id() {
        return id;
    }

    public List<ImageItem> frames() {
        return frames;
    }

    public List<LocalDateTime> timestamps() {
        return timestamps;
    }

    public int frameCount() {
        return frames.size();
    }

    public boolean isScored() {
        return !scores.isEmpty();
    }

    public List<FrameScore> frameScores() {
        return scores;
    }

    public List<Double> sharpnessScores() {
        List<Double> values = new ArrayList<>(scores.size());
        for (FrameScore score : scores) {
            values.add(score.value());
        }
        return Collections.unmodifiableList(values);
    }

    public int bestFrameIndex() {
        return bestFrameIndex;
    }

    public ImageItem bestFrame() {
        return frames.get(bestFrameIndex);
    }

    /**
     * Stores one score per frame and selects the best frame: highest scored value, earliest
     * frame on ties. Unscored frames only win when no frame could be scored.
     */
    public void applyScores(List<FrameScore> frameScores) {
        if (frameScores.size() != frames.size()) {
            throw new IllegalArgumentException("Expected " + frames.size() + " scores but got " + frameScores.size());
        }
        int best = 0;
        boolean found = false;
        double max = 0.0;
        for (int i = 0; i < frameScores.size(); i++) {
            FrameScore score = frameScores.get(i);
            if (!score.scored()) {
                continue;
            }
            if (!found || score.value() > max) {
                best = i;
                max = score.value();
                found = true;
            }
        }
        this.scores = List.copyOf(frameScores);
        this.bestFrameIndex = best;
    }
}
