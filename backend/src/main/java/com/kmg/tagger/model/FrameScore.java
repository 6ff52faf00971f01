package com.kmg.tagger.model;

/**
 * Sharpness of one frame. An unscored frame (unreadable or undecodable) reports 0.0 but is
 * never preferred over a frame that was actually measured.
 */
public record FrameScore(double value, boolean scored) {
    private static final FrameScore UNSCORED = new FrameScore(0.0, false);

    public static FrameScore of(double value) {
        return new FrameScore(value, true);
    }

    public static FrameScore unscored() {
        return UNSCORED;
    }
}
