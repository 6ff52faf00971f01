package com.kmg.tagger.service;

import java.util.Locale;
import java.util.function.LongSupplier;

/**
 * Throughput and remaining time for a running batch.
 */
public class BatchProgress {
    private final int total;
    private final LongSupplier clockMillis;
    private final long startedAt;
    private int done;

    public BatchProgress(int total) {
        this(total, System::currentTimeMillis);
    }

    BatchProgress(int total, LongSupplier clockMillis) {
        this.total = total;
        this.clockMillis = clockMillis;
        this.startedAt = clockMillis.getAsLong();
    }

    public String advance() {
        done++;
        return line();
    }

    public int done() {
        return done;
    }

    public double secondsPerImage() {
        return done == 0 ? 0.0 : elapsedSeconds() / done;
    }

    public double etaSeconds() {
        return secondsPerImage() * Math.max(0, total - done);
    }

    public String line() {
        double percent = total == 0 ? 100.0 : 100.0 * done / total;
        return String.format(Locale.ROOT, "[%d/%d] %.0f%% | %.1fs/img | ETA %s",
                done, total, percent, secondsPerImage(), formatDuration(etaSeconds()));
    }

    static String formatDuration(double seconds) {
        long whole = Math.round(seconds);
        long hours = whole / 3600;
        long minutes = (whole % 3600) / 60;
        long secs = whole % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, secs);
    }

    private double elapsedSeconds() {
        return (clockMillis.getAsLong() - startedAt) / 1000.0;
    }
}
