package com.kmg.tagger.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class BatchProgressTest {

    @Test
    void reportsRateAndRemainingTime() {
        AtomicLong clock = new AtomicLong(1_000);
        BatchProgress progress = new BatchProgress(10, clock::get);

        clock.addAndGet(4_000);
        progress.advance();
        clock.addAndGet(4_000);
        String line = progress.advance();

        assertThat(line).isEqualTo("[2/10] 20% | 4.0s/img | ETA 0:32");
        assertThat(progress.done()).isEqualTo(2);
    }

    @Test
    void nothingDoneYetHasNoRate() {
        BatchProgress progress = new BatchProgress(5, () -> 0L);

        assertThat(progress.line()).isEqualTo("[0/5] 0% | 0.0s/img | ETA 0:00");
    }

    @Test
    void longDurationsShowHours() {
        assertThat(BatchProgress.formatDuration(3_725)).isEqualTo("1:02:05");
        assertThat(BatchProgress.formatDuration(59.6)).isEqualTo("1:00");
    }
}
