package com.kmg.tagger.service;

import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.Sequence;
import com.kmg.tagger.service.capability.CapabilityUnavailableException;
import com.kmg.tagger.service.capability.TimeSignatureReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Groups burst shots by capture time. Consecutive frames belong to the same sequence while the
 * gap between them is at most the threshold; runs of a single frame are not sequences.
 */
@Service
public class SequenceDetector {
    private static final Logger log = LoggerFactory.getLogger(SequenceDetector.class);

    private final TimeSignatureReader timeSignatureReader;

    public SequenceDetector(TimeSignatureReader timeSignatureReader) {
        this.timeSignatureReader = timeSignatureReader;
    }

    public List<Sequence> detect(List<ImageItem> items, double thresholdSeconds) {
        if (thresholdSeconds < 0) {
            throw new IllegalArgumentException("Threshold must not be negative: " + thresholdSeconds);
        }
        if (!timeSignatureReader.isAvailable()) {
            throw new CapabilityUnavailableException("Capture time reader is not available.");
        }
        if (items.isEmpty()) {
            return List.of();
        }

        log.info("Reading timestamps from {} images...", items.size());
        Map<ImageItem, LocalDateTime> instants = timeSignatureReader.readCaptureInstants(items);

        List<TimedItem> timed = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            LocalDateTime instant = instants.get(items.get(i));
            if (instant != null) {
                timed.add(new TimedItem(items.get(i), instant, i));
            }
        }
        if (timed.size() < items.size()) {
            log.info("{} images have no capture time and are left out of sequence detection",
                    items.size() - timed.size());
        }
        timed.sort(Comparator.comparing(TimedItem::instant).thenComparingInt(TimedItem::inputIndex));

        long thresholdMicros = Math.round(thresholdSeconds * 1_000_000);
        List<Sequence> sequences = new ArrayList<>();
        List<TimedItem> run = new ArrayList<>();
        for (TimedItem current : timed) {
            if (!run.isEmpty()) {
                TimedItem previous = run.get(run.size() - 1);
                long gap = ChronoUnit.MICROS.between(previous.instant(), current.instant());
                if (gap > thresholdMicros) {
                    close(run, sequences);
                    run = new ArrayList<>();
                }
            }
            run.add(current);
        }
        close(run, sequences);

        log.info("Found {} sequences", sequences.size());
        return sequences;
    }

    private void close(List<TimedItem> run, List<Sequence> sequences) {
        if (run.size() < 2) {
            return;
        }
        sequences.add(new Sequence(
                run.stream().map(TimedItem::item).toList(),
                run.stream().map(TimedItem::instant).toList()
        ));
    }

    private record TimedItem(ImageItem item, LocalDateTime instant, int inputIndex) {
    }
}
