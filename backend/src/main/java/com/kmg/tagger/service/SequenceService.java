package com.kmg.tagger.service;

import com.kmg.tagger.config.TaggerProperties;
import com.kmg.tagger.dto.SequencePreviewRequest;
import com.kmg.tagger.dto.SequencePreviewResponse;
import com.kmg.tagger.dto.SequenceView;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class SequenceService {
    private static final Logger log = LoggerFactory.getLogger(SequenceService.class);

    private final ImageScanner imageScanner;
    private final SequenceDetector sequenceDetector;
    private final SharpnessScorer sharpnessScorer;
    private final SequencePreviewFormatter previewFormatter;
    private final TaggerProperties properties;

    public SequenceService(
            ImageScanner imageScanner,
            SequenceDetector sequenceDetector,
            SharpnessScorer sharpnessScorer,
            SequencePreviewFormatter previewFormatter,
            TaggerProperties properties
    ) {
        this.imageScanner = imageScanner;
        this.sequenceDetector = sequenceDetector;
        this.sharpnessScorer = sharpnessScorer;
        this.previewFormatter = previewFormatter;
        this.properties = properties;
    }

    public List<Sequence> detect(List<ImageItem> images, Double thresholdSeconds, boolean scoreSharpness) {
        double threshold = thresholdOrDefault(thresholdSeconds);
        log.info("Detecting sequences (threshold: {}s)...", threshold);
        List<Sequence> sequences = sequenceDetector.detect(images, threshold);
        if (scoreSharpness && !sequences.isEmpty()) {
            log.info("Scoring sharpness for sequence frames...");
            sharpnessScorer.scoreAll(sequences);
        }
        return sequences;
    }

    public SequencePreviewResponse preview(SequencePreviewRequest request) {
        List<ImageItem> images = imageScanner.listSupportedImages(request.path());
        List<Sequence> sequences = detect(images, request.thresholdSeconds(), request.scoreSharpness());
        List<SequenceView> views = sequences.stream().map(this::toView).toList();
        int framesInSequences = sequences.stream().mapToInt(Sequence::frameCount).sum();
        return new SequencePreviewResponse(
                images.size(),
                sequences.size(),
                framesInSequences,
                views,
                previewFormatter.format(sequences)
        );
    }

    public String format(List<Sequence> sequences) {
        return previewFormatter.format(sequences);
    }

    private double thresholdOrDefault(Double thresholdSeconds) {
        return thresholdSeconds == null ? properties.getSequence().getThresholdSeconds() : thresholdSeconds;
    }

    private SequenceView toView(Sequence sequence) {
        return new SequenceView(
                sequence.id(),
                sequence.frames().stream().map(ImageItem::name).toList(),
                sequence.timestamps().stream().map(LocalDateTime::toString).toList(),
                sequence.isScored() ? sequence.sharpnessScores() : List.of(),
                sequence.bestFrameIndex(),
                sequence.bestFrame().name()
        );
    }
}
