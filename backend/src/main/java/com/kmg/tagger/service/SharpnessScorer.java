package com.kmg.tagger.service;

import com.kmg.tagger.model.FrameScore;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.LuminanceBuffer;
import com.kmg.tagger.model.Sequence;
import com.kmg.tagger.service.capability.CapabilityUnavailableException;
import com.kmg.tagger.service.capability.PixelBufferExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Relative focus measure: variance of the Laplacian of the luminance. Higher means sharper.
 * Values are only comparable between frames of the same scene.
 */
@Service
public class SharpnessScorer {
    private static final Logger log = LoggerFactory.getLogger(SharpnessScorer.class);

    private final PixelBufferExtractor pixelBufferExtractor;

    public SharpnessScorer(PixelBufferExtractor pixelBufferExtractor) {
        this.pixelBufferExtractor = pixelBufferExtractor;
    }

    /**
     * Scores every frame and selects the best one. Frames are scored in order on the calling
     * thread.
     */
    public void score(Sequence sequence) {
        if (!pixelBufferExtractor.isAvailable()) {
            throw new CapabilityUnavailableException("Pixel extraction is not available; cannot score sharpness.");
        }
        for (ImageItem frame : sequence.frames()) {
            if (!pixelBufferExtractor.isAvailableFor(frame)) {
                throw new CapabilityUnavailableException(
                        "Cannot read RAW previews for " + frame.name() + "; exiftool is required to score sharpness.");
            }
        }
        List<FrameScore> scores = new ArrayList<>(sequence.frameCount());
        for (ImageItem frame : sequence.frames()) {
            scores.add(scoreFrame(frame));
        }
        sequence.applyScores(scores);
        log.debug("{}: best frame {} of {}", sequence.id(), sequence.bestFrameIndex() + 1, sequence.frameCount());
    }

    public void scoreAll(List<Sequence> sequences) {
        for (int i = 0; i < sequences.size(); i++) {
            Sequence sequence = sequences.get(i);
            log.info("  Scoring sequence {}/{}: {} ({} frames)", i + 1, sequences.size(), sequence.id(),
                    sequence.frameCount());
            score(sequence);
        }
    }

    /**
     * Sharpness of one image, or {@code 0.0} when it cannot be read.
     */
    public double scoreOne(ImageItem item) {
        return scoreFrame(item).value();
    }

    FrameScore scoreFrame(ImageItem item) {
        Optional<LuminanceBuffer> buffer;
        try {
            buffer = pixelBufferExtractor.extract(item);
        } catch (RuntimeException e) {
            log.warn("Could not read pixels of {}: {}", item.name(), e.getMessage());
            return FrameScore.unscored();
        }
        return buffer.map(b -> FrameScore.of(laplacianVariance(b))).orElseGet(FrameScore::unscored);
    }

    /**
     * Applies the 3x3 kernel {@code [0,1,0; 1,-4,1; 0,1,0]} with mirrored borders (edge pixel not
     * repeated) and returns the population variance of the response.
     */
    static double laplacianVariance(LuminanceBuffer buffer) {
        int width = buffer.width();
        int height = buffer.height();
        long count = (long) width * height;
        double sum = 0.0;
        double sumSquares = 0.0;
        for (int y = 0; y < height; y++) {
            int up = reflect(y - 1, height);
            int down = reflect(y + 1, height);
            for (int x = 0; x < width; x++) {
                int left = reflect(x - 1, width);
                int right = reflect(x + 1, width);
                double response = buffer.at(x, up) + buffer.at(x, down) + buffer.at(left, y) + buffer.at(right, y)
                        - 4 * buffer.at(x, y);
                sum += response;
                sumSquares += response * response;
            }
        }
        double mean = sum / count;
        return Math.max(0.0, sumSquares / count - mean * mean);
    }

    private static int reflect(int index, int size) {
        if (size == 1) {
            return 0;
        }
        if (index < 0) {
            return -index;
        }
        if (index >= size) {
            return 2 * size - index - 2;
        }
        return index;
    }
}
