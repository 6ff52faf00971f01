package com.kmg.tagger.service;

import com.kmg.tagger.model.FrameScore;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.LuminanceBuffer;
import com.kmg.tagger.model.Sequence;
import com.kmg.tagger.service.capability.CapabilityUnavailableException;
import com.kmg.tagger.service.capability.PixelBufferExtractor;
import com.kmg.tagger.service.capability.PreviewPixelBufferExtractor;
import com.kmg.tagger.service.capability.RawPreviewSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SharpnessScorerTest {
    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 18, 14, 30, 12);

    private final Map<ImageItem, LuminanceBuffer> buffers = new HashMap<>();
    private final PixelBufferExtractor extractor = item -> Optional.ofNullable(buffers.get(item));
    private final SharpnessScorer scorer = new SharpnessScorer(extractor);

    @Test
    void blurredImageScoresLowerThanSharpOne() {
        LuminanceBuffer sharp = checkerboard(32, 32, 1);
        LuminanceBuffer blurred = boxBlur(sharp);

        assertThat(SharpnessScorer.laplacianVariance(blurred))
                .isLessThan(SharpnessScorer.laplacianVariance(sharp));
    }

    @Test
    void flatImageHasZeroSharpness() {
        LuminanceBuffer flat = new LuminanceBuffer(8, 8, filled(64, 128.0));

        assertThat(SharpnessScorer.laplacianVariance(flat)).isZero();
    }

    @Test
    void sharpestFrameIsSelected() {
        Sequence sequence = sequenceOf(
                item("a.jpg", boxBlur(checkerboard(16, 16, 2))),
                item("b.jpg", checkerboard(16, 16, 2)),
                item("c.jpg", boxBlur(boxBlur(checkerboard(16, 16, 2)))));

        scorer.score(sequence);

        assertThat(sequence.bestFrameIndex()).isEqualTo(1);
        assertThat(sequence.sharpnessScores()).hasSize(3);
    }

    @Test
    void identicalFramesScoreEqualAndFirstWins() {
        LuminanceBuffer image = checkerboard(16, 16, 3);
        Sequence sequence = sequenceOf(item("a.jpg", image), item("b.jpg", image), item("c.jpg", image));

        scorer.score(sequence);

        List<Double> scores = sequence.sharpnessScores();
        assertThat(scores.get(0)).isEqualTo(scores.get(1)).isEqualTo(scores.get(2));
        assertThat(sequence.bestFrameIndex()).isZero();
    }

    @Test
    void unreadableFrameReportsZeroAndNeverWins() {
        ImageItem unreadable = ImageItem.of(Path.of("/photos/broken.jpg"));
        Sequence sequence = sequenceOf(unreadable, item("b.jpg", new LuminanceBuffer(4, 4, filled(16, 50.0))));

        scorer.score(sequence);

        assertThat(sequence.frameScores().get(0)).isEqualTo(FrameScore.unscored());
        assertThat(sequence.sharpnessScores().get(0)).isZero();
        assertThat(sequence.bestFrameIndex()).isEqualTo(1);
        assertThat(scorer.scoreOne(unreadable)).isZero();
    }

    @Test
    void allUnreadableFallsBackToFirstFrame() {
        Sequence sequence = sequenceOf(
                ImageItem.of(Path.of("/photos/x.jpg")), ImageItem.of(Path.of("/photos/y.jpg")));

        scorer.score(sequence);

        assertThat(sequence.bestFrameIndex()).isZero();
        assertThat(sequence.sharpnessScores()).containsExactly(0.0, 0.0);
    }

    @Test
    void extractorFailureIsTreatedAsUnreadable() {
        SharpnessScorer failing = new SharpnessScorer(item -> {
            throw new IllegalStateException("decoder crashed");
        });

        assertThat(failing.scoreOne(ImageItem.of(Path.of("/photos/a.jpg")))).isZero();
    }

    @Test
    void scoresRealImageFilesThroughImageIo(@TempDir Path dir) throws Exception {
        Path sharpFile = dir.resolve("sharp.png");
        Path flatFile = dir.resolve("flat.png");
        ImageIO.write(checkerboardImage(32, 32), "png", sharpFile.toFile());
        ImageIO.write(new BufferedImage(32, 32, BufferedImage.TYPE_INT_RGB), "png", flatFile.toFile());
        SharpnessScorer real = new SharpnessScorer(new PreviewPixelBufferExtractor(mock(RawPreviewSource.class)));

        assertThat(real.scoreOne(ImageItem.of(sharpFile))).isGreaterThan(real.scoreOne(ImageItem.of(flatFile)));
        assertThat(real.scoreOne(ImageItem.of(flatFile))).isZero();
    }

    @Test
    void rawBurstWithoutPreviewToolIsFatal() {
        RawPreviewSource rawPreviews = mock(RawPreviewSource.class);
        when(rawPreviews.isAvailable()).thenReturn(false);
        SharpnessScorer real = new SharpnessScorer(new PreviewPixelBufferExtractor(rawPreviews));
        Sequence burst = sequenceOf(ImageItem.of(Path.of("/photos/DSC_0001.NEF")),
                ImageItem.of(Path.of("/photos/DSC_0002.NEF")));

        assertThatThrownBy(() -> real.score(burst))
                .isInstanceOf(CapabilityUnavailableException.class)
                .hasMessageContaining("exiftool");
        assertThat(burst.frameScores()).isEmpty();
    }

    @Test
    void jpegBurstNeedsNoPreviewTool() {
        RawPreviewSource rawPreviews = mock(RawPreviewSource.class);
        PreviewPixelBufferExtractor extractor = new PreviewPixelBufferExtractor(rawPreviews);

        assertThat(extractor.isAvailableFor(ImageItem.of(Path.of("/photos/a.jpg")))).isTrue();
        verify(rawPreviews, never()).isAvailable();
    }

    private ImageItem item(String name, LuminanceBuffer buffer) {
        ImageItem item = ImageItem.of(Path.of("/photos", name));
        buffers.put(item, buffer);
        return item;
    }

    private static Sequence sequenceOf(ImageItem... frames) {
        List<LocalDateTime> timestamps = new ArrayList<>();
        for (int i = 0; i < frames.length; i++) {
            timestamps.add(T0.plusNanos(i * 100_000_000L));
        }
        return new Sequence(List.of(frames), timestamps);
    }

    private static LuminanceBuffer checkerboard(int width, int height, int cell) {
        double[] samples = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                samples[y * width + x] = ((x / cell + y / cell) % 2 == 0) ? 0.0 : 255.0;
            }
        }
        return new LuminanceBuffer(width, height, samples);
    }

    private static BufferedImage checkerboardImage(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, (x + y) % 2 == 0 ? 0x000000 : 0xFFFFFF);
            }
        }
        return image;
    }

    private static LuminanceBuffer boxBlur(LuminanceBuffer source) {
        int width = source.width();
        int height = source.height();
        double[] out = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                int count = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = x + dx;
                        int ny = y + dy;
                        if (nx >= 0 && ny >= 0 && nx < width && ny < height) {
                            sum += source.at(nx, ny);
                            count++;
                        }
                    }
                }
                out[y * width + x] = sum / count;
            }
        }
        return new LuminanceBuffer(width, height, out);
    }

    private static double[] filled(int size, double value) {
        double[] samples = new double[size];
        Arrays.fill(samples, value);
        return samples;
    }
}
