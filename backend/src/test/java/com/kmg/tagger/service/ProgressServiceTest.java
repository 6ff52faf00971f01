package com.kmg.tagger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.tagger.config.TaggerProperties;
import com.kmg.tagger.dto.ProgressView;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.repo.ProgressStore;
import com.kmg.tagger.repo.ProgressStoreFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressServiceTest {
    @TempDir
    Path dir;

    private ProgressStoreFactory factory;
    private ProgressService service;

    @BeforeEach
    void setup() {
        factory = new ProgressStoreFactory(new TaggerProperties(), new ObjectMapper());
        service = new ProgressService(factory);
    }

    @Test
    void viewShowsStoredCountsAndFailures() throws Exception {
        Path ok = Files.writeString(dir.resolve("a.jpg"), "a");
        Path bad = Files.writeString(dir.resolve("b.jpg"), "b");
        ProgressStore store = factory.open(dir);
        store.markProcessed(ImageItem.of(ok), List.of("Num:1"), 2.0, Map.of());
        store.markFailed(ImageItem.of(bad), "timeout");

        ProgressView view = service.view(dir.toString());

        assertThat(view.stats().processedCount()).isEqualTo(1);
        assertThat(view.failed()).containsOnlyKeys("b.jpg");
        assertThat(view.stateFile()).endsWith(".racing_tagger_progress.json");
    }

    @Test
    void singleFileSharesTheFolderProgress() throws Exception {
        Path ok = Files.writeString(dir.resolve("a.jpg"), "a");

        assertThat(service.view(ok.toString()).jobDirectory()).isEqualTo(dir.toAbsolutePath().normalize().toString());
    }

    @Test
    void resetClearsEverything() throws Exception {
        Path ok = Files.writeString(dir.resolve("a.jpg"), "a");
        factory.open(dir).markProcessed(ImageItem.of(ok), List.of(), 1.0, Map.of());

        ProgressView view = service.reset(dir.toString());

        assertThat(view.stats().processedCount()).isZero();
        assertThat(factory.open(dir).isProcessed(ImageItem.of(ok))).isFalse();
    }

    @Test
    void missingPathIsRejected() {
        assertThatThrownBy(() -> service.view(dir.resolve("gone").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
