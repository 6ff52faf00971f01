package com.kmg.tagger.service.capability;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExiftoolMetadataWriterTest {
    @Mock
    ExiftoolRunner exiftool;

    @Captor
    ArgumentCaptor<List<String>> args;

    @TempDir
    Path dir;

    private ExiftoolMetadataWriter writer;

    @BeforeEach
    void setup() {
        writer = new ExiftoolMetadataWriter(exiftool);
    }

    @Test
    void mergeAppendsEachPathWithoutDuplicates() throws IOException {
        Path image = Files.writeString(dir.resolve("a.jpg"), "x");
        when(exiftool.isAvailable()).thenReturn(true);
        when(exiftool.run(anyList())).thenReturn(new ExiftoolRunner.ExiftoolResult(0, new byte[0], ""));

        writer.write(image, List.of("Make:Porsche"), image, true);

        verify(exiftool).run(args.capture());
        assertThat(args.getValue())
                .startsWith("-overwrite_original")
                .contains("-Subject-=AI Keywords|Make|Porsche", "-Subject+=AI Keywords|Make|Porsche",
                        "-XMP-lr:HierarchicalSubject+=AI Keywords|Make")
                .doesNotContain("-Subject=")
                .endsWith(image.toString());
    }

    @Test
    void replaceClearsExistingKeywordsFirst() throws IOException {
        Path image = Files.writeString(dir.resolve("a.jpg"), "x");
        when(exiftool.isAvailable()).thenReturn(true);
        when(exiftool.run(anyList())).thenReturn(new ExiftoolRunner.ExiftoolResult(0, new byte[0], ""));

        writer.write(image, List.of("Num:23"), image, false);

        verify(exiftool).run(args.capture());
        assertThat(args.getValue()).containsSubsequence("-overwrite_original", "-Subject=", "-XMP-lr:HierarchicalSubject=");
    }

    @Test
    void missingSidecarIsCreatedFromSourceImage() throws IOException {
        Path raw = Files.writeString(dir.resolve("DSC_1.NEF"), "raw");
        Path sidecar = dir.resolve("DSC_1.xmp");
        when(exiftool.isAvailable()).thenReturn(true);
        when(exiftool.run(anyList())).thenReturn(new ExiftoolRunner.ExiftoolResult(0, new byte[0], ""));

        writer.write(sidecar, List.of("Num:23"), raw, true);

        verify(exiftool).run(List.of("-o", sidecar.toString(), raw.toString()));
        verify(exiftool, times(2)).run(anyList());
    }

    @Test
    void nonZeroExitIsAWriteFailure() throws IOException {
        Path image = Files.writeString(dir.resolve("a.jpg"), "x");
        when(exiftool.isAvailable()).thenReturn(true);
        when(exiftool.run(anyList())).thenReturn(new ExiftoolRunner.ExiftoolResult(1, new byte[0], "Error: bad file"));

        assertThatThrownBy(() -> writer.write(image, List.of("Num:23"), image, true))
                .isInstanceOf(MetadataWriter.MetadataWriteException.class)
                .hasMessageContaining("bad file");
    }

    @Test
    void missingExiftoolIsAWriteFailure() throws IOException {
        when(exiftool.isAvailable()).thenReturn(false);

        assertThatThrownBy(() -> writer.write(dir.resolve("a.jpg"), List.of("Num:23"), null, true))
                .isInstanceOf(MetadataWriter.MetadataWriteException.class);
        verify(exiftool, never()).run(anyList());
    }

    @Test
    void emptyKeywordListWritesNothing() throws IOException {
        writer.write(dir.resolve("a.jpg"), List.of(), null, true);

        verify(exiftool, never()).run(anyList());
    }
}
