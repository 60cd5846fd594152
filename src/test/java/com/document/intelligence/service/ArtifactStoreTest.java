package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.exception.DocumentProcessingException;
import com.document.intelligence.model.DocumentState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArtifactStore Tests")
class ArtifactStoreTest {

    @TempDir
    Path workDir;

    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getLifecycle().setWorkDir(workDir);
        store = new ArtifactStore(properties);
    }

    @Test
    @DisplayName("Should store the normalized page losslessly under the document's directory")
    void shouldStoreAndReload() {
        // Given
        BufferedImage page = TestPages.receiptLayout(300, 400);

        // When
        Path stored = store.saveNormalized("doc-1", page);
        BufferedImage loaded = store.loadNormalized(stored.toString(), DocumentState.MATCHING);

        // Then
        assertThat(stored).isAbsolute().startsWithRaw(workDir.toAbsolutePath().resolve("doc-1"));
        assertThat(Files.exists(stored.resolveSibling("normalized.png.tmp"))).isFalse();
        assertThat(GrayRaster.pixels(loaded)).isEqualTo(GrayRaster.pixels(page));
    }

    @Test
    @DisplayName("Should fail the asking stage when no image was recorded")
    void shouldFailWithoutRecordedPath() {
        assertThatThrownBy(() -> store.loadNormalized(null, DocumentState.EXTRACTING))
                .isInstanceOf(DocumentProcessingException.class)
                .satisfies(e -> assertThat(((DocumentProcessingException) e).getStage())
                        .isEqualTo(DocumentState.EXTRACTING));
    }
}
