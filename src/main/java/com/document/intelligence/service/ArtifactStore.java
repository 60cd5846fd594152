package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.exception.DocumentProcessingException;
import com.document.intelligence.model.DocumentState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Per-document files under the work directory. The normalized image is kept
 * so a document resumed at MATCHING or EXTRACTING skips preprocessing.
 */
@Component
@Slf4j
public class ArtifactStore {

    private static final String NORMALIZED_FILE = "normalized.png";

    private final Path workDir;

    public ArtifactStore(PipelineProperties properties) {
        this.workDir = properties.getLifecycle().getWorkDir();
    }

    public Path saveNormalized(String documentId, BufferedImage image) {
        Path target = workDir.resolve(documentId).resolve(NORMALIZED_FILE);
        try {
            Files.createDirectories(target.getParent());
            Path temp = target.resolveSibling(NORMALIZED_FILE + ".tmp");
            if (!ImageIO.write(image, "png", temp.toFile())) {
                throw new IOException("no PNG writer available");
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored normalized image for {} at {}", documentId, target);
            return target.toAbsolutePath();
        } catch (IOException e) {
            throw new DocumentProcessingException(DocumentState.PREPROCESSING,
                    "Could not store normalized image: " + e.getMessage(), e);
        }
    }

    public BufferedImage loadNormalized(String path, DocumentState stage) {
        if (path == null) {
            throw new DocumentProcessingException(stage, "No normalized image recorded");
        }
        try {
            BufferedImage image = ImageIO.read(Path.of(path).toFile());
            if (image == null) {
                throw new DocumentProcessingException(stage, "Normalized image is unreadable: " + path);
            }
            return GrayRaster.toGray(image);
        } catch (IOException e) {
            throw new DocumentProcessingException(stage, "Could not read normalized image: " + e.getMessage(), e);
        }
    }
}
