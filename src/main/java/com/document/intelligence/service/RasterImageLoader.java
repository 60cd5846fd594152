package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.exception.DocumentProcessingException;
import com.document.intelligence.model.DocumentState;
import com.document.intelligence.model.RawImage;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;
import org.w3c.dom.Node;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Decodes a source file into a raster. PDFs are rendered (first page) at the
 * configured resolution; everything else goes through ImageIO, keeping the
 * resolution the file declares, if any.
 */
@Component
@Slf4j
public class RasterImageLoader {

    private final PipelineProperties.Preprocessing config;

    public RasterImageLoader(PipelineProperties properties) {
        this.config = properties.getPreprocessing();
    }

    public RawImage load(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new DocumentProcessingException(DocumentState.PREPROCESSING, "Source file not found: " + source);
        }
        try {
            return isPdf(source) ? renderPdf(source) : readImage(source);
        } catch (IOException e) {
            throw new DocumentProcessingException(DocumentState.PREPROCESSING,
                    "Could not decode " + source.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private boolean isPdf(Path source) throws IOException {
        if (source.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf")) return true;
        byte[] head = new byte[4];
        try (InputStream in = Files.newInputStream(source)) {
            return in.read(head) == 4 && head[0] == '%' && head[1] == 'P' && head[2] == 'D' && head[3] == 'F';
        }
    }

    private RawImage renderPdf(Path source) throws IOException {
        try (PDDocument doc = Loader.loadPDF(source.toFile())) {
            if (doc.getNumberOfPages() == 0) {
                throw new DocumentProcessingException(DocumentState.PREPROCESSING, "PDF has no pages: " + source.getFileName());
            }
            int dpi = config.getPdfRenderDpi();
            BufferedImage page = new PDFRenderer(doc).renderImageWithDPI(0, dpi, ImageType.GRAY);
            log.debug("Rendered page 1 of {} ({} pages) at {} dpi", source.getFileName(), doc.getNumberOfPages(), dpi);
            return new RawImage(page, dpi, "pdf");
        }
    }

    private RawImage readImage(Path source) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(source.toFile())) {
            Iterator<ImageReader> readers = input != null ? ImageIO.getImageReaders(input) : null;
            if (readers == null || !readers.hasNext()) {
                throw new DocumentProcessingException(DocumentState.PREPROCESSING,
                        "Unsupported image format: " + source.getFileName());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                IIOImage image = reader.readAll(0, null);
                Integer dpi = declaredDpi(image.getMetadata());
                return new RawImage((BufferedImage) image.getRenderedImage(), dpi,
                        reader.getFormatName().toLowerCase(Locale.ROOT));
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Horizontal resolution from the standard metadata tree, which stores it
     * as millimetres per pixel. Null when absent.
     */
    static Integer declaredDpi(IIOMetadata metadata) {
        if (metadata == null || !metadata.isStandardMetadataFormatSupported()) return null;
        Node root = metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
        for (Node dimension = root.getFirstChild(); dimension != null; dimension = dimension.getNextSibling()) {
            if (!"Dimension".equals(dimension.getNodeName())) continue;
            for (Node child = dimension.getFirstChild(); child != null; child = child.getNextSibling()) {
                if (!"HorizontalPixelSize".equals(child.getNodeName())) continue;
                Node value = child.getAttributes().getNamedItem("value");
                if (value == null) return null;
                try {
                    double mmPerPixel = Double.parseDouble(value.getNodeValue());
                    return mmPerPixel > 0 ? (int) Math.round(25.4 / mmPerPixel) : null;
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }
}
