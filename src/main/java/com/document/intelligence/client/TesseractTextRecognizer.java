package com.document.intelligence.client;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.exception.DocumentProcessingException;
import com.document.intelligence.model.DocumentState;
import com.document.intelligence.model.Recognition;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Tesseract via Tess4J. A Tesseract handle is not thread-safe, so each worker
 * thread gets its own.
 */
@Component
@ConditionalOnProperty(prefix = "docintel.ocr", name = "engine", havingValue = "tesseract", matchIfMissing = true)
@Slf4j
public class TesseractTextRecognizer implements TextRecognizer {

    private final ThreadLocal<Tesseract> engines;

    public TesseractTextRecognizer(PipelineProperties properties) {
        PipelineProperties.Ocr ocr = properties.getOcr();
        this.engines = ThreadLocal.withInitial(() -> {
            Tesseract tesseract = new Tesseract();
            if (ocr.getDatapath() != null) {
                tesseract.setDatapath(ocr.getDatapath());
            }
            tesseract.setLanguage(ocr.getLanguage());
            log.info("Initialized Tesseract ({}) on {}", ocr.getLanguage(), Thread.currentThread().getName());
            return tesseract;
        });
    }

    @Override
    public Recognition recognize(BufferedImage region) {
        Tesseract tesseract = engines.get();
        try {
            String text = tesseract.doOCR(region);
            List<Word> words = tesseract.getWords(region, ITessAPI.TessPageIteratorLevel.RIL_WORD);
            double confidence = words.stream()
                    .filter(w -> w.getText() != null && !w.getText().isBlank())
                    .mapToDouble(Word::getConfidence)
                    .average()
                    .orElse(0.0) / 100.0;
            return new Recognition(text == null ? "" : text.trim(), Math.max(0.0, Math.min(1.0, confidence)));
        } catch (TesseractException e) {
            throw new DocumentProcessingException(DocumentState.EXTRACTING, "Text recognition failed: " + e.getMessage(), e);
        }
    }
}
