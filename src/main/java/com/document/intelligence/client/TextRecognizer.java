package com.document.intelligence.client;

import com.document.intelligence.model.Recognition;

import java.awt.image.BufferedImage;

/**
 * Reads the text in one image region. Implementations must be safe to call
 * from several worker threads at once.
 */
public interface TextRecognizer {

    Recognition recognize(BufferedImage region);
}
