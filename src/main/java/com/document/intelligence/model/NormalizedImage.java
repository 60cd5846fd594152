package com.document.intelligence.model;

import lombok.Value;

import java.awt.image.BufferedImage;

/**
 * Canonical binary raster (TYPE_BYTE_GRAY, 0 = ink, 255 = paper) derived from a
 * document's raw scan. Never modified after creation; reprocessing creates a
 * new one.
 */
@Value
public class NormalizedImage {

    BufferedImage image;
    NormalizationParameters parameters;

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }
}
