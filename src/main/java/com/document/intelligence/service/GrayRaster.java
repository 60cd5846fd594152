package com.document.intelligence.service;

import lombok.extern.slf4j.Slf4j;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Conversions between 8-bit grayscale pages ({@code TYPE_BYTE_GRAY}, 0 = black,
 * 255 = white) and single-channel OpenCV matrices. Loading this class loads
 * the bundled OpenCV natives.
 */
@Slf4j
final class GrayRaster {

    static final int INK_THRESHOLD = 128;

    static {
        OpenCV.loadLocally();
        log.info("OpenCV {} loaded", org.opencv.core.Core.VERSION);
    }

    private GrayRaster() {
    }

    /**
     * No-op that forces the natives to load before the first {@link Mat} is created.
     */
    static void ensureLoaded() {
    }

    static BufferedImage toGray(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            return source;
        }
        BufferedImage gray = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        try {
            // transparent areas become paper, not ink
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, source.getWidth(), source.getHeight());
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return gray;
    }

    static int[] pixels(BufferedImage gray) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        return gray.getRaster().getSamples(0, 0, w, h, 0, new int[w * h]);
    }

    static Mat toMat(BufferedImage image) {
        BufferedImage gray = toGray(image);
        int w = gray.getWidth();
        int h = gray.getHeight();
        byte[] data = (byte[]) gray.getRaster().getDataElements(0, 0, w, h, new byte[w * h]);
        Mat mat = new Mat(h, w, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    static BufferedImage toImage(Mat gray) {
        Mat source = gray.isContinuous() ? gray : gray.clone();
        try {
            int w = source.cols();
            int h = source.rows();
            byte[] data = new byte[w * h];
            source.get(0, 0, data);
            BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
            image.getRaster().setDataElements(0, 0, w, h, data);
            return image;
        } finally {
            if (source != gray) source.release();
        }
    }

    /**
     * Ink mask of a gray page: 255 where the pixel is darker than
     * {@link #INK_THRESHOLD}, 0 elsewhere.
     */
    static Mat inkMask(Mat gray) {
        Mat mask = new Mat();
        Imgproc.threshold(gray, mask, INK_THRESHOLD - 1, 255, Imgproc.THRESH_BINARY_INV);
        return mask;
    }

    static Mat resize(Mat gray, int width, int height) {
        Mat resized = new Mat();
        Imgproc.resize(gray, resized, new Size(width, height), 0, 0, Imgproc.INTER_CUBIC);
        return resized;
    }

    static BufferedImage resize(BufferedImage image, int width, int height) {
        Mat source = toMat(image);
        Mat resized = resize(source, width, height);
        try {
            return toImage(resized);
        } finally {
            release(source, resized);
        }
    }

    /**
     * One column of a {@code connectedComponentsWithStats} result row, e.g.
     * {@code Imgproc.CC_STAT_AREA}.
     */
    static int stat(Mat stats, int label, int column) {
        return (int) stats.get(label, column)[0];
    }

    static void release(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null) {
                mat.release();
            }
        }
    }
}
