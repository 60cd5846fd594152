package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.model.NormalizationParameters;
import com.document.intelligence.model.NormalizationParameters.DpiSource;
import com.document.intelligence.model.NormalizationParameters.ThresholdMethod;
import com.document.intelligence.model.NormalizedImage;
import com.document.intelligence.model.RawImage;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.opencv.photo.Photo;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Turns a raw scan into the canonical page every later stage assumes:
 * straight, clean, binary, at the target resolution, without margins.
 *
 * The five steps run in a fixed order: deskew, denoise, binarize,
 * scale-normalize, border removal. A step that cannot find what it needs
 * (no text lines, no content) logs a warning and hands its input on
 * unchanged; preprocessing never fails a document on its own.
 */
@Service
@Slf4j
public class ImageNormalizer {

    private static final double CANNY_LOW = 50;
    private static final double CANNY_HIGH = 150;
    private static final double HOUGH_THETA = Math.PI / 720;

    private static final int[] COMMON_DPIS = {100, 150, 200, 240, 300, 400, 600};
    private static final double LETTER_WIDTH_INCHES = 8.5;

    private static final double EDGE_INK_FRACTION = 0.9;
    private static final double MAX_EDGE_TRIM = 0.1;
    private static final double SPECK_AREA_RATIO = 0.00002;

    private final PipelineProperties.Preprocessing config;

    public ImageNormalizer(PipelineProperties properties) {
        this.config = properties.getPreprocessing();
        GrayRaster.ensureLoaded();
    }

    public NormalizedImage normalize(RawImage raw) {
        NormalizationParameters.NormalizationParametersBuilder params = NormalizationParameters.builder()
                .thresholdMethod(config.getBinarizationMethod())
                .globalThreshold(-1)
                .scaleFactor(1.0);

        Mat page = GrayRaster.toMat(raw.getImage());
        try {
            page = replace(page, deskew(page, params));
            page = replace(page, denoise(page));
            page = replace(page, binarize(page, params));
            page = replace(page, normalizeScale(page, raw.getDeclaredDpi(), params));
            page = replace(page, removeBorders(page, params));

            NormalizationParameters result = params.build();
            log.debug("Normalized page to {}x{} (skew {}°, dpi {} [{}], degraded {})",
                    page.cols(), page.rows(), result.getSkewAngle(),
                    result.getEstimatedDpi(), result.getDpiSource(), result.getDegradedSteps());
            return new NormalizedImage(GrayRaster.toImage(page), result);
        } finally {
            page.release();
        }
    }

    private static Mat replace(Mat current, Mat next) {
        if (next != current) current.release();
        return next;
    }

    // ─── 1. DESKEW ─────────────────────────────────────────────────────

    private Mat deskew(Mat page, NormalizationParameters.NormalizationParametersBuilder params) {
        if (!config.isDeskewEnabled()) return page;

        OptionalDouble detected = detectSkewAngle(page);
        if (detected.isEmpty()) {
            log.warn("Deskew: no dominant text-line angle found, leaving page unrotated");
            params.degradedStep("deskew");
            return page;
        }

        double angle = detected.getAsDouble();
        params.skewAngle(angle);
        if (Math.abs(angle) <= config.getMinCorrectionAngle()) {
            return page;
        }

        params.skewCorrected(true);
        return rotate(page, angle);
    }

    OptionalDouble detectSkewAngle(BufferedImage page) {
        Mat gray = GrayRaster.toMat(page);
        try {
            return detectSkewAngle(gray);
        } finally {
            gray.release();
        }
    }

    /**
     * Median angle of the line segments found by Canny edges and the
     * probabilistic Hough transform, folded into [-45°, 45°] so vertical
     * rules vote too. Segments steeper than {@code max-skew-angle} are ignored.
     *
     * @return degrees, positive when lines descend to the right; empty when
     *         no usable segment was found
     */
    private OptionalDouble detectSkewAngle(Mat gray) {
        Mat edges = new Mat();
        Mat lines = new Mat();
        try {
            Imgproc.Canny(gray, edges, CANNY_LOW, CANNY_HIGH, 3, false);
            Imgproc.HoughLinesP(edges, lines, 1, HOUGH_THETA,
                    config.getHoughThreshold(), config.getMinLineLength(), config.getMaxLineGap());

            List<Double> angles = new ArrayList<>();
            for (int i = 0; i < lines.rows(); i++) {
                double[] l = lines.get(i, 0);
                double angle = foldAngle(Math.toDegrees(Math.atan2(l[3] - l[1], l[2] - l[0])));
                if (Math.abs(angle) <= config.getMaxSkewAngle()) {
                    angles.add(angle);
                }
            }
            if (angles.isEmpty()) return OptionalDouble.empty();

            log.debug("Deskew: {} of {} segments within ±{}°", angles.size(), lines.rows(), config.getMaxSkewAngle());
            return OptionalDouble.of(Math.round(median(angles) * 100.0) / 100.0);
        } finally {
            GrayRaster.release(edges, lines);
        }
    }

    static double foldAngle(double degrees) {
        double angle = degrees;
        while (angle > 90) angle -= 180;
        while (angle <= -90) angle += 180;
        if (angle > 45) return angle - 90;
        if (angle < -45) return angle + 90;
        return angle;
    }

    private static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    /**
     * Rotates counter-clockwise by {@code degrees} about the centre, keeping
     * the canvas size; uncovered corners are filled with paper.
     */
    private static Mat rotate(Mat page, double degrees) {
        Point center = new Point(page.cols() / 2.0, page.rows() / 2.0);
        Mat rotation = Imgproc.getRotationMatrix2D(center, degrees, 1.0);
        Mat rotated = new Mat();
        try {
            Imgproc.warpAffine(page, rotated, rotation, page.size(),
                    Imgproc.INTER_CUBIC, Core.BORDER_CONSTANT, new Scalar(255));
            return rotated;
        } finally {
            rotation.release();
        }
    }

    // ─── 2. DENOISE ────────────────────────────────────────────────────

    private Mat denoise(Mat page) {
        if (!config.isDenoiseEnabled()) return page;
        return nonLocalMeans(page, config.getDenoiseLevel().strength(),
                config.getDenoiseTemplateWindow(), config.getDenoiseSearchWindow());
    }

    /**
     * Non-local means: each pixel becomes the weighted mean of the pixels in
     * its search window, weighted by how similar their surrounding patches are.
     */
    static Mat nonLocalMeans(Mat gray, float strength, int templateWindow, int searchWindow) {
        Mat denoised = new Mat();
        Photo.fastNlMeansDenoising(gray, denoised, strength, templateWindow, searchWindow);
        return denoised;
    }

    // ─── 3. BINARIZE ───────────────────────────────────────────────────

    private Mat binarize(Mat page, NormalizationParameters.NormalizationParametersBuilder params) {
        Mat binary = new Mat();
        if (config.getBinarizationMethod() == ThresholdMethod.GAUSSIAN) {
            int block = Math.max(3, config.getAdaptiveBlockSize() | 1);
            Imgproc.adaptiveThreshold(page, binary, 255, Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                    Imgproc.THRESH_BINARY, block, config.getAdaptiveConstant());
        } else {
            params.globalThreshold(otsuThreshold(page, binary));
        }
        return binary;
    }

    /**
     * Writes the Otsu-binarized page to {@code binary} and returns the level
     * chosen: pixels above it become paper.
     */
    static int otsuThreshold(Mat gray, Mat binary) {
        double level = Imgproc.threshold(gray, binary, 0, 255, Imgproc.THRESH_BINARY | Imgproc.THRESH_OTSU);
        return (int) Math.round(level);
    }

    // ─── 4. SCALE NORMALIZATION ────────────────────────────────────────

    private Mat normalizeScale(Mat page, Integer declaredDpi,
                               NormalizationParameters.NormalizationParametersBuilder params) {
        int dpi;
        DpiSource source;
        if (declaredDpi != null && declaredDpi >= 50 && declaredDpi <= 2400) {
            dpi = declaredDpi;
            source = DpiSource.METADATA;
        } else {
            int estimated = estimateDpi(page.cols(), page.rows());
            if (estimated > 0) {
                dpi = estimated;
                source = DpiSource.ESTIMATED;
            } else {
                dpi = config.getAssumedDpi();
                source = DpiSource.ASSUMED;
            }
        }
        params.estimatedDpi(dpi).dpiSource(source);

        if (!config.isScaleEnabled()) return page;

        double factor = (double) config.getTargetDpi() / dpi;
        if (Math.abs(factor - 1.0) < 0.01) return page;

        int w = Math.max(1, (int) Math.round(page.cols() * factor));
        int h = Math.max(1, (int) Math.round(page.rows() * factor));
        params.scaleFactor(factor);

        Mat resized = GrayRaster.resize(page, w, h);
        // cubic resampling leaves grey edges; snap back to binary
        Imgproc.threshold(resized, resized, GrayRaster.INK_THRESHOLD - 1, 255, Imgproc.THRESH_BINARY);
        return resized;
    }

    /**
     * Guesses resolution from the page width, for full-page portrait scans
     * only (Letter / A4 proportions). Returns 0 when the page does not look
     * like one or the width is not close to a common scanner setting.
     */
    static int estimateDpi(int width, int height) {
        double aspect = (double) height / width;
        if (aspect < 1.25 || aspect > 1.45) return 0;

        double raw = width / LETTER_WIDTH_INCHES;
        int nearest = COMMON_DPIS[0];
        for (int dpi : COMMON_DPIS) {
            if (Math.abs(dpi - raw) < Math.abs(nearest - raw)) nearest = dpi;
        }
        return Math.abs(nearest - raw) / nearest <= 0.15 ? nearest : 0;
    }

    // ─── 5. BORDER REMOVAL ─────────────────────────────────────────────

    private Mat removeBorders(Mat page, NormalizationParameters.NormalizationParametersBuilder params) {
        int w = page.cols();
        int h = page.rows();
        params.cropX(0).cropY(0).cropWidth(w).cropHeight(h);
        if (!config.isBorderRemovalEnabled()) return page;

        Mat ink = GrayRaster.inkMask(page);
        Mat inner = null;
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        try {
            // scanner lid / shadow edges: rows and columns that are almost all ink
            int top = 0, bottom = h, left = 0, right = w;
            int maxTrimY = (int) (h * MAX_EDGE_TRIM);
            int maxTrimX = (int) (w * MAX_EDGE_TRIM);
            while (top < maxTrimY && inkFraction(ink, top, true, left, right) > EDGE_INK_FRACTION) top++;
            while (h - bottom < maxTrimY && inkFraction(ink, bottom - 1, true, left, right) > EDGE_INK_FRACTION) bottom--;
            while (left < maxTrimX && inkFraction(ink, left, false, top, bottom) > EDGE_INK_FRACTION) left++;
            while (w - right < maxTrimX && inkFraction(ink, right - 1, false, top, bottom) > EDGE_INK_FRACTION) right--;

            int innerW = right - left;
            int innerH = bottom - top;
            inner = ink.submat(top, bottom, left, right);
            int count = Imgproc.connectedComponentsWithStats(inner, labels, stats, centroids, 8, CvType.CV_32S);

            double minPixels = Math.max(4, innerW * (double) innerH * SPECK_AREA_RATIO);
            int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE, maxX = 0, maxY = 0;
            boolean found = false;
            // label 0 is the background
            for (int label = 1; label < count; label++) {
                if (GrayRaster.stat(stats, label, Imgproc.CC_STAT_AREA) < minPixels) continue;
                int x = GrayRaster.stat(stats, label, Imgproc.CC_STAT_LEFT);
                int y = GrayRaster.stat(stats, label, Imgproc.CC_STAT_TOP);
                minX = Math.min(minX, x);
                minY = Math.min(minY, y);
                maxX = Math.max(maxX, x + GrayRaster.stat(stats, label, Imgproc.CC_STAT_WIDTH));
                maxY = Math.max(maxY, y + GrayRaster.stat(stats, label, Imgproc.CC_STAT_HEIGHT));
                found = true;
            }

            if (!found) {
                log.warn("Border removal: no content regions found, keeping full page");
                params.degradedStep("border-removal");
                return page;
            }

            int padX = Math.max(10, (int) ((maxX - minX) * 0.05));
            int padY = Math.max(10, (int) ((maxY - minY) * 0.05));
            int x0 = left + Math.max(0, minX - padX);
            int y0 = top + Math.max(0, minY - padY);
            int x1 = left + Math.min(innerW, maxX + padX);
            int y1 = top + Math.min(innerH, maxY + padY);

            params.cropX(x0).cropY(y0).cropWidth(x1 - x0).cropHeight(y1 - y0);
            if (x0 == 0 && y0 == 0 && x1 == w && y1 == h) return page;

            Mat roi = page.submat(new Rect(x0, y0, x1 - x0, y1 - y0));
            try {
                return roi.clone();
            } finally {
                roi.release();
            }
        } finally {
            GrayRaster.release(ink, inner, labels, stats, centroids);
        }
    }

    private static double inkFraction(Mat ink, int line, boolean row, int from, int to) {
        if (to <= from) return 0.0;
        Mat strip = row ? ink.submat(line, line + 1, from, to) : ink.submat(from, to, line, line + 1);
        try {
            return Core.countNonZero(strip) / (double) (to - from);
        } finally {
            strip.release();
        }
    }
}
