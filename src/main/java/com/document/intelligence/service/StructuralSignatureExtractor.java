package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.model.NormalizedImage;
import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.Zone;
import com.document.intelligence.model.ZoneKind;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Describes a page layout as a list of classified zones, every coordinate a
 * ratio of the page size. The merge kernel is itself a fraction of the page,
 * so the same layout scanned at 200 or 600 dpi yields the same zones.
 */
@Service
@Slf4j
public class StructuralSignatureExtractor {

    private static final double WIDE = 0.5;
    private static final double SHORT = 0.3;
    private static final double TALL = 0.2;
    private static final double TOP_BAND = 0.25;
    private static final double BOTTOM_BAND = 0.75;
    private static final double UPPER_THIRD = 1.0 / 3.0;
    private static final double LOGO_MAX_AREA = 0.05;
    private static final double LOGO_MIN_DENSITY = 0.35;
    private static final double RULING_FILL = 0.8;

    private final PipelineProperties.Signature config;

    public StructuralSignatureExtractor(PipelineProperties properties) {
        this.config = properties.getSignature();
        GrayRaster.ensureLoaded();
    }

    public StructuralSignature extract(NormalizedImage image) {
        return extract(image.getImage());
    }

    /**
     * Signature of an arbitrary page image, e.g. a template's sample scan.
     */
    public StructuralSignature extract(BufferedImage image) {
        Mat gray = GrayRaster.toMat(image);
        Mat ink = GrayRaster.inkMask(gray);
        Mat merged = new Mat();
        Mat kernel = null;
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        try {
            int w = ink.cols();
            int h = ink.rows();
            if (Core.countNonZero(ink) == 0) {
                return StructuralSignature.empty();
            }

            int kernelW = Math.max(1, (int) Math.round(w * config.getMergeWidthRatio()));
            int kernelH = Math.max(1, (int) Math.round(h * config.getMergeHeightRatio()));
            kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(kernelW, kernelH));
            Imgproc.dilate(ink, merged, kernel);
            int count = Imgproc.connectedComponentsWithStats(merged, labels, stats, centroids, 8, CvType.CV_32S);

            double pageArea = (double) w * h;
            List<Zone> zones = new ArrayList<>();
            // label 0 is the background
            for (int label = 1; label < count; label++) {
                // dilation grows boxes; clip them back to the ink they contain
                Rect box = inkBounds(ink, new Rect(
                        GrayRaster.stat(stats, label, Imgproc.CC_STAT_LEFT),
                        GrayRaster.stat(stats, label, Imgproc.CC_STAT_TOP),
                        GrayRaster.stat(stats, label, Imgproc.CC_STAT_WIDTH),
                        GrayRaster.stat(stats, label, Imgproc.CC_STAT_HEIGHT)));
                if (box == null) continue;
                if (box.area() / pageArea < config.getMinRegionAreaRatio()) continue;

                Mat boxInk = ink.submat(box);
                try {
                    double density = Core.countNonZero(boxInk) / box.area();
                    Zone.ZoneBuilder zone = Zone.builder()
                            .x(box.x / (double) w)
                            .y(box.y / (double) h)
                            .width(box.width / (double) w)
                            .height(box.height / (double) h)
                            .density(density);
                    Zone unclassified = zone.kind(ZoneKind.OTHER).build();
                    zones.add(zone.kind(classify(unclassified, box.width, box.height, boxInk)).build());
                } finally {
                    boxInk.release();
                }
            }

            zones.sort(Comparator.comparingDouble(Zone::getY).thenComparingDouble(Zone::getX));

            double covered = zones.stream().mapToDouble(Zone::getAreaRatio).sum();
            StructuralSignature signature = StructuralSignature.builder()
                    .zones(zones)
                    .totalContentRatio(Math.min(1.0, covered))
                    .build();
            log.debug("Extracted {} zones from {}x{} page, content ratio {}", zones.size(), w, h,
                    signature.getTotalContentRatio());
            return signature;
        } finally {
            GrayRaster.release(gray, ink, merged, kernel, labels, stats, centroids);
        }
    }

    private ZoneKind classify(Zone zone, int pixelWidth, int pixelHeight, Mat boxInk) {
        double cy = zone.getCenterY();
        boolean wide = zone.getWidth() > WIDE;

        if (wide && zone.getHeight() >= TALL) {
            int[] bands = rowBands(boxInk);
            if (bands[0] >= 3 || bands[1] >= 2) return ZoneKind.TABLE;
        }
        if (wide && zone.getHeight() < SHORT && cy < TOP_BAND) return ZoneKind.HEADER;
        if (wide && zone.getHeight() < SHORT && cy > BOTTOM_BAND) return ZoneKind.FOOTER;

        double aspect = pixelWidth / (double) pixelHeight;
        if (cy < UPPER_THIRD && zone.getAreaRatio() < LOGO_MAX_AREA
                && aspect >= 0.5 && aspect <= 2.0 && zone.getDensity() > LOGO_MIN_DENSITY) {
            return ZoneKind.LOGO;
        }
        return ZoneKind.OTHER;
    }

    /**
     * Row profile of an ink box (255 = ink): {ink bands, ruling lines}. A band
     * is a run of rows holding any ink; a ruling line is a run of rows that are
     * almost entirely ink.
     */
    static int[] rowBands(Mat boxInk) {
        int bw = boxInk.cols();
        Mat sums = new Mat();
        try {
            Core.reduce(boxInk, sums, 1, Core.REDUCE_SUM, CvType.CV_32S);
            int bands = 0, rulings = 0;
            boolean inBand = false, inRuling = false;
            for (int y = 0; y < sums.rows(); y++) {
                double count = sums.get(y, 0)[0] / 255.0;
                boolean bandRow = count > 0;
                boolean rulingRow = count >= bw * RULING_FILL;
                if (bandRow && !inBand) bands++;
                if (rulingRow && !inRuling) rulings++;
                inBand = bandRow;
                inRuling = rulingRow;
            }
            return new int[]{bands, rulings};
        } finally {
            sums.release();
        }
    }

    /**
     * Tight box of the original ink inside a merged region, in page
     * coordinates, or null when the region holds none.
     */
    private static Rect inkBounds(Mat ink, Rect region) {
        Mat roi = ink.submat(region);
        try {
            Rect tight = Imgproc.boundingRect(roi);
            if (tight.width == 0 || tight.height == 0) return null;
            return new Rect(region.x + tight.x, region.y + tight.y, tight.width, tight.height);
        } finally {
            roi.release();
        }
    }
}
