package com.document.intelligence.config;

import com.document.intelligence.model.NormalizationParameters.ThresholdMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Every tunable of the pipeline, bound from the {@code docintel.*} namespace.
 * Defaults here are the production defaults; application.yml only overrides.
 */
@Data
@ConfigurationProperties(prefix = "docintel")
public class PipelineProperties {

    private Preprocessing preprocessing = new Preprocessing();
    private Signature signature = new Signature();
    private Matching matching = new Matching();
    private Extraction extraction = new Extraction();
    private Validation validation = new Validation();
    private Templates templates = new Templates();
    private Lifecycle lifecycle = new Lifecycle();
    private Ocr ocr = new Ocr();
    private Downstream downstream = new Downstream();

    @Data
    public static class Preprocessing {
        private boolean deskewEnabled = true;
        private double maxSkewAngle = 10.0;
        private double minCorrectionAngle = 0.5;
        // Canny + probabilistic Hough line detection
        private int houghThreshold = 100;
        private int minLineLength = 100;
        private int maxLineGap = 10;

        private boolean denoiseEnabled = true;
        private DenoiseLevel denoiseLevel = DenoiseLevel.MEDIUM;
        private int denoiseTemplateWindow = 7;
        private int denoiseSearchWindow = 21;

        private ThresholdMethod binarizationMethod = ThresholdMethod.OTSU;
        private int adaptiveBlockSize = 11;
        private int adaptiveConstant = 2;

        private boolean scaleEnabled = true;
        private int targetDpi = 300;
        private int assumedDpi = 200;
        private int pdfRenderDpi = 300;

        private boolean borderRemovalEnabled = true;
    }

    public enum DenoiseLevel {
        LOW(3), MEDIUM(5), HIGH(7);

        private final int strength;

        DenoiseLevel(int strength) {
            this.strength = strength;
        }

        public int strength() {
            return strength;
        }
    }

    @Data
    public static class Signature {
        private double minRegionAreaRatio = 0.001;
        // dilation kernel, as fractions of page width / height
        private double mergeWidthRatio = 0.015;
        private double mergeHeightRatio = 0.006;
    }

    @Data
    public static class Matching {
        private double autoMatchThreshold = 0.85;
        private double partialMatchThreshold = 0.60;
        private int suggestionCount = 5;
        private double zoneCountWeight = 0.30;
        private double contentRatioWeight = 0.20;
        private double zoneLayoutWeight = 0.50;
    }

    @Data
    public static class Extraction {
        // template/document zone IoU at or above which no drift discount applies
        private double goodOverlap = 0.8;
        private double unparseableFactor = 0.5;
    }

    @Data
    public static class Validation {
        private List<String> highStakesFields = new ArrayList<>(List.of("total_amount"));
        private double highStakesFloor = 0.99;
        private double defaultFieldFloor = 0.85;
        private int warningReviewThreshold = 3;
        private double subtotalTolerance = 0.01;
        private double minTaxRate = 0.0;
        private double maxTaxRate = 0.15;
        private Rules rules = new Rules();
    }

    /** Field names the cross-field business rules read. */
    @Data
    public static class Rules {
        private String totalField = "total_amount";
        private String subtotalField = "subtotal";
        private String taxField = "tax_amount";
        private String taxableField = "amount_taxable";
        private String lineItemsField = "line_items";
        private String dateField = "receipt_date";
    }

    @Data
    public static class Templates {
        private Duration cacheTtl = Duration.ofHours(24);
        private Duration refreshLockTimeout = Duration.ofSeconds(2);
        private String syncBaseUrl = "http://localhost:8000";
        private String apiKey;
        private Duration syncTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Lifecycle {
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private Path workDir = Path.of("data", "documents");
        private boolean recoverOnStartup = true;
        private StageTimeouts stageTimeouts = new StageTimeouts();
    }

    @Data
    public static class StageTimeouts {
        private Duration preprocessing = Duration.ofSeconds(120);
        private Duration matching = Duration.ofSeconds(60);
        private Duration extracting = Duration.ofSeconds(180);
    }

    @Data
    public static class Ocr {
        private String engine = "tesseract";
        private String datapath;
        private String language = "eng";
    }

    @Data
    public static class Downstream {
        private String baseUrl = "http://localhost:8000";
        private String apiKey;
    }
}
