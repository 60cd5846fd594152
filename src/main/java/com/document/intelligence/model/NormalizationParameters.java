package com.document.intelligence.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * What the normalizer measured and did, kept with the document for audit.
 */
@Value
@Builder
@Jacksonized
public class NormalizationParameters {

    public enum DpiSource { METADATA, ESTIMATED, ASSUMED }

    public enum ThresholdMethod { OTSU, GAUSSIAN }

    double skewAngle;                  // degrees, positive = lines fall to the right
    boolean skewCorrected;

    int estimatedDpi;
    DpiSource dpiSource;
    double scaleFactor;

    ThresholdMethod thresholdMethod;
    int globalThreshold;               // Otsu level, -1 for adaptive

    // crop applied by border removal, in pixels of the scaled image
    int cropX;
    int cropY;
    int cropWidth;
    int cropHeight;

    // steps that could not converge and passed the image through unchanged
    @Singular
    List<String> degradedSteps;
}
