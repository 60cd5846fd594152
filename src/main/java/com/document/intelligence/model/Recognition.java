package com.document.intelligence.model;

import lombok.Value;

/**
 * Output of the text recognition capability for one image region.
 */
@Value
public class Recognition {

    String text;
    double confidence;                 // 0.0 - 1.0

    public static Recognition empty() {
        return new Recognition("", 0.0);
    }
}
