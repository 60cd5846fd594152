package com.document.intelligence.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A sub-rectangle of a zone, as ratios of the zone's own width and height.
 */
@Value
@Builder
@Jacksonized
public class RelativeBox {

    double x;
    double y;
    double width;
    double height;

    public static RelativeBox whole() {
        return new RelativeBox(0.0, 0.0, 1.0, 1.0);
    }
}
