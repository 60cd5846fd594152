package com.document.intelligence.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A classified region of a page. Every coordinate is a ratio of the page
 * width or height, so two scans of the same layout at different resolutions
 * produce the same zone.
 */
@Value
@Builder
@Jacksonized
public class Zone {

    ZoneKind kind;
    double x;
    double y;
    double width;
    double height;

    // fraction of the zone's box covered by ink
    double density;

    @JsonIgnore
    public double getAreaRatio() {
        return width * height;
    }

    @JsonIgnore
    public double getCenterY() {
        return y + height / 2.0;
    }

    /**
     * Intersection-over-union of the two boxes, both in ratio space.
     */
    public double overlap(Zone other) {
        double left = Math.max(x, other.x);
        double top = Math.max(y, other.y);
        double right = Math.min(x + width, other.x + other.width);
        double bottom = Math.min(y + height, other.y + other.height);

        if (right <= left || bottom <= top) return 0.0;

        double intersection = (right - left) * (bottom - top);
        double union = getAreaRatio() + other.getAreaRatio() - intersection;
        return union <= 0 ? 0.0 : intersection / union;
    }

    /**
     * Euclidean distance over position, size and area ratios.
     */
    public double distanceTo(Zone other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dw = width - other.width;
        double dh = height - other.height;
        double da = getAreaRatio() - other.getAreaRatio();
        return Math.sqrt(dx * dx + dy * dy + dw * dw + dh * dh + da * da);
    }
}
