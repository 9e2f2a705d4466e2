package com.jedi.catalog.algorithm;

import java.time.LocalDateTime;

/**
 * Dimming depth in percent below baseline. {@code depthTime} is null when no dimming was found.
 */
public record DepthResult(double depthPercent, LocalDateTime depthTime) {

    public static DepthResult undefined() {
        return new DepthResult(Double.NaN, null);
    }

    public boolean isDefined() {
        return depthTime != null;
    }
}
