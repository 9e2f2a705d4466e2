package com.jedi.catalog.algorithm;

/**
 * Dimming slopes in percent per second.
 */
public record SlopeResult(double minPercentPerSecond, double maxPercentPerSecond, double meanPercentPerSecond) {

    public static SlopeResult undefined() {
        return new SlopeResult(Double.NaN, Double.NaN, Double.NaN);
    }
}
