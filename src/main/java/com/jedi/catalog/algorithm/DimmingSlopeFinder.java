package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;

import java.time.LocalDateTime;

@FunctionalInterface
public interface DimmingSlopeFinder {

    /**
     * @param latestAllowedTime may be null when no dimming depth was found
     */
    SlopeResult findSlope(LightCurve curve, LocalDateTime earliestAllowedTime, LocalDateTime latestAllowedTime);
}
