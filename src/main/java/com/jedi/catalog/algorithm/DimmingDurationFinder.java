package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;

import java.time.LocalDateTime;

@FunctionalInterface
public interface DimmingDurationFinder {

    DurationResult findDuration(LightCurve curve, LocalDateTime earliestAllowedTime);
}
