package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;

import java.time.LocalDateTime;

/**
 * Removes one channel's flare contribution from another.
 */
@FunctionalInterface
public interface LightCurveCorrector {

    CorrectionResult correct(LightCurve toCorrect, LightCurve correctWith, LocalDateTime flarePeakTime);
}
