package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;

/**
 * Smooths a light curve to reduce the influence of noise on the dimming parameters.
 */
@FunctionalInterface
public interface LightCurveFitter {

    /**
     * @param curve       light curve in percent units
     * @param uncertainty per-sample uncertainty, same length as the curve
     */
    FitResult fit(LightCurve curve, double[] uncertainty);
}
