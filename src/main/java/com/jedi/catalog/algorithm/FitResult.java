package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;

/**
 * Smoothed light curve plus the selected shape parameter and its goodness-of-fit score.
 */
public record FitResult(LightCurve fitted, double gamma, double score) {
}
