package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;

/**
 * Output of a pairwise light curve correction.
 *
 * @param corrected         the first curve with the second curve's contribution removed
 * @param timeShiftSeconds  shift applied to the second curve, NaN when undefined
 * @param scaleFactor       scale applied to the second curve, NaN when undefined
 */
public record CorrectionResult(LightCurve corrected, double timeShiftSeconds, double scaleFactor) {
}
