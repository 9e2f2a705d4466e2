package com.jedi.catalog.config;

import com.google.common.base.Preconditions;

import java.nio.file.Path;

/**
 * Parameters of one catalog run.
 *
 * @param thresholdTimePriorFlareMinutes       how long before a flare the previous one must have peaked
 *                                             for the flare to get its own pre-flare baseline
 * @param dimmingWindowRelativeToFlareMinutesLeft  left edge of the dimming window relative to the peak,
 *                                                 negative means before the peak
 * @param dimmingWindowRelativeToFlareMinutesRight right edge of the dimming window relative to the peak,
 *                                                 cut short by the next flare's peak
 * @param thresholdMinimumDimmingWindowMinutes shortest window worth parameterizing
 * @param fitUncertainty                       per-sample uncertainty handed to the fitter, in percent
 * @param outputPath                           directory receiving the catalog file
 * @param verbose                              narrate every processing decision at INFO
 */
public record CatalogSettings(double thresholdTimePriorFlareMinutes,
                              double dimmingWindowRelativeToFlareMinutesLeft,
                              double dimmingWindowRelativeToFlareMinutesRight,
                              double thresholdMinimumDimmingWindowMinutes,
                              double fitUncertainty,
                              Path outputPath,
                              boolean verbose) {

    public static CatalogSettings defaults(Path outputPath) {
        return new CatalogSettings(240.0, 0.0, 240.0, 120.0, 0.002545, outputPath, false);
    }

    /**
     * Fails fast on settings the flare loop cannot work with.
     */
    public CatalogSettings validate() {
        Preconditions.checkArgument(thresholdTimePriorFlareMinutes >= 0,
                "threshold-time-prior-flare-minutes must not be negative: %s", thresholdTimePriorFlareMinutes);
        Preconditions.checkArgument(dimmingWindowRelativeToFlareMinutesRight > dimmingWindowRelativeToFlareMinutesLeft,
                "Dimming window right offset (%s) must be after the left offset (%s)",
                dimmingWindowRelativeToFlareMinutesRight, dimmingWindowRelativeToFlareMinutesLeft);
        Preconditions.checkArgument(thresholdMinimumDimmingWindowMinutes >= 0,
                "threshold-minimum-dimming-window-minutes must not be negative: %s", thresholdMinimumDimmingWindowMinutes);
        Preconditions.checkArgument(fitUncertainty > 0, "fit-uncertainty must be positive: %s", fitUncertainty);
        Preconditions.checkArgument(outputPath != null && !outputPath.toString().isBlank(), "output-path must be set");
        return this;
    }
}
