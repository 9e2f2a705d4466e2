package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;

import java.time.LocalDateTime;

/**
 * Estimates the pre-flare (un-dimmed) irradiance of one channel.
 */
@FunctionalInterface
public interface PreflareIrradianceEstimator {

    /**
     * @param preflareCurve  the channel sliced to the pre-flare window
     * @param flareStartTime GOES start time of the flare
     * @return baseline irradiance, NaN when it cannot be determined
     */
    double estimate(LightCurve preflareCurve, LocalDateTime flareStartTime);
}
