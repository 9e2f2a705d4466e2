package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Arrays;

/**
 * Pre-flare irradiance from the medians of three consecutive sub-windows before the flare start.
 * The estimate is only accepted when the sub-windows agree with each other and are individually quiet.
 */
@Component
@Slf4j
public class MedianPreflareIrradianceEstimator implements PreflareIrradianceEstimator {

    private static final int SUB_WINDOWS = 3;

    private final double maxMedianDiffPercent;
    private final double maxStdPercent;

    public MedianPreflareIrradianceEstimator(
            @Value("${jedi.algorithm.preflare.max-median-diff-percent:1.5}") double maxMedianDiffPercent,
            @Value("${jedi.algorithm.preflare.max-std-percent:0.5}") double maxStdPercent) {
        this.maxMedianDiffPercent = maxMedianDiffPercent;
        this.maxStdPercent = maxStdPercent;
    }

    @Override
    public double estimate(LightCurve preflareCurve, LocalDateTime flareStartTime) {
        LightCurve quiet = preflareCurve.before(flareStartTime);
        if (quiet.countFinite() < SUB_WINDOWS) {
            // Flare started before the window, fall back to the whole slice
            quiet = preflareCurve;
        }

        double[] finite = Arrays.stream(quiet.toArray()).filter(Double::isFinite).toArray();
        if (finite.length < SUB_WINDOWS) {
            log.debug("Not enough finite samples for pre-flare estimate (have {}, need {})", finite.length, SUB_WINDOWS);
            return Double.NaN;
        }

        Median median = new Median();
        StandardDeviation standardDeviation = new StandardDeviation();
        double[] medians = new double[SUB_WINDOWS];
        double[] stds = new double[SUB_WINDOWS];
        for (int w = 0; w < SUB_WINDOWS; w++) {
            int from = w * finite.length / SUB_WINDOWS;
            int to = (w + 1) * finite.length / SUB_WINDOWS;
            double[] chunk = Arrays.copyOfRange(finite, from, to);
            medians[w] = median.evaluate(chunk);
            stds[w] = standardDeviation.evaluate(chunk);
        }

        double meanOfMedians = new Mean().evaluate(medians);
        if (meanOfMedians == 0.0) {
            return Double.NaN;
        }

        for (int w = 0; w < SUB_WINDOWS; w++) {
            double medianDiffPercent = Math.abs(medians[w] - meanOfMedians) / Math.abs(meanOfMedians) * 100.0;
            double stdPercent = stds[w] / Math.abs(meanOfMedians) * 100.0;
            if (medianDiffPercent > maxMedianDiffPercent || stdPercent > maxStdPercent) {
                log.debug("Pre-flare window {} rejected: median diff {}%, std {}%", w, medianDiffPercent, stdPercent);
                return Double.NaN;
            }
        }

        return meanOfMedians;
    }
}
