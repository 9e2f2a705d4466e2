package com.jedi.catalog.algorithm;

import com.google.common.collect.Range;
import com.jedi.catalog.series.LightCurve;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Slopes between consecutive finite samples inside the allowed time range, in percent per second.
 */
@Component
public class FiniteDifferenceSlopeFinder implements DimmingSlopeFinder {

    @Override
    public SlopeResult findSlope(LightCurve curve, LocalDateTime earliestAllowedTime, LocalDateTime latestAllowedTime) {
        if (earliestAllowedTime == null || latestAllowedTime == null || latestAllowedTime.isBefore(earliestAllowedTime)) {
            return SlopeResult.undefined();
        }

        LightCurve bounded = curve.between(Range.closed(earliestAllowedTime, latestAllowedTime));

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        int count = 0;
        int previous = -1;
        for (int i = 0; i < bounded.size(); i++) {
            if (!Double.isFinite(bounded.valueAt(i))) {
                continue;
            }
            if (previous >= 0) {
                double seconds = Duration.between(bounded.timeAt(previous), bounded.timeAt(i)).toMillis() / 1000.0;
                double slope = (bounded.valueAt(i) - bounded.valueAt(previous)) / seconds;
                min = Math.min(min, slope);
                max = Math.max(max, slope);
                sum += slope;
                count++;
            }
            previous = i;
        }

        if (count == 0) {
            return SlopeResult.undefined();
        }
        return new SlopeResult(min, max, sum / count);
    }
}
