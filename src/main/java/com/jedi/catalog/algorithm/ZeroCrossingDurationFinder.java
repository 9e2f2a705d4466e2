package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Duration between the curve dropping below baseline and its recovery back to baseline.
 */
@Component
public class ZeroCrossingDurationFinder implements DimmingDurationFinder {

    @Override
    public DurationResult findDuration(LightCurve curve, LocalDateTime earliestAllowedTime) {
        LocalDateTime start = null;
        LocalDateTime end = null;
        double previous = Double.NaN;

        for (int i = 0; i < curve.size(); i++) {
            double value = curve.valueAt(i);
            if (!Double.isFinite(value)) {
                continue;
            }
            if (earliestAllowedTime != null && curve.timeAt(i).isBefore(earliestAllowedTime)) {
                previous = value;
                continue;
            }
            if (start == null) {
                if (Double.isFinite(previous) && previous >= 0 && value < 0) {
                    start = curve.timeAt(i);
                }
            } else if (value >= 0) {
                end = curve.timeAt(i);
                break;
            }
            previous = value;
        }

        if (start == null || end == null) {
            return DurationResult.undefined();
        }
        return new DurationResult(Duration.between(start, end).toMillis() / 1000.0, start, end);
    }
}
