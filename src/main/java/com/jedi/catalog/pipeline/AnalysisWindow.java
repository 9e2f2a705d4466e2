package com.jedi.catalog.pipeline;

import com.google.common.collect.Range;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Time window searched for dimming. {@code interrupted} is set when the next flare cut it short.
 */
public record AnalysisWindow(LocalDateTime left, LocalDateTime right, boolean interrupted) {

    public double durationMinutes() {
        return Duration.between(left, right).toMillis() / 60_000.0;
    }

    public Range<LocalDateTime> range() {
        return Range.closed(left, right);
    }
}
