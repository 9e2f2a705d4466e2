package com.jedi.catalog.algorithm;

import java.time.LocalDateTime;

/**
 * Dimming duration. Start and end are null when no complete dimming interval was found.
 */
public record DurationResult(double seconds, LocalDateTime startTime, LocalDateTime endTime) {

    public static DurationResult undefined() {
        return new DurationResult(Double.NaN, null, null);
    }
}
