package com.jedi.catalog.pipeline;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pre-flare irradiance per channel together with the window it was computed over.
 * Returned by each flare iteration and handed to the next one.
 */
public record BaselineState(Map<String, Double> irradiance, LocalDateTime windowStart, LocalDateTime windowEnd) {

    private static final BaselineState EMPTY = new BaselineState(Map.of(), null, null);

    public BaselineState {
        irradiance = Collections.unmodifiableMap(new LinkedHashMap<>(irradiance));
    }

    public static BaselineState empty() {
        return EMPTY;
    }

    /**
     * True until the first baseline has been computed.
     */
    public boolean isEmpty() {
        return windowStart == null;
    }

    /**
     * Baseline of a channel, NaN when unknown.
     */
    public double valueFor(String channel) {
        Double value = irradiance.get(channel);
        return value != null ? value : Double.NaN;
    }
}
