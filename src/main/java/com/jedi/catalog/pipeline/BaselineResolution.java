package com.jedi.catalog.pipeline;

/**
 * Outcome of the baseline decision for one flare.
 */
public record BaselineResolution(BaselineState state, boolean recomputed, double minutesSinceLastFlare) {
}
