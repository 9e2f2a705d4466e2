package com.jedi.catalog.pipeline;

import com.jedi.catalog.algorithm.DepthResult;
import com.jedi.catalog.algorithm.DurationResult;
import com.jedi.catalog.algorithm.SlopeResult;

import java.time.LocalDateTime;

/**
 * Depth, slope and duration of one curve, with the slope search bounds that were used.
 */
public record DimmingParameters(DepthResult depth,
                                LocalDateTime slopeStartTime,
                                LocalDateTime slopeEndTime,
                                SlopeResult slope,
                                DurationResult duration) {
}
