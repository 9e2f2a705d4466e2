package com.jedi.catalog.catalog;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Fit and dimming parameters of one channel or pair curve. NaN and null mean missing.
 */
@Data
@NoArgsConstructor
public class LightCurveMetrics {

    // Fitting
    private double fittingGamma = Double.NaN;
    private double fittingScore = Double.NaN;

    // Depth
    private double depthPercent = Double.NaN;
    private LocalDateTime depthTime;

    // Slope, bounded by [slopeStartTime, slopeEndTime]
    private LocalDateTime slopeStartTime;
    private LocalDateTime slopeEndTime;
    private double slopeMin = Double.NaN;
    private double slopeMax = Double.NaN;
    private double slopeMean = Double.NaN;

    // Duration
    private double durationSeconds = Double.NaN;
    private LocalDateTime durationStartTime;
    private LocalDateTime durationEndTime;
}
