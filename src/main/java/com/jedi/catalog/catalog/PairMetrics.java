package com.jedi.catalog.catalog;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class PairMetrics {

    private double correctionTimeShiftSeconds = Double.NaN;
    private double correctionScaleFactor = Double.NaN;

    private LightCurveMetrics metrics = new LightCurveMetrics();
}
