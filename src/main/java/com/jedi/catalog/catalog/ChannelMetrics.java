package com.jedi.catalog.catalog;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ChannelMetrics {

    // W/m2
    private double preflareIrradiance = Double.NaN;

    private LightCurveMetrics metrics = new LightCurveMetrics();
}
