package com.jedi.catalog.pipeline;

import com.jedi.catalog.series.IrradianceTable;
import com.jedi.catalog.series.LightCurve;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts absolute irradiance to percent deviation from the pre-flare baseline.
 */
public final class UnitNormalizer {

    private UnitNormalizer() {}

    /**
     * (value - baseline) / baseline * 100 for every sample. Missing on either side gives missing.
     */
    public static Map<String, LightCurve> toPercent(IrradianceTable window, BaselineState baseline) {
        Map<String, LightCurve> percent = new LinkedHashMap<>();
        for (String channel : window.getChannels()) {
            LightCurve curve = window.curve(channel);
            double reference = baseline.valueFor(channel);
            double[] values = new double[curve.size()];
            for (int i = 0; i < values.length; i++) {
                double value = (curve.valueAt(i) - reference) / reference * 100.0;
                values[i] = Double.isFinite(value) ? value : Double.NaN;
            }
            percent.put(channel, curve.withValues(values));
        }
        return percent;
    }
}
