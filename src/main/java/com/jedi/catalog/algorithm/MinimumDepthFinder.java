package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;
import org.springframework.stereotype.Component;

/**
 * Depth is the deepest point below baseline (0 %). A curve that never drops below baseline has no depth.
 */
@Component
public class MinimumDepthFinder implements DimmingDepthFinder {

    @Override
    public DepthResult findDepth(LightCurve curve) {
        int minIndex = -1;
        for (int i = 0; i < curve.size(); i++) {
            double value = curve.valueAt(i);
            if (Double.isFinite(value) && (minIndex < 0 || value < curve.valueAt(minIndex))) {
                minIndex = i;
            }
        }

        if (minIndex < 0 || curve.valueAt(minIndex) >= 0) {
            return DepthResult.undefined();
        }
        return new DepthResult(-curve.valueAt(minIndex), curve.timeAt(minIndex));
    }
}
