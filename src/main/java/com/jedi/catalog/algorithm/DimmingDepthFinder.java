package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;

@FunctionalInterface
public interface DimmingDepthFinder {

    DepthResult findDepth(LightCurve curve);
}
