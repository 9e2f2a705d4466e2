package com.jedi.catalog.pipeline;

import com.jedi.catalog.algorithm.FitResult;
import com.jedi.catalog.algorithm.LightCurveFitter;
import com.jedi.catalog.series.LightCurve;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fits every channel and derived pair curve. Stops at the first failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FittingStage {

    private final LightCurveFitter fitter;

    public Map<String, StageResult<FitResult>> apply(Map<String, LightCurve> curves, double uncertainty) {
        Map<String, StageResult<FitResult>> results = new LinkedHashMap<>();

        for (Map.Entry<String, LightCurve> entry : curves.entrySet()) {
            LightCurve curve = entry.getValue();
            if (curve.isAllMissing()) {
                results.put(entry.getKey(), StageResult.skipped("all irradiances are NaN"));
                continue;
            }

            double[] sampleUncertainty = new double[curve.size()];
            Arrays.fill(sampleUncertainty, uncertainty);

            try {
                results.put(entry.getKey(), StageResult.computed(fitter.fit(curve, sampleUncertainty)));
            } catch (RuntimeException e) {
                log.error("Fitting of {} failed: {}", entry.getKey(), e.getMessage());
                results.put(entry.getKey(), StageResult.failed(e));
                break;
            }
        }

        return results;
    }
}
