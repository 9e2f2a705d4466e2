package com.jedi.catalog.pipeline;

import com.jedi.catalog.algorithm.DepthResult;
import com.jedi.catalog.algorithm.DimmingDepthFinder;
import com.jedi.catalog.algorithm.DimmingDurationFinder;
import com.jedi.catalog.algorithm.DimmingSlopeFinder;
import com.jedi.catalog.algorithm.DurationResult;
import com.jedi.catalog.algorithm.SlopeResult;
import com.jedi.catalog.series.LightCurve;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameterizes every fitted curve: depth, then slope up to the depth time,
 * then duration from the slope start. Stops at the first failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ParameterizationStage {

    private final DimmingDepthFinder depthFinder;
    private final DimmingSlopeFinder slopeFinder;
    private final DimmingDurationFinder durationFinder;

    public Map<String, StageResult<DimmingParameters>> apply(Map<String, LightCurve> curves, LocalDateTime flarePeakTime) {
        Map<String, StageResult<DimmingParameters>> results = new LinkedHashMap<>();

        for (Map.Entry<String, LightCurve> entry : curves.entrySet()) {
            LightCurve curve = entry.getValue();
            if (curve.isAllMissing()) {
                results.put(entry.getKey(), StageResult.skipped("all irradiances are NaN"));
                continue;
            }

            try {
                results.put(entry.getKey(), StageResult.computed(parameterize(curve, flarePeakTime)));
            } catch (RuntimeException e) {
                log.error("Parameterization of {} failed: {}", entry.getKey(), e.getMessage());
                results.put(entry.getKey(), StageResult.failed(e));
                break;
            }
        }

        return results;
    }

    DimmingParameters parameterize(LightCurve curve, LocalDateTime flarePeakTime) {
        DepthResult depth = depthFinder.findDepth(curve);
        SlopeStep slope = measureSlope(curve, flarePeakTime, depth);
        DurationResult duration = measureDuration(curve, slope);
        return new DimmingParameters(depth, slope.startTime(), slope.endTime(), slope.result(), duration);
    }

    private SlopeStep measureSlope(LightCurve curve, LocalDateTime flarePeakTime, DepthResult depth) {
        LocalDateTime start = flarePeakTime;
        LocalDateTime end = depth.depthTime();
        if (!depth.isDefined()) {
            log.debug("No dimming depth found, slope search from {} has no end bound", start);
        }
        return new SlopeStep(start, end, slopeFinder.findSlope(curve, start, end));
    }

    private DurationResult measureDuration(LightCurve curve, SlopeStep slope) {
        return durationFinder.findDuration(curve, slope.startTime());
    }

    private record SlopeStep(LocalDateTime startTime, LocalDateTime endTime, SlopeResult result) {
    }
}
