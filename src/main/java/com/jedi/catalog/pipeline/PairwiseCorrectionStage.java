package com.jedi.catalog.pipeline;

import com.jedi.catalog.algorithm.CorrectionResult;
import com.jedi.catalog.algorithm.LightCurveCorrector;
import com.jedi.catalog.series.LightCurve;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the flare removal correction for every ordered channel pair.
 * Stops at the first failing pair; the failure is the last entry of the result map.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PairwiseCorrectionStage {

    private final LightCurveCorrector corrector;

    /**
     * @param channels percent-unit curves keyed by channel label
     * @return one result per pair label, in pair order
     */
    public Map<String, StageResult<CorrectionResult>> apply(Map<String, LightCurve> channels,
                                                             List<ChannelPair> pairs,
                                                             LocalDateTime flarePeakTime) {
        Map<String, StageResult<CorrectionResult>> results = new LinkedHashMap<>();

        for (ChannelPair pair : pairs) {
            LightCurve minuend = channels.get(pair.minuend());
            LightCurve subtrahend = channels.get(pair.subtrahend());

            if (isAllMissing(minuend) || isAllMissing(subtrahend)) {
                results.put(pair.label(), StageResult.skipped("all irradiances are NaN"));
                continue;
            }

            try {
                results.put(pair.label(), StageResult.computed(corrector.correct(minuend, subtrahend, flarePeakTime)));
            } catch (RuntimeException e) {
                log.error("Correction of {} failed: {}", pair.label(), e.getMessage());
                results.put(pair.label(), StageResult.failed(e));
                break;
            }
        }

        return results;
    }

    private static boolean isAllMissing(LightCurve curve) {
        return curve == null || curve.isAllMissing();
    }
}
