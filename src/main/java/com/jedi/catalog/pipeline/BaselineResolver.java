package com.jedi.catalog.pipeline;

import com.google.common.collect.Range;
import com.jedi.catalog.algorithm.PreflareIrradianceEstimator;
import com.jedi.catalog.series.IrradianceTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides whether a flare gets a fresh pre-flare baseline or reuses the previous one.
 *
 * <p>A flare that follows the previous flare by more than the threshold is considered independent
 * and gets its baseline from the window {@code [peak - threshold, peak]}. Otherwise the previous
 * baseline, including its window bounds, is reused. Nothing can be reused before the first
 * computation, so an empty state always triggers one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BaselineResolver {

    private final PreflareIrradianceEstimator estimator;

    public BaselineResolution resolve(LocalDateTime previousPeakTime,
                                      FlareEvent flare,
                                      IrradianceTable table,
                                      double thresholdMinutes,
                                      BaselineState previous) {
        double minutesSinceLastFlare = Duration.between(previousPeakTime, flare.peakTime()).toMillis() / 60_000.0;

        if (minutesSinceLastFlare <= thresholdMinutes && !previous.isEmpty()) {
            return new BaselineResolution(previous, false, minutesSinceLastFlare);
        }

        LocalDateTime windowEnd = flare.peakTime();
        LocalDateTime windowStart = windowEnd.minusSeconds(Math.round(thresholdMinutes * 60.0));
        IrradianceTable preflare = table.slice(Range.closed(windowStart, windowEnd));

        Map<String, Double> irradiance = new LinkedHashMap<>();
        for (String channel : table.getChannels()) {
            irradiance.put(channel, estimator.estimate(preflare.curve(channel), flare.startTime()));
        }

        log.debug("Event {}: pre-flare irradiance computed over {} to {} for {} channels",
                flare.index(), windowStart, windowEnd, irradiance.size());
        return new BaselineResolution(new BaselineState(irradiance, windowStart, windowEnd), true, minutesSinceLastFlare);
    }
}
