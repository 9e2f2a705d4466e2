package com.jedi.catalog.algorithm;

import com.jedi.catalog.series.LightCurve;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Peak-match-subtract: aligns the peak of the correcting curve with the peak of the curve to correct,
 * scales it to the same peak height and subtracts it.
 */
@Component
@Slf4j
public class PeakMatchSubtractCorrector implements LightCurveCorrector {

    private final double peakSearchMinutes;

    public PeakMatchSubtractCorrector(@Value("${jedi.algorithm.correction.peak-search-minutes:30}") double peakSearchMinutes) {
        this.peakSearchMinutes = peakSearchMinutes;
    }

    @Override
    public CorrectionResult correct(LightCurve toCorrect, LightCurve correctWith, LocalDateTime flarePeakTime) {
        if (toCorrect.size() != correctWith.size()) {
            throw new IllegalArgumentException("Light curves must share one time index ("
                    + toCorrect.size() + " vs " + correctWith.size() + " samples)");
        }

        int peakIndex = findPeakIndex(toCorrect, flarePeakTime);
        int otherPeakIndex = findPeakIndex(correctWith, flarePeakTime);
        if (peakIndex < 0 || otherPeakIndex < 0) {
            log.debug("No peak found near {}, correction undefined", flarePeakTime);
            return undefined(toCorrect);
        }

        double otherPeak = correctWith.valueAt(otherPeakIndex);
        if (otherPeak == 0.0) {
            return undefined(toCorrect);
        }
        double scaleFactor = toCorrect.valueAt(peakIndex) / otherPeak;
        int shiftSamples = peakIndex - otherPeakIndex;
        double timeShiftSeconds = Duration.between(correctWith.timeAt(otherPeakIndex), toCorrect.timeAt(peakIndex))
                .toMillis() / 1000.0;

        double[] corrected = new double[toCorrect.size()];
        for (int i = 0; i < corrected.length; i++) {
            int shifted = i - shiftSamples;
            if (shifted < 0 || shifted >= corrected.length) {
                corrected[i] = Double.NaN;
            } else {
                corrected[i] = toCorrect.valueAt(i) - scaleFactor * correctWith.valueAt(shifted);
            }
        }

        return new CorrectionResult(toCorrect.withValues(corrected), timeShiftSeconds, scaleFactor);
    }

    private int findPeakIndex(LightCurve curve, LocalDateTime flarePeakTime) {
        long searchSeconds = Math.round(peakSearchMinutes * 60.0);
        LocalDateTime from = flarePeakTime.minusSeconds(searchSeconds);
        LocalDateTime to = flarePeakTime.plusSeconds(searchSeconds);

        int best = -1;
        for (int i = 0; i < curve.size(); i++) {
            LocalDateTime time = curve.timeAt(i);
            double value = curve.valueAt(i);
            if (time.isBefore(from) || time.isAfter(to) || !Double.isFinite(value)) {
                continue;
            }
            if (best < 0 || value > curve.valueAt(best)) {
                best = i;
            }
        }
        return best;
    }

    private CorrectionResult undefined(LightCurve toCorrect) {
        return new CorrectionResult(LightCurve.missing(toCorrect.getTimes()), Double.NaN, Double.NaN);
    }
}
