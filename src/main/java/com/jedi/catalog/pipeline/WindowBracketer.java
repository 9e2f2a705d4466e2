package com.jedi.catalog.pipeline;

import java.time.LocalDateTime;

/**
 * Brackets the dimming window around a flare peak.
 */
public final class WindowBracketer {

    private WindowBracketer() {}

    /**
     * left = peak + leftOffset, right = min(next peak, peak + rightOffset).
     * The window is interrupted when the next peak is the limiting bound.
     *
     * @param nextFlarePeakTime null for the last flare of the list
     */
    public static AnalysisWindow bracket(LocalDateTime peakTime,
                                         double leftOffsetMinutes,
                                         double rightOffsetMinutes,
                                         LocalDateTime nextFlarePeakTime) {
        LocalDateTime left = plusMinutes(peakTime, leftOffsetMinutes);
        LocalDateTime userChoice = plusMinutes(peakTime, rightOffsetMinutes);

        if (nextFlarePeakTime == null || userChoice.isBefore(nextFlarePeakTime)) {
            return new AnalysisWindow(left, userChoice, false);
        }
        return new AnalysisWindow(left, nextFlarePeakTime, true);
    }

    static LocalDateTime plusMinutes(LocalDateTime time, double minutes) {
        return time.plusNanos(Math.round(minutes * 60_000_000_000.0));
    }
}
