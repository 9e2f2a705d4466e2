package com.jedi.catalog.pipeline;

import java.time.LocalDateTime;

/**
 * A GOES flare as loaded from the event list.
 *
 * @param index position in the ascending peak time ordered list
 */
public record FlareEvent(int index, LocalDateTime startTime, LocalDateTime peakTime, String goesClass) {
}
