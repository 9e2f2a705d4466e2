package com.jedi.catalog.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlareEventDTO {
    private LocalDateTime startTime;
    private LocalDateTime peakTime;
    private String goesClass;
}
