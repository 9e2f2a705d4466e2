package com.jedi.catalog.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;

/**
 * One sample time of the irradiance file. Values are keyed by channel in file column order;
 * null is a missing sample.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IrradianceRowDTO {
    private LocalDateTime sampleTime;
    private LinkedHashMap<String, Double> irradiance;
}
