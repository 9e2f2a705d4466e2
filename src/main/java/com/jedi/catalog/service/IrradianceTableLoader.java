package com.jedi.catalog.service;

import com.google.common.base.Preconditions;
import com.jedi.catalog.config.CatalogSettings;
import com.jedi.catalog.persistence.IrradianceSampleEntity;
import com.jedi.catalog.persistence.IrradianceSampleRepository;
import com.jedi.catalog.pipeline.FlareEvent;
import com.jedi.catalog.series.IrradianceTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pivots stored long-format irradiance samples into a wide {@link IrradianceTable}.
 * Channels keep the order in which they were first stored; a time without a sample for a
 * channel is missing for that channel.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IrradianceTableLoader {

    private final IrradianceSampleRepository repository;

    /**
     * Loads the span the flare list needs: from the first peak minus the baseline threshold,
     * or plus the left window offset when that reaches further back, to the last peak plus
     * the right window offset.
     */
    public IrradianceTable loadFor(List<FlareEvent> flares, CatalogSettings settings) {
        Preconditions.checkArgument(!flares.isEmpty(), "Flare list is empty");
        double leadMinutes = Math.min(-settings.thresholdTimePriorFlareMinutes(),
                settings.dimmingWindowRelativeToFlareMinutesLeft());
        LocalDateTime start = flares.get(0).peakTime().plusSeconds(Math.round(leadMinutes * 60.0));
        LocalDateTime end = flares.get(flares.size() - 1).peakTime()
                .plusSeconds(Math.round(Math.max(settings.dimmingWindowRelativeToFlareMinutesRight(), 0.0) * 60.0));
        repository.findMinSampleTime()
                .filter(first -> first.isAfter(start))
                .ifPresent(first -> log.warn("Stored irradiance starts at {}, after the needed start {}", first, start));
        repository.findMaxSampleTime()
                .filter(last -> last.isBefore(end))
                .ifPresent(last -> log.warn("Stored irradiance ends at {}, before the needed end {}", last, end));
        return load(start, end);
    }

    public IrradianceTable load(LocalDateTime start, LocalDateTime end) {
        List<String> channels = repository.findChannelsInInsertionOrder();
        List<IrradianceSampleEntity> samples = repository.findSamplesBetween(start, end);

        List<LocalDateTime> times = new ArrayList<>();
        Map<LocalDateTime, Integer> rowOf = new LinkedHashMap<>();
        for (IrradianceSampleEntity sample : samples) {
            if (!rowOf.containsKey(sample.getSampleTime())) {
                rowOf.put(sample.getSampleTime(), times.size());
                times.add(sample.getSampleTime());
            }
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String channel : channels) {
            double[] values = new double[times.size()];
            Arrays.fill(values, Double.NaN);
            columns.put(channel, values);
        }
        for (IrradianceSampleEntity sample : samples) {
            if (sample.getIrradiance() != null) {
                columns.get(sample.getChannel())[rowOf.get(sample.getSampleTime())] = sample.getIrradiance();
            }
        }

        IrradianceTable.Builder builder = IrradianceTable.builder(times);
        columns.forEach(builder::channel);
        IrradianceTable table = builder.build();

        log.info("Loaded irradiance table {} to {}: {} times, {} channels", start, end, table.size(), channels.size());
        return table;
    }
}
