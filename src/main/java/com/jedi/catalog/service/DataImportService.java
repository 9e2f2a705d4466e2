package com.jedi.catalog.service;

import com.jedi.catalog.ingest.CsvFlareEventReader;
import com.jedi.catalog.ingest.CsvIrradianceReader;
import com.jedi.catalog.ingest.FlareEventDTO;
import com.jedi.catalog.ingest.IrradianceRowDTO;
import com.jedi.catalog.persistence.FlareEventEntity;
import com.jedi.catalog.persistence.FlareEventRepository;
import com.jedi.catalog.persistence.IrradianceSampleEntity;
import com.jedi.catalog.persistence.IrradianceSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Imports flare event and irradiance CSV files into the database.
 * Rows that are already stored are skipped, so an import can be repeated.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DataImportService {

    private static final int LOG_INTERVAL = 10_000;
    static final int BATCH_SIZE = 1_000;

    private final CsvFlareEventReader flareEventReader;
    private final CsvIrradianceReader irradianceReader;
    private final FlareEventRepository flareEventRepository;
    private final IrradianceSampleRepository irradianceSampleRepository;

    public record ImportResult(int read, int saved) {}

    public ImportResult importFlareEvents(Path file) {
        log.info("Importing flare events from {}", file);
        List<FlareEventDTO> events;
        try {
            events = flareEventReader.read(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read flare event file " + file, e);
        }

        int saved = saveFlareEvents(events);
        log.info("Flare event import completed. Read: {}, saved: {}", events.size(), saved);
        return new ImportResult(events.size(), saved);
    }

    public ImportResult importIrradiance(Path file) {
        log.info("Importing irradiance from {}", file);
        List<IrradianceRowDTO> rows;
        try {
            rows = irradianceReader.read(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read irradiance file " + file, e);
        }

        int samples = 0;
        int saved = 0;
        List<IrradianceSampleEntity> batch = new ArrayList<>(BATCH_SIZE);
        Set<LocalDateTime> batchTimes = new HashSet<>();

        for (IrradianceRowDTO row : rows) {
            if (batchTimes.contains(row.getSampleTime())) {
                saved += saveBatch(batch, batchTimes);
            }
            Set<String> stored = new HashSet<>(irradianceSampleRepository.findChannelsAt(row.getSampleTime()));

            for (Map.Entry<String, Double> entry : row.getIrradiance().entrySet()) {
                samples++;
                if (stored.add(entry.getKey())) {
                    batch.add(IrradianceSampleEntity.builder()
                            .sampleTime(row.getSampleTime())
                            .channel(entry.getKey())
                            .irradiance(entry.getValue())
                            .build());
                }
                if (samples % LOG_INTERVAL == 0) {
                    log.info("Progress: {} samples read, {} saved, last: {}", samples, saved, row.getSampleTime());
                }
            }
            batchTimes.add(row.getSampleTime());

            if (batch.size() >= BATCH_SIZE) {
                saved += saveBatch(batch, batchTimes);
            }
        }
        saved += saveBatch(batch, batchTimes);

        log.info("Irradiance import completed. Samples: {}, saved: {}", samples, saved);
        return new ImportResult(samples, saved);
    }

    private int saveFlareEvents(List<FlareEventDTO> events) {
        int savedCount = 0;

        for (FlareEventDTO dto : events) {
            try {
                if (!flareEventRepository.existsByPeakTime(dto.getPeakTime())) {
                    FlareEventEntity entity = FlareEventEntity.builder()
                            .peakTime(dto.getPeakTime())
                            .startTime(dto.getStartTime())
                            .goesClass(dto.getGoesClass())
                            .build();

                    flareEventRepository.save(entity);
                    savedCount++;
                }
            } catch (DataIntegrityViolationException e) {
                log.trace("Flare event already exists: {}", dto.getPeakTime());
            }
        }

        return savedCount;
    }

    /**
     * Saves the pending samples in one transaction and clears the batch. A batch that collides
     * with rows stored meanwhile is retried sample by sample.
     */
    private int saveBatch(List<IrradianceSampleEntity> batch, Set<LocalDateTime> batchTimes) {
        if (batch.isEmpty()) {
            batchTimes.clear();
            return 0;
        }

        int savedCount;
        try {
            irradianceSampleRepository.saveAll(batch);
            savedCount = batch.size();
        } catch (DataIntegrityViolationException e) {
            log.warn("Batch of {} samples collided with stored samples, saving one by one", batch.size());
            savedCount = 0;
            for (IrradianceSampleEntity sample : batch) {
                if (saveSample(sample)) {
                    savedCount++;
                }
            }
        }

        batch.clear();
        batchTimes.clear();
        return savedCount;
    }

    private boolean saveSample(IrradianceSampleEntity sample) {
        try {
            if (irradianceSampleRepository.existsBySampleTimeAndChannel(sample.getSampleTime(), sample.getChannel())) {
                return false;
            }
            irradianceSampleRepository.save(IrradianceSampleEntity.builder()
                    .sampleTime(sample.getSampleTime())
                    .channel(sample.getChannel())
                    .irradiance(sample.getIrradiance())
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.trace("Irradiance sample already exists: {} {}", sample.getSampleTime(), sample.getChannel());
            return false;
        }
    }
}
