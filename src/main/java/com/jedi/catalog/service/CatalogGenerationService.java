package com.jedi.catalog.service;

import com.jedi.catalog.config.CatalogSettings;
import com.jedi.catalog.pipeline.CatalogPipeline;
import com.jedi.catalog.pipeline.CatalogResult;
import com.jedi.catalog.pipeline.FlareEvent;
import com.jedi.catalog.series.IrradianceTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Builds a catalog from the stored flare events and irradiance. One run at a time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogGenerationService {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final CatalogSettings settings;
    private final CatalogPipeline pipeline;
    private final FlareEventLoader flareEventLoader;
    private final IrradianceTableLoader irradianceTableLoader;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public CatalogResult generateCatalog() {
        return guarded(() -> {
            List<FlareEvent> flares = flareEventLoader.loadAll();
            if (flares.isEmpty()) {
                throw new IllegalStateException("No flare events stored, nothing to catalog");
            }
            IrradianceTable table = irradianceTableLoader.loadFor(flares, settings);
            return pipeline.run(flares, table, settings, catalogFile(settings.outputPath()));
        });
    }

    public CatalogResult generateCatalog(List<FlareEvent> flares, IrradianceTable table, CatalogSettings runSettings) {
        return guarded(() -> pipeline.run(flares, table, runSettings, catalogFile(runSettings.outputPath())));
    }

    public boolean isRunning() {
        return running.get();
    }

    static Path catalogFile(Path outputPath) {
        return outputPath.resolve("jedi_" + LocalDateTime.now().format(FILE_TIMESTAMP) + ".csv");
    }

    private CatalogResult guarded(Supplier<CatalogResult> run) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Catalog generation already in progress");
        }
        try {
            return run.get();
        } finally {
            running.set(false);
        }
    }
}
