package com.jedi.catalog.runner;

import com.jedi.catalog.pipeline.CatalogResult;
import com.jedi.catalog.service.CatalogGenerationService;
import com.jedi.catalog.service.DataImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Imports the configured input files, if any, and builds the catalog once at startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "jedi.runner.enabled", havingValue = "true", matchIfMissing = true)
public class CatalogRunner implements ApplicationRunner {

    private final DataImportService dataImportService;
    private final CatalogGenerationService catalogGenerationService;

    @Value("${jedi.import.flare-file:}")
    private String flareFile;

    @Value("${jedi.import.irradiance-file:}")
    private String irradianceFile;

    @Override
    public void run(ApplicationArguments args) {
        if (!flareFile.isBlank()) {
            dataImportService.importFlareEvents(Path.of(flareFile));
        }
        if (!irradianceFile.isBlank()) {
            dataImportService.importIrradiance(Path.of(irradianceFile));
        }

        log.info("=== Building dimming catalog ===");
        CatalogResult result = catalogGenerationService.generateCatalog();
        log.info("Catalog build completed\n{}", result.toFormattedString());
    }
}
