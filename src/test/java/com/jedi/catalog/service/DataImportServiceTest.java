package com.jedi.catalog.service;

import com.jedi.catalog.BaseIntegrationTest;
import com.jedi.catalog.persistence.FlareEventEntity;
import com.jedi.catalog.persistence.FlareEventRepository;
import com.jedi.catalog.persistence.IrradianceSampleEntity;
import com.jedi.catalog.persistence.IrradianceSampleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Data Import Tests")
class DataImportServiceTest extends BaseIntegrationTest {

    @TempDir
    Path tempDir;

    @Autowired
    private DataImportService importService;

    @Autowired
    private FlareEventRepository flareEventRepository;

    @Autowired
    private IrradianceSampleRepository irradianceSampleRepository;

    @BeforeEach
    void setUp() {
        flareEventRepository.deleteAll();
        irradianceSampleRepository.deleteAll();
    }

    @Test
    @DisplayName("Flare events are stored once, a repeated import saves nothing")
    void flareImportIsIdempotent() throws IOException {
        Path file = Files.writeString(tempDir.resolve("flares.csv"), """
                start_time,peak_time,class
                2011-02-15T01:44:00,2011-02-15T01:56:00,X2.2
                2011-02-15T14:32:00,2011-02-15T14:46:00,C6.6
                """);

        DataImportService.ImportResult first = importService.importFlareEvents(file);
        DataImportService.ImportResult second = importService.importFlareEvents(file);

        assertThat(first).isEqualTo(new DataImportService.ImportResult(2, 2));
        assertThat(second).isEqualTo(new DataImportService.ImportResult(2, 0));
        assertThat(flareEventRepository.count()).isEqualTo(2);
        FlareEventEntity stored = flareEventRepository.findById(LocalDateTime.of(2011, 2, 15, 1, 56)).orElseThrow();
        assertThat(stored.getGoesClass()).isEqualTo("X2.2");
        assertThat(stored.getStartTime()).isEqualTo(LocalDateTime.of(2011, 2, 15, 1, 44));
    }

    @Test
    @DisplayName("Irradiance is stored in long format with missing samples as null")
    void irradianceImport() throws IOException {
        Path file = Files.writeString(tempDir.resolve("eve.csv"), """
                time,17.1,30.4
                2011-02-15T00:00:00,1.5e-4,
                2011-02-15T00:01:00,1.6e-4,2.1e-4
                """);

        DataImportService.ImportResult result = importService.importIrradiance(file);
        DataImportService.ImportResult repeated = importService.importIrradiance(file);

        assertThat(result).isEqualTo(new DataImportService.ImportResult(4, 4));
        assertThat(repeated.saved()).isZero();
        assertThat(irradianceSampleRepository.findChannelsInInsertionOrder()).containsExactly("17.1", "30.4");
        List<IrradianceSampleEntity> samples = irradianceSampleRepository.findSamplesBetween(
                LocalDateTime.of(2011, 2, 15, 0, 0), LocalDateTime.of(2011, 2, 15, 0, 0));
        assertThat(samples).extracting(IrradianceSampleEntity::getIrradiance).containsExactly(1.5e-4, null);
    }

    @Test
    @DisplayName("Imports larger than one batch store every sample in time order")
    void irradianceImportAcrossBatches() throws IOException {
        int rows = DataImportService.BATCH_SIZE;
        LocalDateTime start = LocalDateTime.of(2011, 2, 15, 0, 0);
        StringBuilder csv = new StringBuilder("time,17.1,30.4\n");
        for (int i = 0; i < rows; i++) {
            csv.append(start.plusMinutes(i).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append(",1.0e-4,2.0e-4\n");
        }
        Path file = Files.writeString(tempDir.resolve("eve.csv"), csv.toString());

        DataImportService.ImportResult result = importService.importIrradiance(file);

        assertThat(result).isEqualTo(new DataImportService.ImportResult(2 * rows, 2 * rows));
        assertThat(irradianceSampleRepository.count()).isEqualTo(2L * rows);
        assertThat(irradianceSampleRepository.findChannelsInInsertionOrder()).containsExactly("17.1", "30.4");
        assertThat(irradianceSampleRepository.findSamplesBetween(start, start.plusMinutes(rows - 1)))
                .extracting(IrradianceSampleEntity::getSampleTime)
                .isSorted();
    }

    @Test
    @DisplayName("Only samples not yet stored are saved, a repeated time in one file counts once")
    void irradianceImportSkipsStoredSamples() throws IOException {
        Path first = Files.writeString(tempDir.resolve("first.csv"), """
                time,17.1
                2011-02-15T00:00:00,1.5e-4
                2011-02-15T00:01:00,1.6e-4
                """);
        Path second = Files.writeString(tempDir.resolve("second.csv"), """
                time,17.1,30.4
                2011-02-15T00:01:00,9.9e-4,2.1e-4
                2011-02-15T00:02:00,1.7e-4,2.2e-4
                2011-02-15T00:02:00,1.8e-4,2.3e-4
                """);

        importService.importIrradiance(first);
        DataImportService.ImportResult result = importService.importIrradiance(second);

        assertThat(result).isEqualTo(new DataImportService.ImportResult(6, 3));
        assertThat(irradianceSampleRepository.count()).isEqualTo(5);
        List<IrradianceSampleEntity> overlap = irradianceSampleRepository.findSamplesBetween(
                LocalDateTime.of(2011, 2, 15, 0, 1), LocalDateTime.of(2011, 2, 15, 0, 2));
        assertThat(overlap).extracting(IrradianceSampleEntity::getIrradiance)
                .containsExactly(1.6e-4, 2.1e-4, 1.7e-4, 2.2e-4);
    }

    @Test
    @DisplayName("Missing file fails the import")
    void missingFile() {
        assertThatThrownBy(() -> importService.importFlareEvents(tempDir.resolve("absent.csv")))
                .isInstanceOf(UncheckedIOException.class);
    }
}
