package com.jedi.catalog.catalog;

import com.jedi.catalog.pipeline.FlareEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CatalogCsvWriter Tests")
class CatalogCsvWriterTest {

    private static final LocalDateTime PEAK = LocalDateTime.of(2011, 2, 15, 1, 56);

    @TempDir
    Path tempDir;

    private final CatalogSchema schema = new CatalogSchema(List.of("17.1", "30.4"));

    @Test
    @DisplayName("Header is written on creation, output directory is created")
    void headerOnCreate() throws IOException {
        Path file = tempDir.resolve("out/nested/jedi.csv");

        CatalogCsvWriter writer = CatalogCsvWriter.create(file, schema);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).startsWith("Event Index,GOES Flare Start Time");
        assertThat(writer.getRowsWritten()).isZero();
    }

    @Test
    @DisplayName("Each append adds exactly one line and is on disk immediately")
    void appendOneLine() throws IOException {
        Path file = tempDir.resolve("jedi.csv");
        CatalogCsvWriter writer = CatalogCsvWriter.create(file, schema);

        writer.append(CatalogRow.forFlare(new FlareEvent(1, PEAK, PEAK, "C1.0"), schema));
        assertThat(Files.readAllLines(file)).hasSize(2);

        writer.append(CatalogRow.forFlare(new FlareEvent(2, PEAK.plusHours(5), PEAK.plusHours(5), "M2.0"), schema));
        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(2)).startsWith("2,");
        assertThat(writer.getRowsWritten()).isEqualTo(2);
    }

    @Test
    @DisplayName("Creating over an existing file starts a fresh catalog")
    void truncatesExisting() throws IOException {
        Path file = tempDir.resolve("jedi.csv");
        Files.writeString(file, "old\ncontent\n");

        CatalogCsvWriter.create(file, schema);

        assertThat(Files.readAllLines(file)).hasSize(1);
    }

    @Test
    @DisplayName("Unwritable target fails with UncheckedIOException")
    void unwritable() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("taken"));

        assertThatThrownBy(() -> CatalogCsvWriter.create(directory, schema)).isInstanceOf(UncheckedIOException.class);
    }

    @Test
    @DisplayName("CSV escaping of commas and quotes")
    void escape() {
        assertThat(CatalogCsvWriter.escapeCSV("plain")).isEqualTo("plain");
        assertThat(CatalogCsvWriter.escapeCSV("a,b")).isEqualTo("\"a,b\"");
        assertThat(CatalogCsvWriter.escapeCSV("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(CatalogCsvWriter.escapeCSV(null)).isEmpty();
    }
}
