package com.jedi.catalog.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CSV Reader Tests")
class CsvReadersTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    @Nested
    @DisplayName("Flare events")
    class FlareEventTests {

        private final CsvFlareEventReader reader = new CsvFlareEventReader();

        @Test
        @DisplayName("Reads start, peak and class")
        void readsEvents() throws IOException {
            Path file = write("flares.csv", """
                    start_time,peak_time,class
                    2011-02-15T01:44:00,2011-02-15T01:56:00,X2.2
                    2011-02-15 14:32:00,2011-02-15 14:46:00.000,C6.6
                    """);

            List<FlareEventDTO> events = reader.read(file);

            assertThat(events).hasSize(2);
            assertThat(events.get(0).getStartTime()).isEqualTo(LocalDateTime.of(2011, 2, 15, 1, 44));
            assertThat(events.get(0).getPeakTime()).isEqualTo(LocalDateTime.of(2011, 2, 15, 1, 56));
            assertThat(events.get(0).getGoesClass()).isEqualTo("X2.2");
            assertThat(events.get(1).getPeakTime()).isEqualTo(LocalDateTime.of(2011, 2, 15, 14, 46));
        }

        @Test
        @DisplayName("Wrong header is rejected")
        void wrongHeader() throws IOException {
            Path file = write("flares.csv", "start,peak,class\n");

            assertThatThrownBy(() -> reader.read(file)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Malformed line names its line number")
        void malformedLine() throws IOException {
            Path file = write("flares.csv", """
                    start_time,peak_time,class
                    2011-02-15T01:44:00,2011-02-15T01:56:00,X2.2
                    2011-02-15T01:44:00,yesterday,X2.2
                    """);

            assertThatThrownBy(() -> reader.read(file))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Line 3");
        }

        @Test
        @DisplayName("Empty file gives no events")
        void emptyFile() throws IOException {
            assertThat(reader.read(write("flares.csv", ""))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Irradiance")
    class IrradianceTests {

        private final CsvIrradianceReader reader = new CsvIrradianceReader(-1);

        @Test
        @DisplayName("Reads channels in column order, missing values become null")
        void readsRows() throws IOException {
            Path file = write("eve.csv", """
                    time,17.1,30.4,33.5
                    2011-02-15T00:00:00,1.5e-4,2.0e-4,
                    2011-02-15T00:01:00,-1,NaN,3.0e-5
                    """);

            List<IrradianceRowDTO> rows = reader.read(file);

            assertThat(rows).hasSize(2);
            assertThat(rows.get(0).getIrradiance().keySet()).containsExactly("17.1", "30.4", "33.5");
            assertThat(rows.get(0).getIrradiance().get("17.1")).isEqualTo(1.5e-4);
            assertThat(rows.get(0).getIrradiance().get("33.5")).isNull();
            assertThat(rows.get(1).getIrradiance().get("17.1")).isNull();
            assertThat(rows.get(1).getIrradiance().get("30.4")).isNull();
            assertThat(rows.get(1).getSampleTime()).isEqualTo(LocalDateTime.of(2011, 2, 15, 0, 1));
        }

        @Test
        @DisplayName("Header must start with time and name at least one channel")
        void wrongHeader() throws IOException {
            assertThatThrownBy(() -> reader.read(write("eve.csv", "when,17.1\n")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> reader.read(write("eve2.csv", "time\n")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Wrong column count and bad numbers name the line")
        void malformed() throws IOException {
            Path shortRow = write("eve.csv", "time,17.1,30.4\n2011-02-15T00:00:00,1.0\n");
            Path badNumber = write("eve2.csv", "time,17.1\n2011-02-15T00:00:00,1.0\n2011-02-15T00:01:00,lots\n");

            assertThatThrownBy(() -> reader.read(shortRow)).hasMessageContaining("Line 2");
            assertThatThrownBy(() -> reader.read(badNumber))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Line 3");
        }
    }
}
