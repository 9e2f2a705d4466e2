package com.jedi.catalog.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a GOES flare event list with the header {@code start_time,peak_time,class}.
 */
@Component
@Slf4j
public class CsvFlareEventReader {

    private static final List<String> HEADER = List.of("start_time", "peak_time", "class");

    public List<FlareEventDTO> read(Path file) throws IOException {
        List<FlareEventDTO> events = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                log.warn("Flare event file {} is empty", file);
                return events;
            }
            List<String> header = CsvSupport.splitLine(headerLine).stream().map(String::toLowerCase).toList();
            if (!header.equals(HEADER)) {
                throw new IllegalArgumentException("Unexpected flare event header " + header + ", expected " + HEADER);
            }

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> cells = CsvSupport.splitLine(line);
                if (cells.size() != HEADER.size()) {
                    throw new IllegalArgumentException("Line " + lineNumber + ": expected " + HEADER.size()
                            + " columns but found " + cells.size());
                }
                events.add(FlareEventDTO.builder()
                        .startTime(CsvSupport.parseTime(cells.get(0), lineNumber))
                        .peakTime(CsvSupport.parseTime(cells.get(1), lineNumber))
                        .goesClass(cells.get(2))
                        .build());
            }
        }

        log.info("Read {} flare events from {}", events.size(), file);
        return events;
    }
}
