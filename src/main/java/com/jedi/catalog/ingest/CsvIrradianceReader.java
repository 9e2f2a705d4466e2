package com.jedi.catalog.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads extracted emission line irradiance in wide format: {@code time,<channel>,<channel>,...}.
 * Empty cells, {@code NaN} and the configured fill value are missing samples.
 */
@Component
@Slf4j
public class CsvIrradianceReader {

    private final double fillValue;

    public CsvIrradianceReader(@Value("${jedi.import.fill-value:-1}") double fillValue) {
        this.fillValue = fillValue;
    }

    public List<IrradianceRowDTO> read(Path file) throws IOException {
        List<IrradianceRowDTO> rows = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                log.warn("Irradiance file {} is empty", file);
                return rows;
            }
            List<String> header = CsvSupport.splitLine(headerLine);
            if (header.size() < 2 || !header.get(0).equalsIgnoreCase("time")) {
                throw new IllegalArgumentException("Irradiance header must be time,<channel>,... but was " + header);
            }
            List<String> channels = header.subList(1, header.size());

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> cells = CsvSupport.splitLine(line);
                if (cells.size() != header.size()) {
                    throw new IllegalArgumentException("Line " + lineNumber + ": expected " + header.size()
                            + " columns but found " + cells.size());
                }

                LinkedHashMap<String, Double> irradiance = new LinkedHashMap<>();
                for (int c = 0; c < channels.size(); c++) {
                    irradiance.put(channels.get(c), parseIrradiance(cells.get(c + 1), lineNumber));
                }
                rows.add(IrradianceRowDTO.builder()
                        .sampleTime(CsvSupport.parseTime(cells.get(0), lineNumber))
                        .irradiance(irradiance)
                        .build());
            }
        }

        log.info("Read {} irradiance rows from {}", rows.size(), file);
        return rows;
    }

    private Double parseIrradiance(String cell, int lineNumber) {
        if (cell.isEmpty() || cell.equalsIgnoreCase("nan")) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Line " + lineNumber + ": invalid irradiance '" + cell + "'", e);
        }
        return value == fillValue || !Double.isFinite(value) ? null : value;
    }
}
