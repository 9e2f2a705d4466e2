package com.jedi.catalog.catalog;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only CSV catalog file. The header is written when the writer is opened; every
 * {@link #append(CatalogRow)} opens the file, writes one line and closes it again, so a crash
 * loses at most the row in progress.
 */
@Slf4j
public class CatalogCsvWriter {

    @Getter
    private final Path file;
    private final CatalogSchema schema;
    @Getter
    private int rowsWritten;

    private CatalogCsvWriter(Path file, CatalogSchema schema) {
        this.file = file;
        this.schema = schema;
    }

    /**
     * Creates (or truncates) the catalog file and writes the header line.
     */
    public static CatalogCsvWriter create(Path file, CatalogSchema schema) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (PrintWriter writer = new PrintWriter(new FileWriter(file.toFile(), StandardCharsets.UTF_8, false))) {
                writer.println(formatLine(schema.getHeader()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create catalog file " + file, e);
        }
        log.info("Created catalog {} with {} columns", file, schema.getColumnCount());
        return new CatalogCsvWriter(file, schema);
    }

    public void append(CatalogRow row) {
        String line = formatLine(schema.toCells(row));
        try (PrintWriter writer = new PrintWriter(new FileWriter(file.toFile(), StandardCharsets.UTF_8, true))) {
            writer.println(line);
            if (writer.checkError()) {
                throw new IOException("Write error");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not append event " + row.getEventIndex() + " to " + file, e);
        }
        rowsWritten++;
    }

    private static String formatLine(List<String> cells) {
        return cells.stream().map(CatalogCsvWriter::escapeCSV).collect(Collectors.joining(","));
    }

    /**
     * Escape CSV value.
     */
    static String escapeCSV(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
