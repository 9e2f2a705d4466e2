package com.jedi.catalog.pipeline;

import java.nio.file.Path;

/**
 * Summary of one catalog run.
 *
 * @param analyzed flares that went through correction, fitting and parameterization
 * @param skipped  flares whose dimming window was too short, written as metadata-only rows
 */
public record CatalogResult(Path file, int rowsWritten, int analyzed, int skipped, long totalTimeMs) {

    public String toFormattedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Catalog: ").append(file).append("\n");
        sb.append("Rows written: ").append(rowsWritten).append("\n");
        sb.append("Analyzed: ").append(analyzed).append(", skipped (short window): ").append(skipped).append("\n");
        sb.append("Time: ").append(formatDuration(totalTimeMs));
        return sb.toString();
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) {
            return ms + "ms";
        }
        long seconds = ms / 1000;
        if (seconds < 60) {
            return seconds + "s";
        }
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
