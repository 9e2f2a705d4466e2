package com.jedi.catalog.pipeline;

import lombok.Getter;

/**
 * Fatal error while building the catalog. Rows appended before the failure stay on disk.
 */
@Getter
public class CatalogProcessingException extends RuntimeException {

    private final int flareIndex;
    private final String stage;

    public CatalogProcessingException(int flareIndex, String stage, String target, Throwable cause) {
        super(String.format("Event %d: %s failed for %s: %s", flareIndex, stage, target, cause.getMessage()), cause);
        this.flareIndex = flareIndex;
        this.stage = stage;
    }
}
