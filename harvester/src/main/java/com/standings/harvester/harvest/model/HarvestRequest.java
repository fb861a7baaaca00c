package com.standings.harvester.harvest.model;

import java.nio.file.Path;

/**
 * Inputs of one harvest run. Null fields fall back to the configured defaults.
 */
public record HarvestRequest(
    Integer totalPages,
    Integer concurrencyLimit,
    Integer maxAttempts,
    Path outputPath,
    Path failureReportPath
) {
    public static HarvestRequest defaults() {
        return new HarvestRequest(null, null, null, null, null);
    }

    public static HarvestRequest of(int totalPages, int concurrencyLimit) {
        return new HarvestRequest(totalPages, concurrencyLimit, null, null, null);
    }
}
