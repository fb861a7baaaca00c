package com.standings.harvester.harvest.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

public record RunSummary(
    int totalPages,
    int succeeded,
    int failed,
    int cancelled,
    Instant startedAt,
    Duration elapsed,
    RunStatus status,
    Path outputPath,
    Path failureReportPath
) {}
