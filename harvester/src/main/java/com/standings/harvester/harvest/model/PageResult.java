package com.standings.harvester.harvest.model;

import java.time.Duration;

public record PageResult(
    int pageNumber,
    PageStatus status,
    int attempts,
    int recordCount,
    FailureKind failureKind,
    String reason,
    Duration elapsed
) {
    public static PageResult succeeded(int pageNumber, int attempts, int recordCount, Duration elapsed) {
        return new PageResult(pageNumber, PageStatus.SUCCEEDED, attempts, recordCount, null, null, elapsed);
    }

    public static PageResult failed(int pageNumber, int attempts, FailureKind kind, String reason, Duration elapsed) {
        return new PageResult(pageNumber, PageStatus.FAILED, attempts, 0, kind, reason, elapsed);
    }

    public boolean isSucceeded() {
        return status == PageStatus.SUCCEEDED;
    }
}
