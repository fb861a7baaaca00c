package com.standings.harvester.harvest.model;

import java.time.Duration;

public record PageEvent(
    int pageNumber,
    int attempt,
    int maxAttempts,
    PageState state,
    FailureKind kind,
    String reason,
    int statusCode,
    Duration delay,
    int recordCount,
    Duration elapsed
) {
    public static PageEvent requesting(PageRequest request, int maxAttempts) {
        return new PageEvent(request.pageNumber(), request.attempt(), maxAttempts, PageState.REQUESTING,
            null, null, 0, Duration.ZERO, 0, Duration.ZERO);
    }

    public static PageEvent succeeded(
        PageRequest request,
        int maxAttempts,
        int statusCode,
        int recordCount,
        Duration elapsed
    ) {
        return new PageEvent(request.pageNumber(), request.attempt(), maxAttempts, PageState.SUCCEEDED,
            null, null, statusCode, Duration.ZERO, recordCount, elapsed);
    }

    public static PageEvent retryWait(PageRequest request, int maxAttempts, FetchOutcome outcome) {
        return new PageEvent(request.pageNumber(), request.attempt(), maxAttempts, PageState.RETRY_WAIT,
            outcome.kind(), outcome.reason(), outcome.statusCode(), outcome.waitHint(), 0, Duration.ZERO);
    }

    public static PageEvent failed(PageRequest request, int maxAttempts, FetchOutcome outcome, Duration elapsed) {
        return new PageEvent(request.pageNumber(), request.attempt(), maxAttempts, PageState.FAILED,
            outcome.kind(), outcome.reason(), outcome.statusCode(), Duration.ZERO, 0, elapsed);
    }

    public static PageEvent exhausted(PageRequest request, int maxAttempts, FetchOutcome lastOutcome, Duration elapsed) {
        FailureKind kind = lastOutcome == null ? null : lastOutcome.kind();
        String reason = lastOutcome == null ? null : lastOutcome.reason();
        int status = lastOutcome == null ? 0 : lastOutcome.statusCode();
        return new PageEvent(request.pageNumber(), request.attempt(), maxAttempts, PageState.EXHAUSTED,
            kind, reason, status, Duration.ZERO, 0, elapsed);
    }

    public static PageEvent cancelled(PageRequest request, int maxAttempts, Duration elapsed) {
        return new PageEvent(request.pageNumber(), request.attempt(), maxAttempts, PageState.CANCELLED,
            FailureKind.CANCELLED, null, 0, Duration.ZERO, 0, elapsed);
    }

    public int attemptNumber() {
        return attempt + 1;
    }
}
