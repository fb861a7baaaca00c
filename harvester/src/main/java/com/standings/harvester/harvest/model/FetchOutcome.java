package com.standings.harvester.harvest.model;

import java.time.Duration;
import java.util.List;

/**
 * Result of a single attempt at one page. Never shared outside the fetching task.
 */
public record FetchOutcome(
    Type type,
    FailureKind kind,
    String reason,
    int statusCode,
    Duration waitHint,
    List<StandingRecord> records
) {
    public enum Type {
        SUCCESS,
        RETRYABLE_FAILURE,
        TERMINAL_FAILURE
    }

    public static FetchOutcome success(int statusCode, List<StandingRecord> records) {
        return new FetchOutcome(Type.SUCCESS, null, null, statusCode, Duration.ZERO, List.copyOf(records));
    }

    public static FetchOutcome retryable(FailureKind kind, String reason, int statusCode, Duration waitHint) {
        if (!kind.isRetryable()) {
            throw new IllegalArgumentException(kind + " is not a retryable failure kind");
        }
        return new FetchOutcome(Type.RETRYABLE_FAILURE, kind, reason, statusCode, waitHint, List.of());
    }

    public static FetchOutcome terminal(FailureKind kind, String reason, int statusCode) {
        return new FetchOutcome(Type.TERMINAL_FAILURE, kind, reason, statusCode, Duration.ZERO, List.of());
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isRetryable() {
        return type == Type.RETRYABLE_FAILURE;
    }

    public boolean isCancelled() {
        return kind == FailureKind.CANCELLED;
    }
}
