package com.standings.harvester.harvest.model;

public enum FailureKind {
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    CLIENT_PROTOCOL_ERROR(true),
    CONNECTION_ERROR(true),
    UNEXPECTED_ERROR(true),
    MALFORMED_RESPONSE(false),
    CANCELLED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
