package com.standings.harvester.harvest.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchOutcomeTest {

    @Test
    void onlyRetryableKindsCanBeRetried() {
        assertThatThrownBy(() -> FetchOutcome.retryable(FailureKind.MALFORMED_RESPONSE, "MISSING_RESULTS", 200, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FetchOutcome.retryable(FailureKind.CANCELLED, "interrupted", 0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);

        FetchOutcome rateLimited = FetchOutcome.retryable(FailureKind.RATE_LIMITED, "HTTP_429_RATE_LIMIT", 429, Duration.ofSeconds(5));
        assertThat(rateLimited.isRetryable()).isTrue();
        assertThat(rateLimited.waitHint()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void terminalOutcomesAreNotRetried() {
        FetchOutcome malformed = FetchOutcome.terminal(FailureKind.MALFORMED_RESPONSE, "MISSING_RESULTS", 200);

        assertThat(malformed.isRetryable()).isFalse();
        assertThat(malformed.isSuccess()).isFalse();
        assertThat(malformed.waitHint()).isZero();
    }
}
