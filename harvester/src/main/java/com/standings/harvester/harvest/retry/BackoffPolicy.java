package com.standings.harvester.harvest.retry;

import com.standings.harvester.config.HarvesterProperties;
import com.standings.harvester.harvest.model.FailureKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Maps an attempt index and failure kind to the wait before the next attempt.
 *
 * <p>Rate limits wait {@code rateLimitBase * 2^attempt}, every other retryable kind waits
 * {@code base * 2^attempt}. Terminal kinds never wait. The exponent is capped and the result is
 * clamped to {@code maxDelay} when one is set, so the delay stays finite for any attempt.
 */
public final class BackoffPolicy {
    static final int MAX_EXPONENT = 30;

    private final Duration rateLimitBase;
    private final Duration base;
    private final Duration maxDelay;

    public BackoffPolicy(Duration rateLimitBase, Duration base, Duration maxDelay) {
        this.rateLimitBase = requireNonNegative(rateLimitBase, "rateLimitBase");
        this.base = requireNonNegative(base, "base");
        this.maxDelay = requireNonNegative(maxDelay, "maxDelay");
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofMinutes(30));
    }

    public static BackoffPolicy fromProperties(HarvesterProperties.Retry retry) {
        return new BackoffPolicy(
            Duration.ofMillis(retry.getRateLimitBaseMs()),
            Duration.ofMillis(retry.getBaseMs()),
            Duration.ofMillis(retry.getMaxDelayMs())
        );
    }

    public Duration delay(int attempt, FailureKind kind) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0 (was " + attempt + ")");
        }
        Objects.requireNonNull(kind, "kind");
        Duration unit = switch (kind) {
            case RATE_LIMITED -> rateLimitBase;
            case SERVER_ERROR, CLIENT_PROTOCOL_ERROR, CONNECTION_ERROR, UNEXPECTED_ERROR -> base;
            case MALFORMED_RESPONSE, CANCELLED -> Duration.ZERO;
        };
        if (unit.isZero()) {
            return Duration.ZERO;
        }
        long unitMs = unit.toMillis();
        int exponent = Math.min(attempt, MAX_EXPONENT);
        long ceilingMs = maxDelay.isZero() ? Long.MAX_VALUE : maxDelay.toMillis();
        if (unitMs > (ceilingMs >> exponent)) {
            return Duration.ofMillis(ceilingMs);
        }
        return Duration.ofMillis(unitMs << exponent);
    }

    public Duration rateLimitBase() {
        return rateLimitBase;
    }

    public Duration base() {
        return base;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative (was " + value + ")");
        }
        return value;
    }
}
