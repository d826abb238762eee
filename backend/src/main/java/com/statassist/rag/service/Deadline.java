package com.statassist.rag.service;

import com.statassist.rag.exception.OperationTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative deadline checked between the stages of an operation.
 * A null or non-positive timeout never expires.
 */
final class Deadline {

    private final String operation;
    private final Duration timeout;
    private final Clock clock;
    private final Instant startedAt;
    private final Instant expiresAt;

    private Deadline(String operation, Duration timeout, Clock clock) {
        this.operation = operation;
        this.timeout = timeout;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.expiresAt = timeout == null || timeout.isZero() || timeout.isNegative()
                ? null
                : startedAt.plus(timeout);
    }

    static Deadline start(String operation, Duration timeout, Clock clock) {
        return new Deadline(operation, timeout, clock);
    }

    boolean isExpired() {
        return expiresAt != null && clock.instant().isAfter(expiresAt);
    }

    void check() {
        if (isExpired()) {
            throw new OperationTimeoutException(operation, timeout);
        }
    }

    long elapsedMs() {
        return Duration.between(startedAt, clock.instant()).toMillis();
    }
}
