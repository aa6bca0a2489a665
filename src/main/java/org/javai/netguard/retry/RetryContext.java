package org.javai.netguard.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-call retry state. Local to one {@code execute} call and never shared.
 *
 * @param attemptNumber The current attempt number (1-based)
 * @param startedAt When the first attempt began
 * @param elapsed Time elapsed since the first attempt
 */
public record RetryContext(int attemptNumber, Instant startedAt, Duration elapsed) {

    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first(Clock clock) {
        return new RetryContext(1, clock.instant(), Duration.ZERO);
    }

    public RetryContext next(Clock clock) {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, clock.instant()));
    }
}
