package org.javai.netguard.retry;

import org.javai.netguard.ClassifiedError;
import org.javai.netguard.ErrorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable backoff parameters for one operation invocation.
 *
 * <p>The backoff before attempt {@code n + 1} is
 * {@code min(baseDelayMs * backoffMultiplier^(n - 1), maxDelayMs)}.
 *
 * @param id Label used in reporting (e.g., "adaptive-wifi")
 * @param maxAttempts Maximum number of invocations; zero means the operation is never invoked
 * @param baseDelayMs Backoff after the first failure
 * @param maxDelayMs Upper bound of the backoff
 * @param backoffMultiplier Growth factor per attempt (at least 1)
 */
public record RetryPolicy(String id, int maxAttempts, long baseDelayMs, long maxDelayMs, double backoffMultiplier) {

    public RetryPolicy {
        Objects.requireNonNull(id, "id must not be null");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, was: " + maxAttempts);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, was: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, was: " + maxDelayMs);
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, was: " + backoffMultiplier);
        }
    }

    /**
     * A policy that permits no attempts at all. Used while offline.
     */
    public static RetryPolicy noAttempts(String id) {
        return new RetryPolicy(id, 0, 0, 0, 1.0);
    }

    /**
     * A policy that invokes the operation once and never retries.
     */
    public static RetryPolicy noRetry(String id) {
        return new RetryPolicy(id, 1, 0, 0, 1.0);
    }

    public static RetryPolicy exponentialBackoff(String id, int maxAttempts, Duration baseDelay, Duration maxDelay,
            double multiplier) {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        return new RetryPolicy(id, maxAttempts, baseDelay.toMillis(), maxDelay.toMillis(), multiplier);
    }

    /**
     * Returns the backoff to wait after the given failed attempt, before jitter.
     * Non-decreasing in {@code attemptNumber} and never above {@code maxDelayMs}.
     *
     * @param attemptNumber the attempt that just failed (1-based)
     */
    public Duration backoffDelay(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, was: " + attemptNumber);
        }
        double raw = baseDelayMs * Math.pow(backoffMultiplier, attemptNumber - 1);
        long capped = raw >= maxDelayMs ? maxDelayMs : (long) raw;
        return Duration.ofMillis(capped);
    }

    /**
     * Evaluates a failed attempt.
     *
     * @param context The current retry context
     * @param error The classified failure of that attempt
     * @return Retry with the backoff delay, or GiveUp
     */
    public RetryDecision decide(RetryContext context, ClassifiedError error) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(error, "error must not be null");

        if (!error.retryable()) {
            return RetryDecision.GiveUp.because("failure is not retryable");
        }
        if (context.attemptNumber() >= maxAttempts) {
            return RetryDecision.GiveUp.because("max attempts reached");
        }
        // A server-supplied wait belongs to the caller; retrying here would hide the signal.
        if (error.kind() == ErrorKind.RATE_LIMITED && error.retryAfterSeconds() != null) {
            return RetryDecision.GiveUp.because("rate limited, retry after " + error.retryAfterSeconds() + "s");
        }
        return RetryDecision.Retry.after(backoffDelay(context.attemptNumber()));
    }

    /**
     * Returns a copy with a different reporting label.
     */
    public RetryPolicy withId(String newId) {
        return new RetryPolicy(newId, maxAttempts, baseDelayMs, maxDelayMs, backoffMultiplier);
    }
}
