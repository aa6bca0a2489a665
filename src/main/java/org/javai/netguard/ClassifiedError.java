package org.javai.netguard;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A raw failure normalized into the {@link ErrorKind} taxonomy with a retryability verdict.
 * Created once per failed attempt and never modified.
 *
 * @param kind The failure kind
 * @param retryable Whether the retry orchestrator may try again
 * @param retryAfterSeconds Caller-directed wait in seconds (may be null; only set for rate limits)
 * @param message Human-readable description of what happened
 * @param code Stable identifier for logs and metrics
 * @param cause The underlying failure (may be null)
 * @param occurredAt When the failure was classified
 */
public record ClassifiedError(
        ErrorKind kind,
        boolean retryable,
        Integer retryAfterSeconds,
        String message,
        FailureCode code,
        Throwable cause,
        Instant occurredAt
) {

    public static final FailureCode CANCELLED = FailureCode.of("network", "cancelled");
    public static final FailureCode OFFLINE = FailureCode.of("network", "offline");

    public ClassifiedError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        if (retryable && !kind.mayRetry()) {
            throw new IllegalArgumentException(kind + " errors are never retryable");
        }
        if (retryAfterSeconds != null && retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0, was: " + retryAfterSeconds);
        }
    }

    /**
     * Creates an error the orchestrator may retry.
     */
    public static ClassifiedError retryable(ErrorKind kind, FailureCode code, String message, Throwable cause) {
        return new ClassifiedError(kind, true, null, message, code, cause, Instant.now());
    }

    /**
     * Creates an error that is surfaced to the caller without retry.
     */
    public static ClassifiedError terminal(ErrorKind kind, FailureCode code, String message, Throwable cause) {
        return new ClassifiedError(kind, false, null, message, code, cause, Instant.now());
    }

    /**
     * Creates a retryable rate-limit error carrying a caller-directed wait.
     */
    public static ClassifiedError rateLimited(FailureCode code, String message, int retryAfterSeconds, Throwable cause) {
        return new ClassifiedError(ErrorKind.RATE_LIMITED, true, retryAfterSeconds, message, code, cause, Instant.now());
    }

    /**
     * The error raised when a policy permits no attempts because the device is offline.
     */
    public static ClassifiedError offline(String message) {
        return terminal(ErrorKind.CONNECTION, OFFLINE, message, null);
    }

    /**
     * Whether this error stands for a user-initiated cancel rather than a network problem.
     * Cancelled requests share the {@link ErrorKind#CONNECTION} kind but should not show error UI.
     */
    public boolean isCancellation() {
        return CANCELLED.equals(code);
    }

    /**
     * The caller-directed wait as a duration, or null when none applies.
     */
    public Duration retryAfter() {
        return retryAfterSeconds == null ? null : Duration.ofSeconds(retryAfterSeconds);
    }

    /**
     * Default user-facing copy for this error.
     */
    public String userMessage() {
        return switch (kind) {
            case CONNECTION -> "Unable to connect to the weather service. Please check your internet connection.";
            case TIMEOUT -> "Request timed out. Please check your internet connection and try again.";
            case RATE_LIMITED -> "Too many requests. Please wait a moment before trying again.";
            case SERVER_FAULT -> "Weather service is temporarily unavailable. Please try again later.";
            case AUTH_FAILURE -> "Invalid API key. Please check your weather provider API key.";
            case FORBIDDEN -> "Access denied. Please check your API permissions.";
            case NOT_FOUND -> "Weather data not found for this location.";
            case INVALID_REQUEST -> "Invalid request. Please check your input and try again.";
            case UNKNOWN -> message.isBlank() ? "An unexpected error occurred. Please try again." : message;
        };
    }
}
