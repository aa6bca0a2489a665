package org.javai.netguard;

/**
 * The closed taxonomy of remote-fetch failures.
 */
public enum ErrorKind {
    /**
     * The remote end could not be reached (DNS, refused, reset, unreachable).
     * Also used for cancelled requests, which are never retryable.
     */
    CONNECTION(true),

    /**
     * The attempt did not complete within its time limit.
     */
    TIMEOUT(true),

    /**
     * The provider rejected the request because of request volume (HTTP 429).
     */
    RATE_LIMITED(true),

    /**
     * The provider failed on its side (HTTP 5xx).
     */
    SERVER_FAULT(true),

    /**
     * Credentials are missing or invalid (HTTP 401).
     */
    AUTH_FAILURE(false),

    /**
     * Credentials are valid but lack permission (HTTP 403).
     */
    FORBIDDEN(false),

    /**
     * No data exists for the request (HTTP 404).
     */
    NOT_FOUND(false),

    /**
     * The request was understood but rejected as invalid (HTTP 422).
     */
    INVALID_REQUEST(false),

    /**
     * Anything that could not be classified. Fails fast.
     */
    UNKNOWN(false);

    private final boolean mayRetry;

    ErrorKind(boolean mayRetry) {
        this.mayRetry = mayRetry;
    }

    /**
     * Whether an error of this kind is permitted to be marked retryable.
     */
    public boolean mayRetry() {
        return mayRetry;
    }
}
