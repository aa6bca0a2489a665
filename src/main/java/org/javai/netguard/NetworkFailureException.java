package org.javai.netguard;

import java.util.Objects;

/**
 * Completes a fetch future exceptionally once a failure is terminal.
 * Carries the {@link ClassifiedError} verbatim so callers can decide between
 * "retry now", "wait N seconds" and "fix input and resubmit".
 */
public class NetworkFailureException extends RuntimeException {

    private final ClassifiedError error;

    public NetworkFailureException(ClassifiedError error) {
        super(Objects.requireNonNull(error, "error must not be null").kind() + ": " + error.message(), error.cause());
        this.error = error;
    }

    public ClassifiedError error() {
        return error;
    }
}
