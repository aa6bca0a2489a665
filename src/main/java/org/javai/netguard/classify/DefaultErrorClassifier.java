package org.javai.netguard.classify;

import org.javai.netguard.ClassifiedError;
import org.javai.netguard.ErrorKind;
import org.javai.netguard.FailureCode;
import org.javai.netguard.NetworkFailureException;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies JDK networking exceptions and {@link HttpStatusException}s.
 *
 * <p>Classification order, first match wins:
 * <ol>
 *   <li>Cancellation: {@code CONNECTION}, not retryable</li>
 *   <li>Transport failures (DNS, refused, reset, unreachable): {@code CONNECTION}, retryable</li>
 *   <li>Timeouts: {@code TIMEOUT}, retryable</li>
 *   <li>Other I/O failures (early EOF, connection closed mid-exchange): {@code CONNECTION}, retryable</li>
 *   <li>HTTP status: 401, 403, 404, 422 terminal; 429 and 5xx retryable</li>
 *   <li>Fallback: {@code UNKNOWN}, not retryable</li>
 * </ol>
 *
 * <p>{@link CompletionException} and {@link ExecutionException} wrappers are unwrapped first,
 * and a {@link NetworkFailureException} is passed through with its existing classification.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    /**
     * Wait applied to a 429 response that carries no usable {@code Retry-After} header.
     */
    public static final int DEFAULT_RATE_LIMIT_RETRY_AFTER_SECONDS = 60;

    private final int defaultRetryAfterSeconds;
    private final Clock clock;

    public DefaultErrorClassifier() {
        this(DEFAULT_RATE_LIMIT_RETRY_AFTER_SECONDS, Clock.systemUTC());
    }

    public DefaultErrorClassifier(int defaultRetryAfterSeconds, Clock clock) {
        if (defaultRetryAfterSeconds < 0) {
            throw new IllegalArgumentException("defaultRetryAfterSeconds must be >= 0, was: " + defaultRetryAfterSeconds);
        }
        this.defaultRetryAfterSeconds = defaultRetryAfterSeconds;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ClassifiedError classify(Throwable failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        Throwable t = unwrap(failure);

        if (t instanceof NetworkFailureException nfe) {
            return nfe.error();
        }

        if (isCancellation(t)) {
            return error(ErrorKind.CONNECTION, false, ClassifiedError.CANCELLED, "Request cancelled", t);
        }

        if (t instanceof UnknownHostException) {
            return error(ErrorKind.CONNECTION, true, FailureCode.of("network", "dns"), messageFor("Unknown host", t), t);
        }

        if (t instanceof ConnectException) {
            return error(ErrorKind.CONNECTION, true, FailureCode.of("network", "connection_refused"),
                    messageFor("Connection refused", t), t);
        }

        if (t instanceof NoRouteToHostException || t instanceof PortUnreachableException) {
            return error(ErrorKind.CONNECTION, true, FailureCode.of("network", "unreachable"),
                    messageFor("Host unreachable", t), t);
        }

        if (t instanceof SocketException) {
            return error(ErrorKind.CONNECTION, true, FailureCode.of("network", "connection_reset"),
                    messageFor("Connection reset", t), t);
        }

        if (t instanceof SocketTimeoutException || t instanceof HttpConnectTimeoutException) {
            return error(ErrorKind.TIMEOUT, true, FailureCode.of("network", "timeout"), messageFor("Socket timeout", t), t);
        }

        if (t instanceof HttpTimeoutException) {
            return error(ErrorKind.TIMEOUT, true, FailureCode.of("network", "http_timeout"), messageFor("HTTP timeout", t), t);
        }

        if (t instanceof TimeoutException) {
            return error(ErrorKind.TIMEOUT, true, FailureCode.of("operation", "timeout"),
                    messageFor("Operation timeout", t), t);
        }

        if (t instanceof EOFException) {
            return error(ErrorKind.CONNECTION, true, FailureCode.of("network", "io"),
                    messageFor("Connection closed early", t), t);
        }

        if (t instanceof IOException) {
            return error(ErrorKind.CONNECTION, true, FailureCode.of("network", "io"), messageFor("I/O failure", t), t);
        }

        if (t instanceof HttpStatusException http) {
            ClassifiedError classified = classifyStatus(http);
            if (classified != null) {
                return classified;
            }
        }

        return error(ErrorKind.UNKNOWN, false, FailureCode.of("unknown", t.getClass().getSimpleName()),
                t.getMessage() != null ? t.getMessage() : t.getClass().getName(), t);
    }

    private ClassifiedError classifyStatus(HttpStatusException http) {
        int status = http.statusCode();
        FailureCode code = FailureCode.of("http", Integer.toString(status));
        return switch (status) {
            case 401 -> error(ErrorKind.AUTH_FAILURE, false, code, http.getMessage(), http);
            case 403 -> error(ErrorKind.FORBIDDEN, false, code, http.getMessage(), http);
            case 404 -> error(ErrorKind.NOT_FOUND, false, code, http.getMessage(), http);
            case 422 -> error(ErrorKind.INVALID_REQUEST, false, code, http.getMessage(), http);
            case 429 -> new ClassifiedError(
                    ErrorKind.RATE_LIMITED,
                    true,
                    retryAfterSeconds(http),
                    http.getMessage(),
                    code,
                    http,
                    now());
            default -> status >= 500 ? error(ErrorKind.SERVER_FAULT, true, code, http.getMessage(), http) : null;
        };
    }

    private int retryAfterSeconds(HttpStatusException http) {
        return http.header("Retry-After")
                .map(value -> RetryAfterParser.parseSeconds(value, clock))
                .orElse(OptionalInt.empty())
                .orElse(defaultRetryAfterSeconds);
    }

    private static boolean isCancellation(Throwable t) {
        return t instanceof CancellationException
                || t instanceof InterruptedException
                || t instanceof ClosedByInterruptException;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null
                && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private ClassifiedError error(ErrorKind kind, boolean retryable, FailureCode code, String message, Throwable cause) {
        return new ClassifiedError(kind, retryable, null, message, code, cause, now());
    }

    private Instant now() {
        return clock.instant();
    }

    private static String messageFor(String prefix, Throwable t) {
        return t.getMessage() != null ? prefix + ": " + t.getMessage() : prefix;
    }
}
