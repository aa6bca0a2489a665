package org.javai.netguard.classify;

import org.javai.netguard.ClassifiedError;
import org.javai.netguard.ErrorKind;
import org.javai.netguard.FailureCode;
import org.javai.netguard.MutableClock;
import org.javai.netguard.NetworkFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class DefaultErrorClassifierTest {

    private MutableClock clock;
    private DefaultErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-20T10:00:00Z");
        classifier = new DefaultErrorClassifier(DefaultErrorClassifier.DEFAULT_RATE_LIMIT_RETRY_AFTER_SECONDS, clock);
    }

    @Test
    void classify_unknownHost_isRetryableConnection() {
        ClassifiedError error = classifier.classify(new UnknownHostException("api.example.com"));

        assertThat(error.kind()).isEqualTo(ErrorKind.CONNECTION);
        assertThat(error.retryable()).isTrue();
        assertThat(error.code()).isEqualTo(FailureCode.of("network", "dns"));
        assertThat(error.occurredAt()).isEqualTo(clock.instant());
    }

    @Test
    void classify_transportFailures_areRetryableConnection() {
        assertThat(classifier.classify(new ConnectException("refused")).code())
                .isEqualTo(FailureCode.of("network", "connection_refused"));
        assertThat(classifier.classify(new NoRouteToHostException("no route")).code())
                .isEqualTo(FailureCode.of("network", "unreachable"));
        assertThat(classifier.classify(new SocketException("Connection reset")).code())
                .isEqualTo(FailureCode.of("network", "connection_reset"));
        assertThat(classifier.classify(new SocketException("reset")).retryable()).isTrue();
    }

    @Test
    void classify_timeouts_areRetryableTimeout() {
        ClassifiedError socket = classifier.classify(new SocketTimeoutException("Read timed out"));
        ClassifiedError http = classifier.classify(new HttpTimeoutException("request timed out"));
        ClassifiedError operation = classifier.classify(new TimeoutException());

        assertThat(List.of(socket, http, operation))
                .allSatisfy(error -> {
                    assertThat(error.kind()).isEqualTo(ErrorKind.TIMEOUT);
                    assertThat(error.retryable()).isTrue();
                });
        assertThat(operation.code()).isEqualTo(FailureCode.of("operation", "timeout"));
    }

    @Test
    void classify_cancellation_isNonRetryableConnection() {
        ClassifiedError error = classifier.classify(new CancellationException());

        assertThat(error.kind()).isEqualTo(ErrorKind.CONNECTION);
        assertThat(error.retryable()).isFalse();
        assertThat(error.isCancellation()).isTrue();
    }

    @Test
    void classify_interrupted_isCancellation() {
        assertThat(classifier.classify(new InterruptedException()).isCancellation()).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "401, AUTH_FAILURE",
            "403, FORBIDDEN",
            "404, NOT_FOUND",
            "422, INVALID_REQUEST"
    })
    void classify_clientErrors_areTerminal(int status, ErrorKind expected) {
        ClassifiedError error = classifier.classify(new HttpStatusException(status));

        assertThat(error.kind()).isEqualTo(expected);
        assertThat(error.retryable()).isFalse();
        assertThat(error.code()).hasToString("http:" + status);
    }

    @ParameterizedTest
    @ValueSource(ints = {500, 502, 503, 504, 599})
    void classify_serverErrors_areRetryableServerFault(int status) {
        ClassifiedError error = classifier.classify(new HttpStatusException(status));

        assertThat(error.kind()).isEqualTo(ErrorKind.SERVER_FAULT);
        assertThat(error.retryable()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 409, 418})
    void classify_otherClientErrors_areUnknown(int status) {
        ClassifiedError error = classifier.classify(new HttpStatusException(status));

        assertThat(error.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(error.retryable()).isFalse();
    }

    @Test
    void classify_tooManyRequestsWithSeconds_usesHeader() {
        HttpStatusException tooMany = new HttpStatusException(429, Map.of("retry-after", List.of("30")), "HTTP 429");

        ClassifiedError error = classifier.classify(tooMany);

        assertThat(error.kind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(error.retryable()).isTrue();
        assertThat(error.retryAfterSeconds()).isEqualTo(30);
    }

    @Test
    void classify_tooManyRequestsWithHttpDate_usesSecondsUntilDate() {
        HttpStatusException tooMany = new HttpStatusException(429,
                Map.of("Retry-After", List.of("Sat, 20 Jan 2024 10:02:00 GMT")), "HTTP 429");

        ClassifiedError error = classifier.classify(tooMany);

        assertThat(error.retryAfterSeconds()).isEqualTo(120);
    }

    @Test
    void classify_tooManyRequestsWithPastDate_waitsZeroSeconds() {
        HttpStatusException tooMany = new HttpStatusException(429,
                Map.of("Retry-After", List.of("Sat, 20 Jan 2024 09:00:00 GMT")), "HTTP 429");

        assertThat(classifier.classify(tooMany).retryAfterSeconds()).isZero();
    }

    @Test
    void classify_tooManyRequestsWithoutHeader_usesDefault() {
        ClassifiedError error = classifier.classify(new HttpStatusException(429));

        assertThat(error.retryAfterSeconds()).isEqualTo(60);
    }

    @Test
    void classify_tooManyRequestsWithGarbageHeader_usesConfiguredDefault() {
        DefaultErrorClassifier custom = new DefaultErrorClassifier(15, clock);
        HttpStatusException tooMany = new HttpStatusException(429, Map.of("Retry-After", List.of("soon")), "HTTP 429");

        assertThat(custom.classify(tooMany).retryAfterSeconds()).isEqualTo(15);
    }

    @Test
    void classify_wrappedFailure_classifiesRootCause() {
        CompletionException wrapped = new CompletionException(
                new ExecutionException(new SocketTimeoutException("Read timed out")));

        ClassifiedError error = classifier.classify(wrapped);

        assertThat(error.kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(error.cause()).isInstanceOf(SocketTimeoutException.class);
    }

    @Test
    void classify_networkFailureException_passesThrough() {
        ClassifiedError original = ClassifiedError.offline("offline");

        ClassifiedError error = classifier.classify(new CompletionException(new NetworkFailureException(original)));

        assertThat(error).isSameAs(original);
    }

    @Test
    void classify_unrecognised_isUnknownAndTerminal() {
        ClassifiedError error = classifier.classify(new IllegalStateException("Unexpected response body"));

        assertThat(error.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(error.retryable()).isFalse();
        assertThat(error.code()).isEqualTo(FailureCode.of("unknown", "IllegalStateException"));
        assertThat(error.message()).isEqualTo("Unexpected response body");
    }

    @ParameterizedTest
    @ValueSource(strings = {"HTTP/1.1 header parser received no bytes", "connection closed locally"})
    void classify_plainIoFailure_isRetryableConnection(String message) {
        ClassifiedError error = classifier.classify(new IOException(message));

        assertThat(error.kind()).isEqualTo(ErrorKind.CONNECTION);
        assertThat(error.retryable()).isTrue();
        assertThat(error.code()).isEqualTo(FailureCode.of("network", "io"));
        assertThat(error.message()).endsWith(message);
    }

    @Test
    void classify_earlyEof_isRetryableConnection() {
        ClassifiedError error = classifier.classify(new CompletionException(new EOFException("EOF reached while reading")));

        assertThat(error.kind()).isEqualTo(ErrorKind.CONNECTION);
        assertThat(error.retryable()).isTrue();
        assertThat(error.code()).isEqualTo(FailureCode.of("network", "io"));
    }

    @Test
    void classify_ioTimeoutSubtype_staysTimeout() {
        ClassifiedError error = classifier.classify(new HttpTimeoutException("request timed out"));

        assertThat(error.kind()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    void constructor_negativeDefault_throws() {
        assertThatThrownBy(() -> new DefaultErrorClassifier(-1, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void httpStatusException_invalidStatus_throws() {
        assertThatThrownBy(() -> new HttpStatusException(42)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void httpStatusException_header_isCaseInsensitive() {
        HttpStatusException exception = new HttpStatusException(503, Map.of("RETRY-AFTER", List.of("5")), "HTTP 503");

        assertThat(exception.header("retry-after")).contains("5");
        assertThat(exception.header("X-Missing")).isEmpty();
    }
}
