package org.javai.netguard;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class ClassifiedErrorTest {

    private static final FailureCode CODE = FailureCode.of("test", "code");

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = {"AUTH_FAILURE", "FORBIDDEN", "NOT_FOUND", "INVALID_REQUEST", "UNKNOWN"})
    void constructor_retryableTerminalKind_throws(ErrorKind kind) {
        assertThatThrownBy(() -> new ClassifiedError(kind, true, null, "boom", CODE, null, Instant.EPOCH))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("never retryable");
    }

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = {"CONNECTION", "TIMEOUT", "RATE_LIMITED", "SERVER_FAULT"})
    void constructor_retryableTransientKind_accepted(ErrorKind kind) {
        ClassifiedError error = new ClassifiedError(kind, true, null, "boom", CODE, null, Instant.EPOCH);

        assertThat(error.retryable()).isTrue();
    }

    @Test
    void constructor_negativeRetryAfter_throws() {
        assertThatThrownBy(() -> new ClassifiedError(ErrorKind.RATE_LIMITED, true, -1, "slow down", CODE, null,
                Instant.EPOCH))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rateLimited_exposesRetryAfterAsDuration() {
        ClassifiedError error = ClassifiedError.rateLimited(CODE, "slow down", 30, null);

        assertThat(error.kind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(error.retryable()).isTrue();
        assertThat(error.retryAfter()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void retryAfter_absent_isNull() {
        ClassifiedError error = ClassifiedError.retryable(ErrorKind.TIMEOUT, CODE, "slow", null);

        assertThat(error.retryAfter()).isNull();
    }

    @Test
    void offline_isNonRetryableConnection() {
        ClassifiedError error = ClassifiedError.offline("no network");

        assertThat(error.kind()).isEqualTo(ErrorKind.CONNECTION);
        assertThat(error.retryable()).isFalse();
        assertThat(error.code()).isEqualTo(ClassifiedError.OFFLINE);
        assertThat(error.isCancellation()).isFalse();
    }

    @Test
    void isCancellation_onlyForCancelledCode() {
        ClassifiedError cancelled = ClassifiedError.terminal(ErrorKind.CONNECTION, ClassifiedError.CANCELLED,
                "Request cancelled", null);
        ClassifiedError refused = ClassifiedError.retryable(ErrorKind.CONNECTION,
                FailureCode.of("network", "connection_refused"), "refused", null);

        assertThat(cancelled.isCancellation()).isTrue();
        assertThat(refused.isCancellation()).isFalse();
    }

    @Test
    void userMessage_knownKind_usesFixedCopy() {
        ClassifiedError error = ClassifiedError.retryable(ErrorKind.TIMEOUT, CODE, "read timed out", null);

        assertThat(error.userMessage()).startsWith("Request timed out.");
    }

    @Test
    void userMessage_unknownKind_usesOwnMessage() {
        ClassifiedError error = ClassifiedError.terminal(ErrorKind.UNKNOWN, CODE, "Unexpected token", null);

        assertThat(error.userMessage()).isEqualTo("Unexpected token");
    }

    @Test
    void networkFailureException_carriesErrorAndCause() {
        IllegalStateException cause = new IllegalStateException("bad");
        ClassifiedError error = ClassifiedError.terminal(ErrorKind.UNKNOWN, CODE, "bad", cause);

        NetworkFailureException exception = new NetworkFailureException(error);

        assertThat(exception.error()).isSameAs(error);
        assertThat(exception.getCause()).isSameAs(cause);
        assertThat(exception.getMessage()).isEqualTo("UNKNOWN: bad");
    }

    @Test
    void failureCode_toString_joinsWithColon() {
        assertThat(FailureCode.of("http", "429")).hasToString("http:429");
    }

    @Test
    void failureCode_blankPart_throws() {
        assertThatThrownBy(() -> FailureCode.of(" ", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FailureCode.of("x", "")).isInstanceOf(IllegalArgumentException.class);
    }
}
