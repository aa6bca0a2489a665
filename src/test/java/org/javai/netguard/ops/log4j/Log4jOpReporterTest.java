package org.javai.netguard.ops.log4j;

import org.apache.logging.log4j.Level;
import org.javai.netguard.ClassifiedError;
import org.javai.netguard.ErrorKind;
import org.javai.netguard.FailureCode;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class Log4jOpReporterTest {

	@Test
	void levelFor_serverFaultAndUnknown_areErrors() {
		assertThat(Log4jOpReporter.levelFor(error(ErrorKind.SERVER_FAULT, true))).isEqualTo(Level.ERROR);
		assertThat(Log4jOpReporter.levelFor(error(ErrorKind.UNKNOWN, false))).isEqualTo(Level.ERROR);
	}

	@Test
	void levelFor_otherKinds_areWarnings() {
		assertThat(Log4jOpReporter.levelFor(error(ErrorKind.TIMEOUT, true))).isEqualTo(Level.WARN);
		assertThat(Log4jOpReporter.levelFor(error(ErrorKind.NOT_FOUND, false))).isEqualTo(Level.WARN);
	}

	@Test
	void levelFor_cancellation_isDebug() {
		ClassifiedError cancelled = ClassifiedError.terminal(ErrorKind.CONNECTION, ClassifiedError.CANCELLED,
				"Request cancelled", null);

		assertThat(Log4jOpReporter.levelFor(cancelled)).isEqualTo(Level.DEBUG);
	}

	@Test
	void reportMethods_logWithoutThrowing() {
		Log4jOpReporter reporter = new Log4jOpReporter("org.javai.netguard.test");
		ClassifiedError error = ClassifiedError.rateLimited(FailureCode.of("http", "429"), "HTTP 429", 30,
				new IllegalStateException("cause"));

		assertThatCode(() -> {
			reporter.report("Forecast.current", error, 1);
			reporter.reportRetryAttempt("Forecast.current", error, 1, Duration.ofMillis(500));
			reporter.reportRetryExhausted("Forecast.current", error, 1, "rate limited, retry after 30s");
		}).doesNotThrowAnyException();
	}

	private static ClassifiedError error(ErrorKind kind, boolean retryable) {
		FailureCode code = FailureCode.of("test", kind.name().toLowerCase());
		return retryable
				? ClassifiedError.retryable(kind, code, "failure", null)
				: ClassifiedError.terminal(kind, code, "failure", null);
	}
}
