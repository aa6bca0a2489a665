package org.javai.netguard.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.netguard.ClassifiedError;
import org.javai.netguard.ops.OpReporter;

import java.time.Duration;

/**
 * Reports fetch failures using Log4j2.
 *
 * <p>Failed attempts are logged at a level chosen by the error:
 * <ul>
 *   <li>{@code SERVER_FAULT}, {@code UNKNOWN} → ERROR</li>
 *   <li>cancellations → DEBUG</li>
 *   <li>everything else → WARN</li>
 * </ul>
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.netguard.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, ClassifiedError error, int attemptNumber) {
		logger.atLevel(levelFor(error))
			.withMarker(FAILURE_MARKER)
			.log("Attempt {} of operation [{}] failed: {} | kind={}, code={}, retryable={}{}{}",
				attemptNumber,
				operation,
				error.message(),
				error.kind(),
				error.code(),
				error.retryable(),
				formatRetryAfter(error),
				formatCause(error));
	}

	@Override
	public void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying operation [{}] after attempt {} in {} ms. Code: {}",
				operation,
				attemptNumber,
				delay.toMillis(),
				error.code());
	}

	@Override
	public void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts, String reason) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Giving up on operation [{}] after {} attempts ({}). Code: {}, Message: {}",
				operation,
				totalAttempts,
				reason,
				error.code(),
				error.message());
	}

	static Level levelFor(ClassifiedError error) {
		if (error.isCancellation()) {
			return Level.DEBUG;
		}
		return switch (error.kind()) {
			case SERVER_FAULT, UNKNOWN -> Level.ERROR;
			default -> Level.WARN;
		};
	}

	private static String formatRetryAfter(ClassifiedError error) {
		return error.retryAfterSeconds() != null ? ", retryAfter=" + error.retryAfterSeconds() + "s" : "";
	}

	private static String formatCause(ClassifiedError error) {
		return error.cause() != null ? ", cause=" + error.cause().getClass().getName() : "";
	}
}
