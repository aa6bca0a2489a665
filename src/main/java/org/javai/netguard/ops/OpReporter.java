package org.javai.netguard.ops;

import org.javai.netguard.ClassifiedError;

import java.time.Duration;

/**
 * Reports fetch failures and retry activity for observability.
 * Implementations might emit structured logs or metrics. They must not block.
 */
public interface OpReporter {

	/**
	 * Reports a failed attempt, whether or not it will be retried.
	 *
	 * @param operation The operation name
	 * @param error The classified failure
	 * @param attemptNumber The attempt that failed (1-based)
	 */
	void report(String operation, ClassifiedError error, int attemptNumber);

	/**
	 * Reports that a retry has been scheduled.
	 *
	 * @param operation The operation name
	 * @param error The failure that triggered the retry
	 * @param attemptNumber The attempt that failed (1-based)
	 * @param delay The wait before the next attempt, jitter included
	 */
	default void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that the failure is terminal and will be surfaced to the caller.
	 *
	 * @param operation The operation name
	 * @param error The final failure
	 * @param totalAttempts The number of attempts made
	 * @param reason Why no further attempt is made
	 */
	default void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts, String reason) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static OpReporter noOp() {
		return (operation, error, attemptNumber) -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static OpReporter composite(OpReporter... reporters) {
		return CompositeOpReporter.of(reporters);
	}
}
