package org.javai.netguard.ops;

import org.javai.netguard.ClassifiedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .add(new MetricsOpReporter("weather"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(String operation, ClassifiedError error, int attemptNumber) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.report(operation, error, attemptNumber);
			} catch (Exception e) {
				logReporterError("report", reporter, e);
			}
		}
	}

	@Override
	public void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(operation, error, attemptNumber, delay);
			} catch (Exception e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	@Override
	public void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts, String reason) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.reportRetryExhausted(operation, error, totalAttempts, reason);
			} catch (Exception e) {
				logReporterError("reportRetryExhausted", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, OpReporter reporter, Exception e) {
		LOG.warn("OpReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null is ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
