package org.javai.netguard.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.netguard.ClassifiedError;
import org.javai.netguard.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports fetch failures as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"weather.current","attemptNumber":2,"kind":"TIMEOUT",...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.netguard.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(String operation, ClassifiedError error, int attemptNumber) {
		try {
			logger.info(buildFailureJson(operation, error, attemptNumber));
		} catch (RuntimeException e) {
			logger.debug("Could not emit failure metric for {}", operation, e);
		}
	}

	@Override
	public void reportRetryAttempt(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
		try {
			logger.info(buildRetryAttemptJson(operation, error, attemptNumber, delay));
		} catch (RuntimeException e) {
			logger.debug("Could not emit retry metric for {}", operation, e);
		}
	}

	@Override
	public void reportRetryExhausted(String operation, ClassifiedError error, int totalAttempts, String reason) {
		try {
			logger.info(buildRetryExhaustedJson(operation, error, totalAttempts, reason));
		} catch (RuntimeException e) {
			logger.debug("Could not emit exhaustion metric for {}", operation, e);
		}
	}

	String buildFailureJson(String operation, ClassifiedError error, int attemptNumber) {
		ObjectNode event = event("failure", operation, error);
		event.put("attemptNumber", attemptNumber);
		event.put("kind", error.kind().name());
		event.put("code", error.code().toString());
		event.put("retryable", error.retryable());
		if (error.retryAfterSeconds() != null) {
			event.put("retryAfterSeconds", error.retryAfterSeconds());
		}
		event.put("message", error.message());
		return toJson(event);
	}

	String buildRetryAttemptJson(String operation, ClassifiedError error, int attemptNumber, Duration delay) {
		ObjectNode event = event("retry_attempt", operation, error);
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		event.put("code", error.code().toString());
		return toJson(event);
	}

	String buildRetryExhaustedJson(String operation, ClassifiedError error, int totalAttempts, String reason) {
		ObjectNode event = event("retry_exhausted", operation, error);
		event.put("totalAttempts", totalAttempts);
		event.put("reason", reason);
		event.put("kind", error.kind().name());
		event.put("code", error.code().toString());
		return toJson(event);
	}

	private ObjectNode event(String eventType, String operation, ClassifiedError error) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(error.occurredAt()));
		event.put("trackingKey", buildTrackingKey(operation));
		return event;
	}

	private static String toJson(ObjectNode event) {
		try {
			return MAPPER.writeValueAsString(event);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
