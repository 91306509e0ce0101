package org.javai.tasks.ops.metrics;

import org.javai.tasks.Failure;
import org.javai.tasks.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports failures and retry progress as JSON-lines metrics via SLF4J.
 *
 * <p>One JSON object per event, suitable for log-based metrics pipelines. The
 * tracking key is the failed operation, optionally prefixed with a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"checkout.Inventory.reserve","attemptNumber":"1","delayMs":"200","code":"exception:IOException"}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.tasks.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

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

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		emit(startEvent("failure", failure)
			.field("message", failure.message()));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		emit(startEvent("retry_attempt", failure)
			.field("attemptNumber", String.valueOf(attemptNumber))
			.field("delayMs", String.valueOf(delay.toMillis())));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		emit(startEvent("retry_exhausted", failure)
			.field("totalAttempts", String.valueOf(totalAttempts)));
	}

	@Override
	public void reportCancelled(Failure failure, int totalAttempts) {
		emit(startEvent("cancelled", failure)
			.field("totalAttempts", String.valueOf(totalAttempts)));
	}

	String buildTrackingKey(Failure failure) {
		if (namespace == null) {
			return failure.operation();
		}
		return namespace + "." + failure.operation();
	}

	private JsonLine startEvent(String eventType, Failure failure) {
		return new JsonLine()
			.field("eventType", eventType)
			.field("timestamp", ISO_FORMATTER.format(failure.occurredAt()))
			.field("trackingKey", buildTrackingKey(failure))
			.field("code", failure.id().toString());
	}

	private void emit(JsonLine line) {
		try {
			logger.info(line.toString());
		} catch (RuntimeException e) {
			System.err.println("MetricsOpReporter failed to emit event: " + e.getMessage());
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}

	private static final class JsonLine {
		private final StringBuilder sb = new StringBuilder("{");

		JsonLine field(String key, String value) {
			if (sb.length() > 1) {
				sb.append(",");
			}
			sb.append("\"").append(escapeJson(key)).append("\":\"").append(escapeJson(value)).append("\"");
			return this;
		}

		@Override
		public String toString() {
			return sb + "}";
		}
	}
}
