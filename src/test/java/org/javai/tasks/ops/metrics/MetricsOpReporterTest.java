package org.javai.tasks.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.tasks.Failure;
import org.javai.tasks.FailureId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsOpReporterTest {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;
	private MetricsOpReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		reporter = new MetricsOpReporter(null, capturingLogger);
	}

	@Test
	void report_emitsFailureEventAsJsonLine() throws Exception {
		reporter.report(createFailure("Inventory.reserve", "stock \"locked\"\nretry later"));

		JsonNode json = singleEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("failure");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("Inventory.reserve");
		assertThat(json.get("code").asText()).isEqualTo("test:unavailable");
		assertThat(json.get("message").asText()).isEqualTo("stock \"locked\"\nretry later");
	}

	@Test
	void reportRetryAttempt_includesAttemptAndDelay() throws Exception {
		reporter.reportRetryAttempt(createFailure("Inventory.reserve", "busy"), 2, Duration.ofMillis(250));

		JsonNode json = singleEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("retry_attempt");
		assertThat(json.get("attemptNumber").asText()).isEqualTo("2");
		assertThat(json.get("delayMs").asText()).isEqualTo("250");
	}

	@Test
	void reportRetryExhausted_includesTotalAttempts() throws Exception {
		reporter.reportRetryExhausted(createFailure("Inventory.reserve", "busy"), 3);

		JsonNode json = singleEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("retry_exhausted");
		assertThat(json.get("totalAttempts").asText()).isEqualTo("3");
	}

	@Test
	void reportCancelled_emitsCancelledEvent() throws Exception {
		reporter.reportCancelled(createFailure("Inventory.reserve", "busy"), 1);

		assertThat(singleEvent().get("eventType").asText()).isEqualTo("cancelled");
	}

	@Test
	void namespace_prependsToTrackingKey() {
		MetricsOpReporter namespaced = new MetricsOpReporter(" checkout ", capturingLogger);

		assertThat(namespaced.buildTrackingKey(createFailure("Inventory.reserve", "x")))
			.isEqualTo("checkout.Inventory.reserve");
	}

	@Test
	void blankNamespace_isIgnored() {
		MetricsOpReporter blank = new MetricsOpReporter("  ", capturingLogger);

		assertThat(blank.buildTrackingKey(createFailure("Inventory.reserve", "x")))
			.isEqualTo("Inventory.reserve");
	}

	@Test
	void escapeJson_handlesSpecialCharacters() {
		assertThat(MetricsOpReporter.escapeJson("a\\b\"c\td")).isEqualTo("a\\\\b\\\"c\\td");
		assertThat(MetricsOpReporter.escapeJson(null)).isEmpty();
	}

	private JsonNode singleEvent() throws Exception {
		assertThat(capturedMessages).hasSize(1);
		return MAPPER.readTree(capturedMessages.get(0));
	}

	private static Failure createFailure(String operation, String message) {
		return new Failure(FailureId.of("test", "unavailable"), message, operation, null,
			Instant.parse("2024-01-20T10:30:00Z"));
	}

	/**
	 * Collects formatted messages instead of writing them anywhere.
	 */
	static final class CapturingLogger extends LegacyAbstractLogger {
		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.messages = messages;
			this.name = "capturing";
		}

		@Override
		protected String getFullyQualifiedCallerName() {
			return null;
		}

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			messages.add(arguments == null ? messagePattern : MessageFormatter.basicArrayFormat(messagePattern, arguments));
		}

		@Override
		public boolean isTraceEnabled() {
			return true;
		}

		@Override
		public boolean isDebugEnabled() {
			return true;
		}

		@Override
		public boolean isInfoEnabled() {
			return true;
		}

		@Override
		public boolean isWarnEnabled() {
			return true;
		}

		@Override
		public boolean isErrorEnabled() {
			return true;
		}
	}
}
