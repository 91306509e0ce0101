package org.javai.tasks.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.tasks.Failure;
import org.javai.tasks.ops.OpReporter;

import java.time.Duration;

/**
 * Reports failures and retry progress through Log4j2.
 *
 * <p>Levels:
 * <ul>
 *   <li>failure, retry attempt → INFO</li>
 *   <li>retry exhausted → WARN</li>
 *   <li>cancelled → INFO</li>
 * </ul>
 * Each event carries a marker ({@code FAILURE}, {@code RETRY}, {@code RETRY_EXHAUSTED},
 * {@code CANCELLED}) so appenders can route them separately.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker CANCELLED_MARKER = MarkerManager.getMarker("CANCELLED");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.tasks.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atInfo()
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.exception())
			.log("Failure in operation [{}]: {} | code={}",
				failure.operation(),
				failure.message(),
				failure.id());
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of operation [{}] failed, retrying in {} ms. Code: {}, Message: {}",
				attemptNumber,
				failure.operation(),
				delay.toMillis(),
				failure.id(),
				failure.message());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for operation [{}] after {} attempts. Last code: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				failure.id(),
				failure.message());
	}

	@Override
	public void reportCancelled(Failure failure, int totalAttempts) {
		logger.atInfo()
			.withMarker(CANCELLED_MARKER)
			.log("Retry of operation [{}] cancelled after {} attempts. Last code: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				failure.id(),
				failure.message());
	}
}
