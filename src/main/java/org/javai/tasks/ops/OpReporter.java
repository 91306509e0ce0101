package org.javai.tasks.ops;

import org.javai.tasks.Failure;

import java.time.Duration;

/**
 * Reports failures and retry progress for observability.
 * Implementations might emit structured logs, metrics, or alerts.
 *
 * <p>The retry loop hands every reporter the last operation failure, which the
 * loop itself does not return to its caller.</p>
 */
public interface OpReporter {

	/**
	 * Reports a failure occurrence.
	 */
	void report(Failure failure);

	/**
	 * Reports that a failed attempt will be retried.
	 *
	 * @param failure The failure that triggered the retry
	 * @param attemptNumber The attempt that failed (1-based)
	 * @param delay How long the loop waits before the next attempt
	 */
	default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
	}

	/**
	 * Reports that the retry policy gave up.
	 *
	 * @param failure The last operation failure
	 * @param totalAttempts The total number of attempts made
	 */
	default void reportRetryExhausted(Failure failure, int totalAttempts) {
	}

	/**
	 * Reports that the session was cancelled while waiting to retry.
	 *
	 * @param failure The last operation failure
	 * @param totalAttempts The total number of attempts made
	 */
	default void reportCancelled(Failure failure, int totalAttempts) {
	}

	/**
	 * A reporter that does nothing.
	 */
	static OpReporter noOp() {
		return failure -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 */
	static OpReporter composite(OpReporter... reporters) {
		return CompositeOpReporter.of(reporters);
	}
}
