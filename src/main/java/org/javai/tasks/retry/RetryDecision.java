package org.javai.tasks.retry;

import org.javai.tasks.Failure;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision a retry policy makes after a failed attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Wait for the given delay, then attempt the operation again.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry immediate() {
            return new Retry(Duration.ZERO);
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Stop retrying; {@code reason} is the terminal failure handed back to the caller.
     */
    record GiveUp(Failure reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp because(Failure reason) {
            return new GiveUp(reason);
        }
    }
}
