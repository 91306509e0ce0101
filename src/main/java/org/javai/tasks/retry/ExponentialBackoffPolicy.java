package org.javai.tasks.retry;

import org.javai.tasks.TaskFailures;

import java.time.Duration;
import java.util.Objects;

/**
 * Doubles the delay after every failure, up to a ceiling.
 *
 * <p>Counts failures exactly like {@link FixedDurationPolicy}. The n-th retry waits
 * {@code initialDelay * 2^(n-1)}, capped at {@code maxDelay}.</p>
 *
 * <p>Not thread-safe. One instance per retry session.</p>
 */
public final class ExponentialBackoffPolicy implements RetryPolicy {

    // 2^62 already overflows any sensible delay
    private static final int MAX_SHIFT = 62;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final int maxRetry;
    private int count;

    public ExponentialBackoffPolicy(Duration initialDelay, Duration maxDelay, int maxRetry) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (maxRetry < 0) {
            throw new IllegalArgumentException("maxRetry must be >= 0, was: " + maxRetry);
        }
        this.maxRetry = maxRetry;
    }

    @Override
    public RetryDecision next() {
        count++;
        if (count >= maxRetry) {
            return RetryDecision.GiveUp.because(TaskFailures.maxRetryReached(id()));
        }
        return RetryDecision.Retry.after(delayFor(count));
    }

    @Override
    public String id() {
        return "exponential-backoff";
    }

    private Duration delayFor(int failures) {
        int shift = Math.min(failures - 1, MAX_SHIFT);
        try {
            Duration delay = initialDelay.multipliedBy(1L << shift);
            return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
        } catch (ArithmeticException e) {
            return maxDelay;
        }
    }
}
