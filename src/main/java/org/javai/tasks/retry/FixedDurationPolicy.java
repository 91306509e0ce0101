package org.javai.tasks.retry;

import org.javai.tasks.TaskFailures;

import java.time.Duration;
import java.util.Objects;

/**
 * Waits the same period between attempts, for a bounded number of attempts.
 *
 * <p>Each call to {@link #next()} increments the failure count first and gives up
 * once the count reaches {@code maxRetry}. The number of retries actually performed
 * is therefore {@code maxRetry - 1}: with {@code maxRetry = 1} the first failure ends
 * the session without any wait, with {@code maxRetry = 3} the operation runs three
 * times with two waits in between. Callers depend on these counts, so the comparison
 * stays {@code >=}.</p>
 *
 * <p>Not thread-safe. One instance per retry session.</p>
 */
public final class FixedDurationPolicy implements RetryPolicy {

    private final Duration retryPeriod;
    private final int maxRetry;
    private int count;

    /**
     * @param retryPeriod delay between attempts, must not be negative
     * @param maxRetry failure count at which the policy gives up; 0 behaves like 1
     * @throws IllegalArgumentException if retryPeriod or maxRetry is negative
     */
    public FixedDurationPolicy(Duration retryPeriod, int maxRetry) {
        this.retryPeriod = Objects.requireNonNull(retryPeriod, "retryPeriod must not be null");
        if (retryPeriod.isNegative()) {
            throw new IllegalArgumentException("retryPeriod must not be negative, was: " + retryPeriod);
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
        return RetryDecision.Retry.after(retryPeriod);
    }

    @Override
    public String id() {
        return "fixed-duration";
    }

    public Duration retryPeriod() {
        return retryPeriod;
    }

    public int maxRetry() {
        return maxRetry;
    }

    /**
     * Number of failures recorded so far.
     */
    public int count() {
        return count;
    }
}
