package org.javai.tasks.retry;

import org.javai.tasks.TaskFailures;

import java.time.Clock;
import java.time.Duration;

/**
 * Decides, after each failed attempt, whether and when to try again.
 *
 * <p>A policy is a stateful object: every call to {@link #next()} counts as one
 * failed attempt. Create a fresh instance for each retry session and never share one
 * between threads or sessions, otherwise attempt counts carry over.</p>
 *
 * <p>Any lambda returning a {@link RetryDecision} is a policy:</p>
 * <pre>{@code
 * AtomicInteger failures = new AtomicInteger();
 * RetryPolicy custom = () -> failures.incrementAndGet() < 4
 *         ? RetryDecision.Retry.after(Duration.ofMillis(50L * failures.get()))
 *         : RetryDecision.GiveUp.because(TaskFailures.maxRetryReached("linear"));
 * }</pre>
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Records a failed attempt and decides what happens next.
     *
     * @return Retry with a delay, or GiveUp with the terminal failure
     */
    RetryDecision next();

    /**
     * An identifier for this policy, used in reporting.
     */
    default String id() {
        return "custom";
    }

    /**
     * Waits {@code retryPeriod} between attempts and gives up on the
     * {@code maxRetry}-th failure. See {@link FixedDurationPolicy} for the exact count.
     */
    static RetryPolicy fixedDuration(Duration retryPeriod, int maxRetry) {
        return new FixedDurationPolicy(retryPeriod, maxRetry);
    }

    /**
     * Retries without delay, giving up on the {@code maxRetry}-th failure.
     */
    static RetryPolicy immediate(int maxRetry) {
        return new FixedDurationPolicy(Duration.ZERO, maxRetry);
    }

    /**
     * Gives up on the first failure.
     */
    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public RetryDecision next() {
                return RetryDecision.GiveUp.because(TaskFailures.maxRetryReached(id()));
            }

            @Override
            public String id() {
                return "no-retry";
            }
        };
    }

    /**
     * Doubles the delay after every failure, starting at {@code initialDelay} and
     * capped at {@code maxDelay}, giving up on the {@code maxRetry}-th failure.
     */
    static RetryPolicy exponentialBackoff(Duration initialDelay, Duration maxDelay, int maxRetry) {
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, maxRetry);
    }

    /**
     * Limits {@code delegate} to a wall-clock budget measured from its first consultation.
     */
    static RetryPolicy withTimeBudget(RetryPolicy delegate, Duration budget, Clock clock) {
        return new TimeBudgetPolicy(delegate, budget, clock);
    }

    static RetryPolicy withTimeBudget(RetryPolicy delegate, Duration budget) {
        return new TimeBudgetPolicy(delegate, budget, Clock.systemUTC());
    }
}
