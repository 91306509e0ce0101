package org.javai.tasks.retry;

import org.javai.tasks.TaskFailures;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Caps another policy with a wall-clock budget.
 *
 * <p>The clock starts at the first failed attempt. A retry whose delay would end past
 * the budget is refused with {@link TaskFailures#BUDGET_EXHAUSTED}; otherwise the
 * delegate decides. The delegate is consulted on every call so its own count stays
 * accurate.</p>
 */
public final class TimeBudgetPolicy implements RetryPolicy {

    private final RetryPolicy delegate;
    private final Duration budget;
    private final Clock clock;
    private Instant startedAt;

    public TimeBudgetPolicy(RetryPolicy delegate, Duration budget, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (budget.isNegative()) {
            throw new IllegalArgumentException("budget must not be negative, was: " + budget);
        }
    }

    @Override
    public RetryDecision next() {
        Instant now = clock.instant();
        if (startedAt == null) {
            startedAt = now;
        }
        RetryDecision decision = delegate.next();
        if (decision instanceof RetryDecision.Retry retry) {
            Duration elapsed = Duration.between(startedAt, now);
            if (elapsed.plus(retry.delay()).compareTo(budget) > 0) {
                return RetryDecision.GiveUp.because(TaskFailures.budgetExhausted(id()));
            }
        }
        return decision;
    }

    @Override
    public String id() {
        return delegate.id() + "+budget";
    }
}
