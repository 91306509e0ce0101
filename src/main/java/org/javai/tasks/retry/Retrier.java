package org.javai.tasks.retry;

import org.javai.tasks.Failure;
import org.javai.tasks.Outcome;
import org.javai.tasks.boundary.Boundary;
import org.javai.tasks.boundary.ThrowingSupplier;
import org.javai.tasks.cancel.CancellableWait;
import org.javai.tasks.cancel.CancellationToken;
import org.javai.tasks.ops.OpReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs an operation until it succeeds, its retry policy gives up, or its
 * cancellation token fires while waiting between attempts.
 *
 * <p>Attempts are strictly sequential. The loop only blocks inside the wait between
 * attempts, so cancellation is observed there and nowhere else: a running attempt is
 * never interrupted. The loop itself imposes no attempt limit; a policy that never
 * gives up and an operation that never succeeds keep it running forever.</p>
 *
 * <p>The result is the operation's own success, or a failure with one of the
 * terminal ids from {@link org.javai.tasks.TaskFailures}. The last operation
 * failure is not part of the result; it goes to the configured {@link OpReporter}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * CancellationToken token = CancellationToken.create();
 * Outcome<Order> result = retrier.execute(
 *     "Orders.fetch",
 *     RetryPolicy.fixedDuration(Duration.ofMillis(200), 5),
 *     token,
 *     () -> boundary.call("Orders.fetch", () -> orders.fetch(orderId))
 * );
 * }</pre>
 */
public final class Retrier {

    private static final Retrier SILENT = new Retrier(OpReporter.noOp(), CancellableWait::await);

    private final OpReporter reporter;
    private final Waiter waiter;

    Retrier(OpReporter reporter, Waiter waiter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.waiter = Objects.requireNonNull(waiter, "waiter must not be null");
    }

    /**
     * A Retrier that reports nothing.
     */
    public static Retrier silent() {
        return SILENT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private OpReporter reporter = OpReporter.noOp();
        private Waiter waiter = CancellableWait::await;

        private Builder() {}

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the waiter for testing (package-private).
         */
        Builder waiter(Waiter waiter) {
            this.waiter = Objects.requireNonNull(waiter, "waiter must not be null");
            return this;
        }

        public Retrier build() {
            return new Retrier(reporter, waiter);
        }
    }

    /**
     * Executes an operation with retry.
     *
     * @param operation The operation name for reporting
     * @param policy A fresh policy for this session; it is mutated and must not be reused
     * @param token Cancels the session when triggered during a wait
     * @param attempt Performs one attempt
     * @return The successful Outcome, or a Fail carrying the terminal condition
     */
    public <T> Outcome<T> execute(
            String operation,
            RetryPolicy policy,
            CancellationToken token,
            Supplier<Outcome<T>> attempt
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        int attemptNumber = 1;
        Outcome<T> result = attempt.get();

        while (result instanceof Outcome.Fail<T> fail) {
            Failure failure = fail.failure();
            RetryDecision decision = Objects.requireNonNull(policy.next(), "policy returned null decision");

            if (decision instanceof RetryDecision.GiveUp giveUp) {
                int attempts = attemptNumber;
                safelyReport("reportRetryExhausted", () -> reporter.reportRetryExhausted(failure, attempts));
                return Outcome.fail(giveUp.reason());
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            int failedAttempt = attemptNumber;
            safelyReport("reportRetryAttempt", () -> reporter.reportRetryAttempt(failure, failedAttempt, delay));
            Outcome<Void> waited = waiter.await(delay, token);
            if (waited instanceof Outcome.Fail<Void> cancelled) {
                safelyReport("reportCancelled", () -> reporter.reportCancelled(failure, failedAttempt));
                return Outcome.fail(cancelled.failure());
            }

            attemptNumber++;
            result = attempt.get();
        }

        return result;
    }

    /**
     * Executes throwing work with retry, translating checked exceptions through the Boundary.
     */
    public <T> Outcome<T> execute(
            String operation,
            RetryPolicy policy,
            CancellationToken token,
            Boundary boundary,
            ThrowingSupplier<T, ? extends Exception> work
    ) {
        Objects.requireNonNull(boundary, "boundary must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return execute(operation, policy, token, () -> boundary.call(operation, work));
    }

    // A failing reporter must not change the outcome of the session
    private void safelyReport(String method, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            System.err.println("OpReporter." + method + " failed for " +
                    reporter.getClass().getName() + ": " + e.getMessage());
        }
    }

    /**
     * The wait between attempts; swapped out in tests.
     */
    @FunctionalInterface
    interface Waiter {
        Outcome<Void> await(Duration delay, CancellationToken token);
    }
}
