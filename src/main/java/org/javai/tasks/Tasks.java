package org.javai.tasks;

import org.javai.tasks.boundary.Boundary;
import org.javai.tasks.boundary.ThrowingRunnable;
import org.javai.tasks.cancel.CancellableWait;
import org.javai.tasks.cancel.CancellationToken;
import org.javai.tasks.retry.Retrier;
import org.javai.tasks.retry.RetryPolicy;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Entry points for retrying an operation with a cancellable delay between attempts.
 *
 * <pre>{@code
 * CancellationToken token = Tasks.createCancellationToken();
 * Outcome<Void> result = Tasks.retryOperation(
 *     "Inventory.reserve",
 *     () -> inventory.reserve(sku),
 *     Tasks.fixedDuration(Duration.ofMillis(500), 5),
 *     token);
 *
 * if (TaskFailures.isMaxRetryReached(result)) { ... }
 * }</pre>
 *
 * These methods report nothing; use {@link Retrier#builder()} to attach an
 * {@link org.javai.tasks.ops.OpReporter}.
 */
public final class Tasks {

    private static final String OPERATION = "operation";

    private Tasks() {}

    public static CancellationToken createCancellationToken() {
        return CancellationToken.create();
    }

    /**
     * @see RetryPolicy#fixedDuration(Duration, int)
     */
    public static RetryPolicy fixedDuration(Duration retryPeriod, int maxRetry) {
        return RetryPolicy.fixedDuration(retryPeriod, maxRetry);
    }

    /**
     * Runs {@code operation} until it succeeds, {@code policy} gives up, or {@code token}
     * is cancelled during a wait. The policy must be fresh for this call.
     */
    public static <T> Outcome<T> retryOperation(
            Supplier<Outcome<T>> operation,
            RetryPolicy policy,
            CancellationToken token
    ) {
        return Retrier.silent().execute(OPERATION, policy, token, operation);
    }

    /**
     * Like {@link #retryOperation(Supplier, RetryPolicy, CancellationToken)}, for an
     * operation that fails by throwing a checked exception.
     */
    public static Outcome<Void> retryOperation(
            String name,
            ThrowingRunnable<? extends Exception> operation,
            RetryPolicy policy,
            CancellationToken token
    ) {
        Boundary boundary = Boundary.silent();
        return Retrier.silent().execute(name, policy, token, () -> boundary.run(name, operation));
    }

    /**
     * Waits for {@code duration} unless {@code token} is cancelled first.
     *
     * @see CancellableWait#await(Duration, CancellationToken)
     */
    public static Outcome<Void> await(Duration duration, CancellationToken token) {
        return CancellableWait.await(duration, token);
    }
}
