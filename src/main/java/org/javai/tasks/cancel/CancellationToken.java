package org.javai.tasks.cancel;

import org.javai.tasks.Failure;
import org.javai.tasks.TaskFailures;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A single-shot, thread-safe cancellation signal.
 *
 * <p>A token starts armed. {@link #cancel()} triggers it once and for all: every
 * party blocked in {@link #await(Duration)} is released, and every later wait
 * observes the triggered state immediately. Triggering never blocks, whether or not
 * anyone is waiting, and triggering an already cancelled token does nothing.</p>
 *
 * <p>The token is shared by reference between the caller that owns a retry session
 * and the thread running it. It holds no resources and needs no teardown.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * executor.submit(() -> Tasks.retryOperation(op, Tasks.fixedDuration(Duration.ofSeconds(1), 10), token));
 * ...
 * token.cancel();   // from any thread
 * }</pre>
 */
public final class CancellationToken {

    private static final String OPERATION = "CancellationToken";

    private final CountDownLatch triggered = new CountDownLatch(1);

    private CancellationToken() {}

    /**
     * Creates a new, armed token.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Triggers the token. Safe to call from any thread, at any time.
     */
    public void cancel() {
        triggered.countDown();
    }

    public boolean isCancelled() {
        return triggered.getCount() == 0;
    }

    /**
     * The reason delivered to waiters once the token is triggered.
     */
    public Failure reason() {
        return TaskFailures.cancelled(OPERATION);
    }

    /**
     * Blocks until the token is triggered or the timeout elapses.
     *
     * @param timeout maximum time to wait; zero or negative only polls the current state
     * @return true if the token was triggered, false if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return triggered.await(toNanosSaturated(timeout), TimeUnit.NANOSECONDS);
    }

    /**
     * Blocks until the token is triggered.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void awaitCancellation() throws InterruptedException {
        triggered.await();
    }

    @Override
    public String toString() {
        return "CancellationToken[" + (isCancelled() ? "cancelled" : "armed") + "]";
    }

    private static long toNanosSaturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
