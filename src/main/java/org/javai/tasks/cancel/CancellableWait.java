package org.javai.tasks.cancel;

import org.javai.tasks.Outcome;

import java.time.Duration;
import java.util.Objects;

/**
 * A delay that ends early when a {@link CancellationToken} fires.
 *
 * <p>Whichever of the timer and the token becomes ready first decides the result.
 * When both are ready at the same moment either result may be returned.</p>
 */
public final class CancellableWait {

    private CancellableWait() {}

    /**
     * Blocks the calling thread until {@code duration} elapses or {@code token} is cancelled.
     *
     * <p>An interrupt of the waiting thread is treated as cancellation; the interrupt
     * flag is restored before returning.</p>
     *
     * @param duration how long to wait; zero or negative returns at once
     * @param token the token that may cut the wait short
     * @return {@code Outcome.ok()} if the full duration elapsed, otherwise a failure
     *         with id {@link org.javai.tasks.TaskFailures#CANCELLED}
     */
    public static Outcome<Void> await(Duration duration, CancellationToken token) {
        Objects.requireNonNull(duration, "duration must not be null");
        Objects.requireNonNull(token, "token must not be null");

        try {
            if (token.await(duration)) {
                return Outcome.fail(token.reason());
            }
            return Outcome.ok();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.fail(token.reason());
        }
    }
}
