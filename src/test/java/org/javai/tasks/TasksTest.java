package org.javai.tasks;

import org.javai.tasks.cancel.CancellationToken;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class TasksTest {

    private static final FailureId FLAKY = FailureId.of("test", "flaky");

    @Test
    void retryOperation_alwaysFailing_stopsAfterTwoWaits() {
        AtomicInteger attempts = new AtomicInteger(0);

        long start = System.nanoTime();
        Outcome<Void> result = Tasks.retryOperation(() -> {
            attempts.incrementAndGet();
            return Outcome.fail(FLAKY, "nope", "flaky");
        }, Tasks.fixedDuration(Duration.ofMillis(10), 3), Tasks.createCancellationToken());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(TaskFailures.isMaxRetryReached(result)).isTrue();
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(20);
    }

    @Test
    void retryOperation_succeedsOnThirdAttempt() {
        AtomicInteger attempts = new AtomicInteger(0);

        long start = System.nanoTime();
        Outcome<Void> result = Tasks.retryOperation(
                () -> attempts.incrementAndGet() < 3 ? Outcome.fail(FLAKY, "nope", "flaky") : Outcome.ok(),
                Tasks.fixedDuration(Duration.ofMillis(5), 10),
                Tasks.createCancellationToken());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.isOk()).isTrue();
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(10);
    }

    @Test
    void retryOperation_cancelledFromAnotherThread_returnsWithoutWaitingTheHour() throws Exception {
        CancellationToken token = Tasks.createCancellationToken();
        AtomicInteger attempts = new AtomicInteger(0);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Outcome<Void>> session = executor.submit(() -> Tasks.<Void>retryOperation(() -> {
                attempts.incrementAndGet();
                return Outcome.fail(FLAKY, "nope", "flaky");
            }, Tasks.fixedDuration(Duration.ofHours(1), 5), token));

            Thread.sleep(20);
            token.cancel();

            Outcome<Void> result = session.get(5, TimeUnit.SECONDS);
            assertThat(TaskFailures.isCancelled(result)).isTrue();
            assertThat(attempts.get()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void retryOperation_cancelAfterSessionEnded_isNoOp() {
        CancellationToken token = Tasks.createCancellationToken();

        Outcome<String> result = Tasks.retryOperation(() -> Outcome.ok("done"),
                Tasks.fixedDuration(Duration.ofMillis(1), 3), token);
        token.cancel();

        assertThat(result.getOrThrow()).isEqualTo("done");
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void retryOperation_throwingOperation_retriesUntilItStopsThrowing() {
        AtomicInteger attempts = new AtomicInteger(0);

        Outcome<Void> result = Tasks.retryOperation("Socket.connect", () -> {
            if (attempts.incrementAndGet() < 2) {
                throw new IOException("connection refused");
            }
        }, Tasks.fixedDuration(Duration.ofMillis(1), 5), Tasks.createCancellationToken());

        assertThat(result.isOk()).isTrue();
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void retryOperation_throwingOperationExhausted_returnsMaxRetryReached() {
        Outcome<Void> result = Tasks.retryOperation("Socket.connect", () -> {
            throw new IOException("connection refused");
        }, Tasks.fixedDuration(Duration.ZERO, 2), Tasks.createCancellationToken());

        assertThat(TaskFailures.isMaxRetryReached(result)).isTrue();
        assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(OutcomeFailedException.class)
                .hasMessageContaining("tasks:max_retry_reached");
    }

    @Test
    void retryOperation_anonymousCheckedException_isRetriedAsFailure() {
        AtomicInteger attempts = new AtomicInteger(0);

        Outcome<Void> result = Tasks.retryOperation("Socket.connect", () -> {
            attempts.incrementAndGet();
            throw new IOException("refused") {};
        }, Tasks.fixedDuration(Duration.ZERO, 2), Tasks.createCancellationToken());

        assertThat(TaskFailures.isMaxRetryReached(result)).isTrue();
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void await_elapsesWhenNotCancelled() {
        long start = System.nanoTime();
        Outcome<Void> result = Tasks.await(Duration.ofMillis(15), Tasks.createCancellationToken());

        assertThat(result.isOk()).isTrue();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(15);
    }

    @Test
    void await_cancelled_returnsCancelled() {
        CancellationToken token = Tasks.createCancellationToken();
        CompletableFuture.runAsync(token::cancel, CompletableFuture.delayedExecutor(5, TimeUnit.MILLISECONDS));

        Outcome<Void> result = Tasks.await(Duration.ofMinutes(10), token);

        assertThat(TaskFailures.isCancelled(result)).isTrue();
    }
}
