package org.javai.tasks;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of an operation that may fail.
 * Either {@link Ok} containing a value, or {@link Fail} containing a {@link Failure}.
 *
 * <p>Operations handed to the retry loop report their result as an Outcome, and the
 * loop reports its own result the same way. A session that ends without success
 * yields a {@link Fail} whose failure id tells the caller why it stopped:</p>
 * <pre>{@code
 * Outcome<Void> result = Tasks.retryOperation(op, Tasks.fixedDuration(Duration.ofSeconds(1), 5), token);
 * if (result instanceof Outcome.Fail<Void> fail && fail.failure().is(TaskFailures.CANCELLED)) {
 *     ...
 * }
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value, which may be null for {@code Outcome<Void>}.
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super Failure, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome containing failure details.
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public Outcome<T> recover(Function<? super Failure, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);
    Outcome<T> recover(Function<? super Failure, ? extends T> recovery);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }

    /**
     * Creates a failed outcome for the given operation.
     *
     * @param id The failure id
     * @param message Human-readable description of what went wrong
     * @param operation The operation that failed
     * @param <T> The type parameter for the outcome
     * @return A failed outcome
     */
    static <T> Outcome<T> fail(FailureId id, String message, String operation) {
        return new Fail<>(Failure.of(id, message, operation));
    }
}
