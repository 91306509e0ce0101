package org.javai.tasks;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * Unchecked, because it signals misuse: the caller should have checked
 * {@link Outcome#isFail()} or pattern-matched on {@link Outcome.Fail}.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super("Outcome failed [" + failure.id() + "]: " + failure.message(), failure.exception());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
