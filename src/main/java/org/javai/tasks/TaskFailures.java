package org.javai.tasks;

/**
 * The terminal conditions a retry session can end with.
 *
 * <p>Callers branch on the id of the returned failure:</p>
 * <pre>{@code
 * Outcome<Void> result = Tasks.retryOperation(op, policy, token);
 * if (TaskFailures.isCancelled(result)) {
 *     // someone called token.cancel()
 * } else if (TaskFailures.isMaxRetryReached(result)) {
 *     // the policy ran out of attempts
 * }
 * }</pre>
 *
 * Any other failure id comes from a custom policy and is propagated unchanged.
 */
public final class TaskFailures {

    public static final String NAMESPACE = "tasks";

    /** The retry policy spent its attempt budget. */
    public static final FailureId MAX_RETRY_REACHED = FailureId.of(NAMESPACE, "max_retry_reached");

    /** The cancellation token fired while the session was waiting. */
    public static final FailureId CANCELLED = FailureId.of(NAMESPACE, "cancelled");

    /** A time-budgeted policy ran out of time. */
    public static final FailureId BUDGET_EXHAUSTED = FailureId.of(NAMESPACE, "budget_exhausted");

    private TaskFailures() {}

    public static Failure maxRetryReached(String policyId) {
        return Failure.of(MAX_RETRY_REACHED, "Maximum number of retry reached", policyId);
    }

    public static Failure cancelled(String operation) {
        return Failure.of(CANCELLED, "Task is cancelled", operation);
    }

    public static Failure budgetExhausted(String policyId) {
        return Failure.of(BUDGET_EXHAUSTED, "Retry time budget exhausted", policyId);
    }

    public static boolean isMaxRetryReached(Outcome<?> outcome) {
        return hasId(outcome, MAX_RETRY_REACHED);
    }

    public static boolean isCancelled(Outcome<?> outcome) {
        return hasId(outcome, CANCELLED);
    }

    private static boolean hasId(Outcome<?> outcome, FailureId id) {
        return outcome instanceof Outcome.Fail<?> fail && fail.failure().is(id);
    }
}
