package org.javai.tasks;

import java.time.Instant;
import java.util.Objects;

/**
 * An operation failure or a terminal condition of a retry session.
 *
 * @param id The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param operation The operation that failed (e.g., "Inventory.reserve")
 * @param exception The underlying exception (may be null)
 * @param occurredAt When the failure happened
 */
public record Failure(
        FailureId id,
        String message,
        String operation,
        Throwable exception,
        Instant occurredAt
) {

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    /**
     * Creates a failure without an underlying exception.
     */
    public static Failure of(FailureId id, String message, String operation) {
        return new Failure(id, message, operation, null, Instant.now());
    }

    /**
     * Creates a failure caused by an exception.
     */
    public static Failure of(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, operation, exception, Instant.now());
    }

    /**
     * Returns true if this failure is of the kind identified by {@code failureId}.
     */
    public boolean is(FailureId failureId) {
        return id.equals(failureId);
    }
}
