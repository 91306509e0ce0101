package org.javai.tasks;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a kind of failure.
 * Two failures are of the same kind when their ids are equal.
 *
 * @param namespace The subsystem that defines the failure (e.g., "tasks", "exception")
 * @param name The failure kind within that namespace (e.g., "cancelled")
 */
public record FailureId(String namespace, String name) {

    public FailureId {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("namespace and name must not be blank");
        }
    }

    public static FailureId of(String namespace, String name) {
        return new FailureId(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
