package org.javai.tasks.boundary;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link Boundary} to wrap operations written in exception style.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
