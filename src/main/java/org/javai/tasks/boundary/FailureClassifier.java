package org.javai.tasks.boundary;

import org.javai.tasks.Failure;
import org.javai.tasks.FailureId;

/**
 * Translates a checked exception thrown by an operation into a {@link Failure}.
 */
@FunctionalInterface
public interface FailureClassifier {

    Failure classify(String operation, Exception exception);

    /**
     * Identifies failures by exception type, e.g. {@code exception:IOException}.
     */
    static FailureClassifier byExceptionType() {
        return (operation, exception) -> Failure.of(
                FailureId.of("exception", typeName(exception.getClass())),
                exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName(),
                operation,
                exception);
    }

    /**
     * The simple name of the first named class in the hierarchy; anonymous and
     * some synthetic exception classes have a blank simple name.
     */
    private static String typeName(Class<?> type) {
        Class<?> named = type;
        while (named != null && named.getSimpleName().isBlank()) {
            named = named.getSuperclass();
        }
        return named != null ? named.getSimpleName() : type.getName();
    }
}
