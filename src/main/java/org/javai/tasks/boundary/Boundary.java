package org.javai.tasks.boundary;

import org.javai.tasks.Failure;
import org.javai.tasks.Outcome;
import org.javai.tasks.ops.OpReporter;

import java.util.Objects;

/**
 * Adapts code that signals failure with checked exceptions to the Outcome world.
 *
 * <p>Checked exceptions are classified into a {@link Failure}, reported, and returned
 * as {@link Outcome.Fail}. RuntimeExceptions are defects, not operational failures:
 * they are not caught and propagate to the caller, aborting any retry loop.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Outcome<Response> result = boundary.call("HttpClient.send", () -> httpClient.send(request, handler));
 * }</pre>
 */
public final class Boundary {

    private final FailureClassifier classifier;
    private final OpReporter reporter;

    /**
     * Creates a Boundary that classifies by exception type and reports nothing.
     */
    public static Boundary silent() {
        return new Boundary(FailureClassifier.byExceptionType(), OpReporter.noOp());
    }

    /**
     * Creates a Boundary that classifies by exception type and reports every failure.
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(FailureClassifier.byExceptionType(), reporter);
    }

    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            return handleException(operation, e);
        }
    }

    /**
     * Executes an action that may throw checked exceptions.
     *
     * @return {@code Outcome.ok()} if the action completed, otherwise Fail with a classified failure
     */
    public Outcome<Void> run(String operation, ThrowingRunnable<? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return call(operation, () -> {
            work.run();
            return null;
        });
    }

    private <T> Outcome<T> handleException(String operation, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        Failure failure = classifier.classify(operation, e);
        try {
            reporter.report(failure);
        } catch (RuntimeException reportError) {
            // A failing reporter must not turn an operation failure into a defect
            System.err.println("OpReporter.report failed for " +
                    reporter.getClass().getName() + ": " + reportError.getMessage());
        }
        return Outcome.fail(failure);
    }
}
