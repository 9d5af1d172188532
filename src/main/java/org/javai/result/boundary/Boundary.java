package org.javai.result.boundary;

import java.util.Objects;
import org.javai.result.Error;
import org.javai.result.Result;
import org.javai.result.ops.ErrorReporter;

/**
 * The boundary adapter for integrating third-party APIs that throw checked exceptions.
 * Catches exceptions, classifies them into errors, reports them, and returns a {@link Result}.
 *
 * <p>This is the single point where checked exceptions are translated into the result world.
 * After passing through a Boundary, code operates entirely on results.</p>
 *
 * <p>RuntimeExceptions (defects) are not caught: they propagate to the caller unchanged.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * // Simple usage for testing or prototyping
 * Boundary boundary = Boundary.silent();
 *
 * // Production usage with reporting
 * Boundary boundary = Boundary.withReporter(new Log4jErrorReporter());
 *
 * Result<String> body = boundary.call("Config.read", () -> Files.readString(path));
 * }</pre>
 */
public final class Boundary {

    private static final ErrorClassifier DEFAULT_CLASSIFIER = new DefaultErrorClassifier();

    private final ErrorClassifier classifier;
    private final ErrorReporter reporter;

    /**
     * Creates a silent Boundary that classifies failures but does not report them.
     *
     * @return a Boundary with default classification and no reporting
     */
    public static Boundary silent() {
        return new Boundary(DEFAULT_CLASSIFIER, ErrorReporter.noOp());
    }

    /**
     * Creates a Boundary with default classification and the specified reporter.
     *
     * @param reporter the reporter for failure notifications
     * @return a Boundary with default classification and custom reporting
     */
    public static Boundary withReporter(ErrorReporter reporter) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter);
    }

    /**
     * Creates a Boundary with custom classification and reporting.
     */
    public static Boundary of(ErrorClassifier classifier, ErrorReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(ErrorClassifier classifier, ErrorReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any checked exception into
     * a failed result.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return a success with the work's value, or a failure with the classified error
     */
    public <T> Result<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Result.success(work.get());
        } catch (RuntimeException e) {
            // Defects propagate; they are not operational failures.
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(operation, e);
        }
    }

    private <T> Result<T> handleException(String operation, Exception e) {
        Error error = Objects.requireNonNull(classifier.classify(operation, e),
                "classifier must not return null");
        reporter.report(operation, error, e);
        return Result.failure(error);
    }
}
