package org.javai.result.ops;

import java.util.Arrays;
import org.javai.result.Error;

/**
 * Reports errors produced at a {@link org.javai.result.boundary.Boundary} for operator
 * visibility. Implementations might write structured logs or raise alerts.
 */
public interface ErrorReporter {

    /**
     * Reports an error occurrence.
     *
     * @param operation the operation that failed
     * @param error the error carried by the failed result
     * @param cause the exception the error was classified from, may be null
     */
    void report(String operation, Error error, Throwable cause);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static ErrorReporter noOp() {
        return (operation, error, cause) -> {};
    }

    /**
     * Creates a reporter that fans out to all given reporters. A reporter that throws is
     * logged and skipped; the others still run.
     */
    static ErrorReporter composite(ErrorReporter... reporters) {
        return new CompositeErrorReporter(Arrays.asList(reporters));
    }
}
