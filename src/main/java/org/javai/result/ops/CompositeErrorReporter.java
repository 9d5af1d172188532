package org.javai.result.ops;

import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.result.Error;

/**
 * An {@link ErrorReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the exception is
 * logged and the remaining reporters still run.
 */
final class CompositeErrorReporter implements ErrorReporter {

    private static final Logger log = LogManager.getLogger(CompositeErrorReporter.class);

    private final List<ErrorReporter> reporters;

    CompositeErrorReporter(List<ErrorReporter> reporters) {
        this.reporters = List.copyOf(reporters);
    }

    @Override
    public void report(String operation, Error error, Throwable cause) {
        for (ErrorReporter reporter : reporters) {
            try {
                reporter.report(operation, error, cause);
            } catch (RuntimeException e) {
                log.warn("ErrorReporter.report failed for {}", reporter.getClass().getName(), e);
            }
        }
    }
}
