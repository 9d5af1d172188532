package org.javai.result.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.result.ApiError;
import org.javai.result.ConfigurationError;
import org.javai.result.Error;
import org.javai.result.UnauthorizedError;
import org.javai.result.UnhandledExceptionError;
import org.javai.result.ops.ErrorReporter;

/**
 * Reports errors using Log4j2.
 *
 * <p>The log level follows the error variant:
 * <ul>
 *   <li>{@link UnhandledExceptionError}, {@link ConfigurationError} → ERROR</li>
 *   <li>{@link UnauthorizedError}, {@link ApiError} → WARN</li>
 *   <li>any other error → INFO</li>
 * </ul>
 *
 * <p>Every entry carries the {@code RESULT_FAILURE} marker.
 */
public class Log4jErrorReporter implements ErrorReporter {

    static final Marker FAILURE_MARKER = MarkerManager.getMarker("RESULT_FAILURE");

    private final Logger logger;

    public Log4jErrorReporter() {
        this(LogManager.getLogger("org.javai.result.ErrorReporter"));
    }

    public Log4jErrorReporter(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public Log4jErrorReporter(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void report(String operation, Error error, Throwable cause) {
        logger.atLevel(levelFor(error))
                .withMarker(FAILURE_MARKER)
                .withThrowable(cause)
                .log("Failure in operation [{}]: {} | code={}, type={}",
                        operation,
                        error.getDescription(),
                        error.getCode(),
                        error.getClass().getSimpleName());
    }

    static Level levelFor(Error error) {
        if (error instanceof UnhandledExceptionError || error instanceof ConfigurationError) {
            return Level.ERROR;
        }
        if (error instanceof UnauthorizedError || error instanceof ApiError) {
            return Level.WARN;
        }
        return Level.INFO;
    }
}
