package org.javai.result.boundary;

import org.javai.result.Error;

/**
 * Translates an exception thrown by third-party code into an {@link Error}.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * @param operation the operation that failed, e.g. "UserApi.fetch"
     * @param exception the exception it threw
     * @return the error to carry in the failed result, never null
     */
    Error classify(String operation, Exception exception);
}
