package org.javai.result.boundary;

import java.io.FileNotFoundException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import org.javai.result.Error;

/**
 * Default classifier for common JDK exceptions.
 * Missing files become {@link org.javai.result.NotFoundError}, denied access becomes
 * {@link org.javai.result.UnauthorizedError}; anything else is kept as an
 * {@link org.javai.result.UnhandledExceptionError}.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    @Override
    public Error classify(String operation, Exception exception) {
        if (exception instanceof FileNotFoundException || exception instanceof NoSuchFileException) {
            return Error.notFound(operation + ": file not found: " + exception.getMessage());
        }

        if (exception instanceof AccessDeniedException) {
            return Error.unauthorized(operation + ": access denied: " + exception.getMessage());
        }

        return Error.exception(exception);
    }
}
