package org.javai.result;

/**
 * Thrown when {@link Result#getOrThrow()} is called on a failed result.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Result#isFailure()} first or used {@link Result#match}.
 */
public class ResultFailedException extends RuntimeException {

    private final Error error;

    public ResultFailedException(Error error) {
        super("Result failed: " + error.getDescription());
        this.error = error;
    }

    public Error error() {
        return error;
    }
}
