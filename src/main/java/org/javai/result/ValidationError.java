package org.javai.result;

/**
 * Input was rejected before any work was attempted.
 * One error per operation: callers that need every field problem at once should
 * describe them together in the description.
 */
public final class ValidationError extends Error {

    public static final ErrorCode CODE = Code.INSTANCE;

    public ValidationError(String description) {
        super(Code.INSTANCE, description);
    }

    static final class Code extends ErrorCode {
        static final Code INSTANCE = new Code();

        private Code() {
            super("ValidationError");
        }
    }
}
