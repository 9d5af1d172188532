package org.javai.result;

/**
 * The caller is not authenticated or not allowed to perform the operation.
 */
public final class UnauthorizedError extends Error {

    public static final ErrorCode CODE = Code.INSTANCE;

    public UnauthorizedError(String description) {
        super(Code.INSTANCE, description);
    }

    static final class Code extends ErrorCode {
        static final Code INSTANCE = new Code();

        private Code() {
            super("UnauthorizedError");
        }
    }
}
