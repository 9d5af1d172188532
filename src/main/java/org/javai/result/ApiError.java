package org.javai.result;

/**
 * A remote API answered with an error or could not be reached.
 */
public final class ApiError extends Error {

    public static final ErrorCode CODE = Code.INSTANCE;

    public ApiError(String description) {
        super(Code.INSTANCE, description);
    }

    static final class Code extends ErrorCode {
        static final Code INSTANCE = new Code();

        private Code() {
            super("ApiError");
        }
    }
}
