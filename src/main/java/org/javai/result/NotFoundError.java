package org.javai.result;

/**
 * The requested entity does not exist.
 */
public final class NotFoundError extends Error {

    public static final ErrorCode CODE = Code.INSTANCE;

    public NotFoundError(String description) {
        super(Code.INSTANCE, description);
    }

    static final class Code extends ErrorCode {
        static final Code INSTANCE = new Code();

        private Code() {
            super("NotFoundError");
        }
    }
}
