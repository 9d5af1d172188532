package org.javai.result;

/**
 * The operation collides with the current state, e.g. a duplicate key or a stale version.
 */
public final class ConflictError extends Error {

    public static final ErrorCode CODE = Code.INSTANCE;

    public ConflictError(String description) {
        super(Code.INSTANCE, description);
    }

    static final class Code extends ErrorCode {
        static final Code INSTANCE = new Code();

        private Code() {
            super("ConflictError");
        }
    }
}
