package org.javai.result;

/**
 * An exception escaped into the result world.
 *
 * @see Error#exception(Throwable)
 */
public final class UnhandledExceptionError extends Error {

    public static final ErrorCode CODE = Code.INSTANCE;

    public UnhandledExceptionError(String description) {
        super(Code.INSTANCE, description);
    }

    static final class Code extends ErrorCode {
        static final Code INSTANCE = new Code();

        private Code() {
            super("UnhandledExceptionError");
        }
    }
}
