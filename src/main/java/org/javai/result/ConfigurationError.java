package org.javai.result;

/**
 * Required configuration is missing or invalid.
 */
public final class ConfigurationError extends Error {

    public static final ErrorCode CODE = Code.INSTANCE;

    public ConfigurationError(String description) {
        super(Code.INSTANCE, description);
    }

    static final class Code extends ErrorCode {
        static final Code INSTANCE = new Code();

        private Code() {
            super("ConfigurationError");
        }
    }
}
