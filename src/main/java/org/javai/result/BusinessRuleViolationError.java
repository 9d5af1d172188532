package org.javai.result;

/**
 * The request is well-formed but breaks a domain rule.
 */
public final class BusinessRuleViolationError extends Error {

    public static final ErrorCode CODE = Code.INSTANCE;

    public BusinessRuleViolationError(String description) {
        super(Code.INSTANCE, description);
    }

    static final class Code extends ErrorCode {
        static final Code INSTANCE = new Code();

        private Code() {
            super("BusinessRuleViolationError");
        }
    }
}
