package org.javai.result;

import java.util.Objects;

/**
 * A failure carried by a {@link Result}: a {@link ErrorCode} naming the category plus a
 * human-readable description.
 *
 * <p>The hierarchy is open. Code outside this library adds variants by subclassing and
 * supplying its own singleton code; nothing here has to change. Extra state on a subtype
 * is exposed through JavaBean getters so the JSON codec can find it, and takes part in
 * {@code equals} and {@code hashCode}:
 *
 * <pre>{@code
 * public final class CustomerNotFoundError extends Error {
 *     private final String customerId;
 *
 *     public CustomerNotFoundError(String description, String customerId) {
 *         super(Code.INSTANCE, description);
 *         this.customerId = customerId;
 *     }
 *
 *     public String getCustomerId() {
 *         return customerId;
 *     }
 *
 *     @Override
 *     public boolean equals(Object obj) {
 *         return super.equals(obj) && customerId.equals(((CustomerNotFoundError) obj).customerId);
 *     }
 *
 *     @Override
 *     public int hashCode() {
 *         return 31 * super.hashCode() + customerId.hashCode();
 *     }
 *
 *     static final class Code extends ErrorCode {
 *         static final Code INSTANCE = new Code();
 *         private Code() { super("CustomerNotFoundError"); }
 *     }
 * }
 * }</pre>
 *
 * <p>Instances are immutable.
 */
public class Error {

    private final ErrorCode code;
    private final String description;

    /**
     * @param code the category of the error, never null
     * @param description what went wrong, never null, empty or blank
     * @throws NullPointerException if {@code code} or {@code description} is null
     * @throws IllegalArgumentException if {@code description} is empty or blank
     */
    public Error(ErrorCode code, String description) {
        Objects.requireNonNull(description, "description must not be null");
        if (description.isBlank()) {
            throw new IllegalArgumentException("description must not be empty or blank");
        }
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.description = description;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns true if this error is an instance of {@code type}, including {@code Error}
     * itself and any intermediate supertype.
     */
    public boolean isErrorType(Class<? extends Error> type) {
        Objects.requireNonNull(type, "type must not be null");
        return type.isInstance(this);
    }

    // === Factory methods for the built-in variants ===

    public static Error apiError(String description) {
        return new ApiError(description);
    }

    public static Error businessRuleViolation(String description) {
        return new BusinessRuleViolationError(description);
    }

    public static Error configuration(String description) {
        return new ConfigurationError(description);
    }

    public static Error conflict(String description) {
        return new ConflictError(description);
    }

    public static Error notFound(String description) {
        return new NotFoundError(description);
    }

    public static Error unauthorized(String description) {
        return new UnauthorizedError(description);
    }

    public static Error validation(String description) {
        return new ValidationError(description);
    }

    /**
     * Captures an exception as an {@link UnhandledExceptionError}.
     * Exceptions do not survive serialization, so only the type name and message are kept.
     * An exception without a message is described by its type name alone.
     */
    public static Error exception(Throwable exception) {
        Objects.requireNonNull(exception, "exception must not be null");
        String typeName = exception.getClass().getSimpleName();
        String message = exception.getMessage();
        return new UnhandledExceptionError(message == null ? typeName : typeName + ": " + message);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Error other = (Error) obj;
        return code.equals(other.code) && description.equals(other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, description);
    }

    @Override
    public String toString() {
        return code + ": " + description;
    }
}
