package org.javai.result;

import java.util.Objects;

/**
 * Identifies the category of an {@link Error}.
 *
 * <p>Every concrete code is a singleton: a {@code final} subclass that exposes its only
 * instance through a {@code public static final INSTANCE} field. The instance is created
 * when the class is initialized and lives for the rest of the process.
 *
 * <p>Equality is structural: two codes are equal when they have the same concrete class
 * and the same name. Because each class has exactly one instance, this coincides with
 * reference identity inside one process. The JSON codec resolves a decoded code back to
 * the {@code INSTANCE} of its class, so both {@code equals} and {@code ==} hold across a
 * serialization boundary.
 *
 * <pre>{@code
 * public final class PaymentDeclinedCode extends ErrorCode {
 *     public static final PaymentDeclinedCode INSTANCE = new PaymentDeclinedCode();
 *
 *     private PaymentDeclinedCode() {
 *         super("PaymentDeclinedError");
 *     }
 * }
 * }</pre>
 */
public abstract class ErrorCode {

    private final String name;

    protected ErrorCode(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
    }

    /**
     * Returns the stable, human-readable identifier of this category.
     * Suitable for logging, metrics and protocol discriminators.
     */
    public final String name() {
        return name;
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return name.equals(((ErrorCode) obj).name);
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass(), name);
    }

    @Override
    public final String toString() {
        return name;
    }
}
