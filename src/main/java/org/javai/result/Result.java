package org.javai.result;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the result of an operation that may fail.
 * Either {@link Success} containing a value, or {@link Failure} containing an {@link Error}.
 *
 * <p>Every result satisfies {@code isSuccess() == (error() == NONE)}. A success reports the
 * {@link #NONE} sentinel as its error; a failure never does. Operations that produce no
 * value use {@code Result<Void>}.
 *
 * <p>{@link #value()} on a failure returns {@code null} instead of throwing. Code that
 * wants to fail loudly calls {@link #getOrThrow()}; code that wants a specific fallback
 * calls {@link #getOrElse(Object)}.
 *
 * <pre>{@code
 * Result<String> greeting = Result.success(5)
 *         .map(x -> x * 2)
 *         .bind(x -> x > 5 ? Result.success("got " + x) : Result.failure(Error.validation("too small")));
 *
 * String body = greeting.match(value -> value, error -> error.getDescription());
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * The "no error" sentinel. Reported by {@link Success#error()}; rejected by {@link Failure}.
     */
    Error NONE = new Error(NoneCode.INSTANCE, "None");

    /**
     * A successful result containing a value.
     *
     * @param value the successful value, may be null
     */
    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Error error() {
            return NONE;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> bind(Function<? super T, ? extends Result<U>> binder) {
            Objects.requireNonNull(binder);
            return Objects.requireNonNull(binder.apply(value), "binder must not return null");
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super Error, ? extends R> onFailure) {
            Objects.requireNonNull(onSuccess);
            Objects.requireNonNull(onFailure);
            return onSuccess.apply(value);
        }

        @Override
        public Result<T> tap(Consumer<? super T> action) {
            Objects.requireNonNull(action);
            action.accept(value);
            return this;
        }

        @Override
        public Result<T> recover(Function<? super Error, ? extends T> recovery) {
            return this;
        }

        @Override
        public Result<T> recoverWith(Function<? super Error, ? extends Result<T>> recovery) {
            return this;
        }
    }

    /**
     * A failed result containing the error.
     *
     * @param error the error, never null and never {@link #NONE}
     */
    record Failure<T>(Error error) implements Result<T> {

        /**
         * Canonical constructor with validation.
         */
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
            if (NONE.equals(error)) {
                throw new IllegalArgumentException("Failure result must have an error");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        /**
         * Always {@code null}: a failure has no value.
         */
        @Override
        public T value() {
            return null;
        }

        @Override
        public T getOrThrow() {
            throw new ResultFailedException(error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <U> Result<U> bind(Function<? super T, ? extends Result<U>> binder) {
            return new Failure<>(error);
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super Error, ? extends R> onFailure) {
            Objects.requireNonNull(onSuccess);
            Objects.requireNonNull(onFailure);
            return onFailure.apply(error);
        }

        @Override
        public Result<T> tap(Consumer<? super T> action) {
            return this;
        }

        @Override
        public Result<T> recover(Function<? super Error, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Success<>(recovery.apply(error));
        }

        @Override
        public Result<T> recoverWith(Function<? super Error, ? extends Result<T>> recovery) {
            Objects.requireNonNull(recovery);
            return Objects.requireNonNull(recovery.apply(error), "recovery must not return null");
        }
    }

    // Query methods
    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the error of a failure, or {@link #NONE} for a success.
     */
    Error error();

    /**
     * Returns the value of a success, or {@code null} for a failure.
     */
    T value();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations

    /**
     * Applies {@code mapper} to the value of a success. A failure is passed through untouched
     * and {@code mapper} is not invoked. Use {@link #bind} when the step can itself fail.
     */
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    /**
     * Sequences a step that can fail. On success returns whatever {@code binder} returns;
     * on failure short-circuits with the original error and never invokes {@code binder}.
     */
    <U> Result<U> bind(Function<? super T, ? extends Result<U>> binder);

    /**
     * Consumes the result. Exactly one of the two functions runs.
     */
    <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super Error, ? extends R> onFailure);

    /**
     * Runs {@code action} with the value of a success and returns this result unchanged.
     */
    Result<T> tap(Consumer<? super T> action);

    // Recovery
    Result<T> recover(Function<? super Error, ? extends T> recovery);
    Result<T> recoverWith(Function<? super Error, ? extends Result<T>> recovery);

    /**
     * Replaces the value of a success with {@code value}, keeping a failure as it is.
     */
    default <U> Result<U> toResult(U value) {
        return isSuccess() ? new Success<>(value) : new Failure<>(error());
    }

    // Static factories
    static Result<Void> success() {
        return new Success<>(null);
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Error error) {
        return new Failure<>(error);
    }

    /**
     * Builds a result from its three wire-level parts, checking that they agree.
     *
     * @param isSuccess whether the result is a success
     * @param error {@link #NONE} for a success, the error for a failure
     * @param value the value of a success; ignored for a failure
     * @throws IllegalArgumentException if {@code isSuccess} and {@code error} disagree
     */
    static <T> Result<T> of(boolean isSuccess, Error error, T value) {
        Objects.requireNonNull(error, "error must not be null, use Result.NONE");
        boolean none = NONE.equals(error);
        if (isSuccess && !none) {
            throw new IllegalArgumentException("Success result cannot have an error");
        }
        if (!isSuccess && none) {
            throw new IllegalArgumentException("Failure result must have an error");
        }
        return isSuccess ? new Success<>(value) : new Failure<>(error);
    }
}
