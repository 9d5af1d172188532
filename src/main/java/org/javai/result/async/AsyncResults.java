package org.javai.result.async;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;
import org.javai.result.Error;
import org.javai.result.Result;

/**
 * Combinators for results produced or consumed by asynchronous steps.
 *
 * <p>Branching is the same as {@link Result#map}, {@link Result#bind}, {@link Result#match}
 * and {@link Result#tap}; the difference is that a step may return a
 * {@link CompletionStage}. Steps of one chain run one after the other through
 * {@code thenCompose}: a step never starts before the previous stage has completed, and
 * a failed result short-circuits the rest of the chain without invoking any step.
 *
 * <p>Exceptional completion is not converted into a {@link Result}. If an upstream stage
 * or a step completes exceptionally (including cancellation or a timeout), the returned
 * stage completes exceptionally with the same cause.
 *
 * <pre>{@code
 * CompletionStage<Result<Receipt>> receipt =
 *         AsyncResults.bindAsyncStep(orders.find(orderId), order -> payments.charge(order));
 * }</pre>
 */
public final class AsyncResults {

    private AsyncResults() {
    }

    // === map ===

    public static <T, U> CompletionStage<Result<U>> mapAsync(
            Result<T> result,
            Function<? super T, ? extends CompletionStage<U>> mapper) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");
        if (result.isFailure()) {
            return completed(Result.failure(result.error()));
        }
        return mapper.apply(result.value()).thenApply(value -> Result.<U>success(value));
    }

    public static <T, U> CompletionStage<Result<U>> mapAsync(
            CompletionStage<Result<T>> stage,
            Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");
        return stage.thenApply(result -> result.map(mapper));
    }

    public static <T, U> CompletionStage<Result<U>> mapAsyncStep(
            CompletionStage<Result<T>> stage,
            Function<? super T, ? extends CompletionStage<U>> mapper) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");
        return stage.thenCompose(result -> mapAsync(result, mapper));
    }

    // === bind ===

    public static <T, U> CompletionStage<Result<U>> bindAsync(
            Result<T> result,
            Function<? super T, ? extends CompletionStage<Result<U>>> binder) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(binder, "binder must not be null");
        if (result.isFailure()) {
            return completed(Result.failure(result.error()));
        }
        return binder.apply(result.value());
    }

    public static <T, U> CompletionStage<Result<U>> bindAsync(
            CompletionStage<Result<T>> stage,
            Function<? super T, ? extends Result<U>> binder) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(binder, "binder must not be null");
        return stage.thenApply(result -> result.bind(binder));
    }

    public static <T, U> CompletionStage<Result<U>> bindAsyncStep(
            CompletionStage<Result<T>> stage,
            Function<? super T, ? extends CompletionStage<Result<U>>> binder) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(binder, "binder must not be null");
        return stage.thenCompose(result -> bindAsync(result, binder));
    }

    // === match ===

    public static <T, R> CompletionStage<R> matchAsync(
            Result<T> result,
            Function<? super T, ? extends CompletionStage<R>> onSuccess,
            Function<? super Error, ? extends CompletionStage<R>> onFailure) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(onSuccess, "onSuccess must not be null");
        Objects.requireNonNull(onFailure, "onFailure must not be null");
        return result.isSuccess()
                ? onSuccess.apply(result.value())
                : onFailure.apply(result.error());
    }

    public static <T, R> CompletionStage<R> matchAsync(
            CompletionStage<Result<T>> stage,
            Function<? super T, ? extends R> onSuccess,
            Function<? super Error, ? extends R> onFailure) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(onSuccess, "onSuccess must not be null");
        Objects.requireNonNull(onFailure, "onFailure must not be null");
        return stage.thenApply(result -> result.match(onSuccess, onFailure));
    }

    public static <T, R> CompletionStage<R> matchAsyncStep(
            CompletionStage<Result<T>> stage,
            Function<? super T, ? extends CompletionStage<R>> onSuccess,
            Function<? super Error, ? extends CompletionStage<R>> onFailure) {
        Objects.requireNonNull(stage, "stage must not be null");
        return stage.thenCompose(result -> matchAsync(result, onSuccess, onFailure));
    }

    // === tap ===

    /**
     * Runs {@code action} on the value of a success and completes with the original result
     * once the action's stage has completed.
     */
    public static <T> CompletionStage<Result<T>> tapAsync(
            Result<T> result,
            Function<? super T, ? extends CompletionStage<?>> action) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(action, "action must not be null");
        if (result.isFailure()) {
            return completed(result);
        }
        return action.apply(result.value()).thenApply(ignored -> result);
    }

    public static <T> CompletionStage<Result<T>> tapAsync(
            CompletionStage<Result<T>> stage,
            Consumer<? super T> action) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(action, "action must not be null");
        return stage.thenApply(result -> result.tap(action));
    }

    public static <T> CompletionStage<Result<T>> tapAsyncStep(
            CompletionStage<Result<T>> stage,
            Function<? super T, ? extends CompletionStage<?>> action) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(action, "action must not be null");
        return stage.thenCompose(result -> tapAsync(result, action));
    }

    private static <T> CompletionStage<Result<T>> completed(Result<T> result) {
        return CompletableFuture.completedFuture(result);
    }
}
