package org.javai.result.pipe;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import org.javai.result.Outcome;

/**
 * Threads an {@link Outcome} through a sequence of steps that may each fail, stopping at the
 * first failure.
 *
 * <p>Each step receives the successful value of the previous outcome and returns the next
 * outcome. As soon as an outcome is a failure, the remaining steps are skipped and that
 * failure is returned as the same instance. The decision is made on
 * {@link Outcome#isFailure()}, never by catching exceptions; a step that throws propagates.
 *
 * <pre>{@code
 * Outcome<String, String> result = OutcomePipe.pipe(
 *     Outcome.success(10),
 *     x -> Outcome.success(x + 5),
 *     x -> x > 10 ? Outcome.success(x * 2) : Outcome.failure("too small"),
 *     x -> Outcome.success("result: " + x));
 * // Success[value=result: 30]
 * }</pre>
 *
 * <p>All steps share the error type {@code E}; translate errors with
 * {@link Outcome#mapErr(Function)} before joining chains with different error types.
 * The fixed-arity overloads accept up to eight steps; longer chains use
 * {@link #pipeAll(Outcome, List)}.
 */
public final class OutcomePipe {

    private OutcomePipe() {
    }

    /**
     * Returns {@code value} unchanged.
     */
    public static <T0, E> Outcome<T0, E> pipe(Outcome<T0, E> value) {
        return value;
    }

    /**
     * Applies the steps to the successful value in order, stopping at the first failure.
     *
     * @param value the initial outcome
     * @return the last step's outcome, or the first failure encountered
     */
    public static <T0, T1, E> Outcome<T1, E> pipe(Outcome<T0, E> value,
            Function<? super T0, ? extends Outcome<T1, E>> f1) {
        return value.flatMap(f1);
    }

    public static <T0, T1, T2, E> Outcome<T2, E> pipe(Outcome<T0, E> value,
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2) {
        return value.flatMap(f1).flatMap(f2);
    }

    public static <T0, T1, T2, T3, E> Outcome<T3, E> pipe(Outcome<T0, E> value,
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3) {
        return value.flatMap(f1).flatMap(f2).flatMap(f3);
    }

    public static <T0, T1, T2, T3, T4, E> Outcome<T4, E> pipe(Outcome<T0, E> value,
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4) {
        return value.flatMap(f1).flatMap(f2).flatMap(f3).flatMap(f4);
    }

    public static <T0, T1, T2, T3, T4, T5, E> Outcome<T5, E> pipe(Outcome<T0, E> value,
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4,
            Function<? super T4, ? extends Outcome<T5, E>> f5) {
        return value.flatMap(f1).flatMap(f2).flatMap(f3).flatMap(f4).flatMap(f5);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, E> Outcome<T6, E> pipe(Outcome<T0, E> value,
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4,
            Function<? super T4, ? extends Outcome<T5, E>> f5,
            Function<? super T5, ? extends Outcome<T6, E>> f6) {
        return value.flatMap(f1).flatMap(f2).flatMap(f3).flatMap(f4).flatMap(f5).flatMap(f6);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, E> Outcome<T7, E> pipe(Outcome<T0, E> value,
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4,
            Function<? super T4, ? extends Outcome<T5, E>> f5,
            Function<? super T5, ? extends Outcome<T6, E>> f6,
            Function<? super T6, ? extends Outcome<T7, E>> f7) {
        return value.flatMap(f1).flatMap(f2).flatMap(f3).flatMap(f4).flatMap(f5).flatMap(f6).flatMap(f7);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, T8, E> Outcome<T8, E> pipe(Outcome<T0, E> value,
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4,
            Function<? super T4, ? extends Outcome<T5, E>> f5,
            Function<? super T5, ? extends Outcome<T6, E>> f6,
            Function<? super T6, ? extends Outcome<T7, E>> f7,
            Function<? super T7, ? extends Outcome<T8, E>> f8) {
        return value.flatMap(f1).flatMap(f2).flatMap(f3).flatMap(f4).flatMap(f5).flatMap(f6).flatMap(f7).flatMap(f8);
    }

    /**
     * Composes the steps into a function equivalent to {@code value -> pipe(value, steps...)}.
     */
    public static <T0, T1, E> Function<Outcome<T0, E>, Outcome<T1, E>> flow(
            Function<? super T0, ? extends Outcome<T1, E>> f1) {
        return value -> pipe(value, f1);
    }

    public static <T0, T1, T2, E> Function<Outcome<T0, E>, Outcome<T2, E>> flow(
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2) {
        return value -> pipe(value, f1, f2);
    }

    public static <T0, T1, T2, T3, E> Function<Outcome<T0, E>, Outcome<T3, E>> flow(
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3) {
        return value -> pipe(value, f1, f2, f3);
    }

    public static <T0, T1, T2, T3, T4, E> Function<Outcome<T0, E>, Outcome<T4, E>> flow(
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4) {
        return value -> pipe(value, f1, f2, f3, f4);
    }

    public static <T0, T1, T2, T3, T4, T5, E> Function<Outcome<T0, E>, Outcome<T5, E>> flow(
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4,
            Function<? super T4, ? extends Outcome<T5, E>> f5) {
        return value -> pipe(value, f1, f2, f3, f4, f5);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, E> Function<Outcome<T0, E>, Outcome<T6, E>> flow(
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4,
            Function<? super T4, ? extends Outcome<T5, E>> f5,
            Function<? super T5, ? extends Outcome<T6, E>> f6) {
        return value -> pipe(value, f1, f2, f3, f4, f5, f6);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, E> Function<Outcome<T0, E>, Outcome<T7, E>> flow(
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4,
            Function<? super T4, ? extends Outcome<T5, E>> f5,
            Function<? super T5, ? extends Outcome<T6, E>> f6,
            Function<? super T6, ? extends Outcome<T7, E>> f7) {
        return value -> pipe(value, f1, f2, f3, f4, f5, f6, f7);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, T8, E> Function<Outcome<T0, E>, Outcome<T8, E>> flow(
            Function<? super T0, ? extends Outcome<T1, E>> f1,
            Function<? super T1, ? extends Outcome<T2, E>> f2,
            Function<? super T2, ? extends Outcome<T3, E>> f3,
            Function<? super T3, ? extends Outcome<T4, E>> f4,
            Function<? super T4, ? extends Outcome<T5, E>> f5,
            Function<? super T5, ? extends Outcome<T6, E>> f6,
            Function<? super T6, ? extends Outcome<T7, E>> f7,
            Function<? super T7, ? extends Outcome<T8, E>> f8) {
        return value -> pipe(value, f1, f2, f3, f4, f5, f6, f7, f8);
    }

    /**
     * Applies asynchronous steps in order, each awaited before the next starts, stopping at the
     * first failed outcome. A step that throws or completes exceptionally completes the returned
     * future exceptionally; use {@link Outcome#performAsync} inside a step to capture instead.
     *
     * @param value the initial outcome
     * @return a future of the last step's outcome, or of the first failure encountered
     */
    public static <T0, T1, E> CompletableFuture<Outcome<T1, E>> pipeAsync(Outcome<T0, E> value,
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1) {
        return CompletableFuture.completedFuture(value)
                .thenCompose(bind(f1));
    }

    public static <T0, T1, T2, E> CompletableFuture<Outcome<T2, E>> pipeAsync(Outcome<T0, E> value,
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2) {
        return CompletableFuture.completedFuture(value)
                .thenCompose(bind(f1))
                .thenCompose(bind(f2));
    }

    public static <T0, T1, T2, T3, E> CompletableFuture<Outcome<T3, E>> pipeAsync(Outcome<T0, E> value,
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3) {
        return CompletableFuture.completedFuture(value)
                .thenCompose(bind(f1))
                .thenCompose(bind(f2))
                .thenCompose(bind(f3));
    }

    public static <T0, T1, T2, T3, T4, E> CompletableFuture<Outcome<T4, E>> pipeAsync(Outcome<T0, E> value,
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4) {
        return CompletableFuture.completedFuture(value)
                .thenCompose(bind(f1))
                .thenCompose(bind(f2))
                .thenCompose(bind(f3))
                .thenCompose(bind(f4));
    }

    public static <T0, T1, T2, T3, T4, T5, E> CompletableFuture<Outcome<T5, E>> pipeAsync(Outcome<T0, E> value,
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4,
            Function<? super T4, ? extends CompletionStage<Outcome<T5, E>>> f5) {
        return CompletableFuture.completedFuture(value)
                .thenCompose(bind(f1))
                .thenCompose(bind(f2))
                .thenCompose(bind(f3))
                .thenCompose(bind(f4))
                .thenCompose(bind(f5));
    }

    public static <T0, T1, T2, T3, T4, T5, T6, E> CompletableFuture<Outcome<T6, E>> pipeAsync(Outcome<T0, E> value,
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4,
            Function<? super T4, ? extends CompletionStage<Outcome<T5, E>>> f5,
            Function<? super T5, ? extends CompletionStage<Outcome<T6, E>>> f6) {
        return CompletableFuture.completedFuture(value)
                .thenCompose(bind(f1))
                .thenCompose(bind(f2))
                .thenCompose(bind(f3))
                .thenCompose(bind(f4))
                .thenCompose(bind(f5))
                .thenCompose(bind(f6));
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, E> CompletableFuture<Outcome<T7, E>> pipeAsync(Outcome<T0, E> value,
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4,
            Function<? super T4, ? extends CompletionStage<Outcome<T5, E>>> f5,
            Function<? super T5, ? extends CompletionStage<Outcome<T6, E>>> f6,
            Function<? super T6, ? extends CompletionStage<Outcome<T7, E>>> f7) {
        return CompletableFuture.completedFuture(value)
                .thenCompose(bind(f1))
                .thenCompose(bind(f2))
                .thenCompose(bind(f3))
                .thenCompose(bind(f4))
                .thenCompose(bind(f5))
                .thenCompose(bind(f6))
                .thenCompose(bind(f7));
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, T8, E> CompletableFuture<Outcome<T8, E>> pipeAsync(Outcome<T0, E> value,
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4,
            Function<? super T4, ? extends CompletionStage<Outcome<T5, E>>> f5,
            Function<? super T5, ? extends CompletionStage<Outcome<T6, E>>> f6,
            Function<? super T6, ? extends CompletionStage<Outcome<T7, E>>> f7,
            Function<? super T7, ? extends CompletionStage<Outcome<T8, E>>> f8) {
        return CompletableFuture.completedFuture(value)
                .thenCompose(bind(f1))
                .thenCompose(bind(f2))
                .thenCompose(bind(f3))
                .thenCompose(bind(f4))
                .thenCompose(bind(f5))
                .thenCompose(bind(f6))
                .thenCompose(bind(f7))
                .thenCompose(bind(f8));
    }

    /**
     * Composes asynchronous steps into a function equivalent to
     * {@code value -> pipeAsync(value, steps...)}.
     */
    public static <T0, T1, E> Function<Outcome<T0, E>, CompletableFuture<Outcome<T1, E>>> flowAsync(
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1) {
        return value -> pipeAsync(value, f1);
    }

    public static <T0, T1, T2, E> Function<Outcome<T0, E>, CompletableFuture<Outcome<T2, E>>> flowAsync(
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2) {
        return value -> pipeAsync(value, f1, f2);
    }

    public static <T0, T1, T2, T3, E> Function<Outcome<T0, E>, CompletableFuture<Outcome<T3, E>>> flowAsync(
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3) {
        return value -> pipeAsync(value, f1, f2, f3);
    }

    public static <T0, T1, T2, T3, T4, E> Function<Outcome<T0, E>, CompletableFuture<Outcome<T4, E>>> flowAsync(
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4) {
        return value -> pipeAsync(value, f1, f2, f3, f4);
    }

    public static <T0, T1, T2, T3, T4, T5, E> Function<Outcome<T0, E>, CompletableFuture<Outcome<T5, E>>> flowAsync(
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4,
            Function<? super T4, ? extends CompletionStage<Outcome<T5, E>>> f5) {
        return value -> pipeAsync(value, f1, f2, f3, f4, f5);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, E> Function<Outcome<T0, E>, CompletableFuture<Outcome<T6, E>>> flowAsync(
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4,
            Function<? super T4, ? extends CompletionStage<Outcome<T5, E>>> f5,
            Function<? super T5, ? extends CompletionStage<Outcome<T6, E>>> f6) {
        return value -> pipeAsync(value, f1, f2, f3, f4, f5, f6);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, E> Function<Outcome<T0, E>, CompletableFuture<Outcome<T7, E>>> flowAsync(
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4,
            Function<? super T4, ? extends CompletionStage<Outcome<T5, E>>> f5,
            Function<? super T5, ? extends CompletionStage<Outcome<T6, E>>> f6,
            Function<? super T6, ? extends CompletionStage<Outcome<T7, E>>> f7) {
        return value -> pipeAsync(value, f1, f2, f3, f4, f5, f6, f7);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, T8, E> Function<Outcome<T0, E>, CompletableFuture<Outcome<T8, E>>> flowAsync(
            Function<? super T0, ? extends CompletionStage<Outcome<T1, E>>> f1,
            Function<? super T1, ? extends CompletionStage<Outcome<T2, E>>> f2,
            Function<? super T2, ? extends CompletionStage<Outcome<T3, E>>> f3,
            Function<? super T3, ? extends CompletionStage<Outcome<T4, E>>> f4,
            Function<? super T4, ? extends CompletionStage<Outcome<T5, E>>> f5,
            Function<? super T5, ? extends CompletionStage<Outcome<T6, E>>> f6,
            Function<? super T6, ? extends CompletionStage<Outcome<T7, E>>> f7,
            Function<? super T7, ? extends CompletionStage<Outcome<T8, E>>> f8) {
        return value -> pipeAsync(value, f1, f2, f3, f4, f5, f6, f7, f8);
    }

    /**
     * Applies any number of steps, stopping at the first failure. Types are not checked at
     * compile time.
     *
     * @param value the initial outcome
     * @param steps the steps, applied in list order to each successful value
     * @return the last step's outcome, or an outcome equal to the first failure encountered
     */
    public static Outcome<Object, Object> pipeAll(
            Outcome<?, ?> value, List<? extends Function<Object, ? extends Outcome<?, ?>>> steps) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(steps, "steps must not be null");
        Outcome<?, ?> current = value;
        for (Function<Object, ? extends Outcome<?, ?>> step : steps) {
            if (!(current instanceof Outcome.Success<?, ?> success)) {
                break;
            }
            current = Objects.requireNonNull(step.apply(success.value()), "step returned null");
        }
        return widen(current);
    }

    public static Function<Outcome<?, ?>, Outcome<Object, Object>> flowAll(
            List<? extends Function<Object, ? extends Outcome<?, ?>>> steps) {
        List<? extends Function<Object, ? extends Outcome<?, ?>>> copy = List.copyOf(steps);
        return value -> pipeAll(value, copy);
    }

    /**
     * Asynchronous counterpart of {@link #pipeAll(Outcome, List)}.
     */
    public static CompletableFuture<Outcome<Object, Object>> pipeAllAsync(
            Outcome<?, ?> value,
            List<? extends Function<Object, ? extends CompletionStage<? extends Outcome<?, ?>>>> steps) {
        Objects.requireNonNull(steps, "steps must not be null");
        CompletableFuture<Outcome<Object, Object>> current = CompletableFuture.completedFuture(widen(value));
        for (Function<Object, ? extends CompletionStage<? extends Outcome<?, ?>>> step : steps) {
            current = current.thenCompose(previous -> {
                if (!(previous instanceof Outcome.Success<Object, Object> success)) {
                    return CompletableFuture.completedFuture(previous);
                }
                return step.apply(success.value()).thenApply(OutcomePipe::widen);
            });
        }
        return current;
    }

    public static Function<Outcome<?, ?>, CompletableFuture<Outcome<Object, Object>>> flowAllAsync(
            List<? extends Function<Object, ? extends CompletionStage<? extends Outcome<?, ?>>>> steps) {
        List<? extends Function<Object, ? extends CompletionStage<? extends Outcome<?, ?>>>> copy = List.copyOf(steps);
        return value -> pipeAllAsync(value, copy);
    }

    private static <T, U, E> Function<Outcome<T, E>, CompletionStage<Outcome<U, E>>> bind(
            Function<? super T, ? extends CompletionStage<Outcome<U, E>>> step) {
        Objects.requireNonNull(step);
        return outcome -> {
            if (outcome instanceof Outcome.Success<T, E> success) {
                return step.apply(success.value());
            }
            return CompletableFuture.completedFuture(retype(outcome));
        };
    }

    // Only called on failures, which hold no value of the source type.
    @SuppressWarnings("unchecked")
    private static <U, E> Outcome<U, E> retype(Outcome<?, E> failure) {
        return (Outcome<U, E>) failure;
    }

    private static Outcome<Object, Object> widen(Outcome<?, ?> outcome) {
        if (outcome instanceof Outcome.Success<?, ?> success) {
            return Outcome.success(success.value());
        }
        return Outcome.failure(((Outcome.Failure<?, ?>) outcome).error());
    }
}
