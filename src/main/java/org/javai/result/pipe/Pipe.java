package org.javai.result.pipe;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Threads a value through a sequence of functions, each receiving the previous result.
 *
 * <p>Every step runs, in order. There is no notion of failure here: a failed
 * {@link org.javai.result.Outcome} or an absent {@link org.javai.result.Option} is passed to the
 * next step like any other value, so steps are normally the data-last combinators of
 * {@link org.javai.result.combinator.Outcomes} and {@link org.javai.result.combinator.Options},
 * which already leave failure and absence untouched. Use {@link OutcomePipe} to stop at the
 * first failure instead.
 *
 * <pre>{@code
 * String label = Pipe.pipe(
 *     Option.from(user.nickname()),
 *     Options.map(String::trim),
 *     Options.filter((String s) -> !s.isEmpty()),
 *     Options.unwrapOr("anonymous"));
 * }</pre>
 *
 * <p>The fixed-arity overloads infer every intermediate type and accept up to eight steps.
 * Longer chains use {@link #pipeAll(Object, List)} and its relatives, which are checked only
 * at run time.
 */
public final class Pipe {

    private Pipe() {
    }

    /**
     * Returns {@code value} unchanged.
     */
    public static <T0> T0 pipe(T0 value) {
        return value;
    }

    /**
     * Applies the steps to {@code value} in order and returns the last result.
     *
     * @param value the initial value
     * @return the result of the last step
     */
    public static <T0, T1> T1 pipe(T0 value,
            Function<? super T0, ? extends T1> f1) {
        return f1.apply(value);
    }

    public static <T0, T1, T2> T2 pipe(T0 value,
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2) {
        return f2.apply(f1.apply(value));
    }

    public static <T0, T1, T2, T3> T3 pipe(T0 value,
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3) {
        return f3.apply(f2.apply(f1.apply(value)));
    }

    public static <T0, T1, T2, T3, T4> T4 pipe(T0 value,
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4) {
        return f4.apply(f3.apply(f2.apply(f1.apply(value))));
    }

    public static <T0, T1, T2, T3, T4, T5> T5 pipe(T0 value,
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4,
            Function<? super T4, ? extends T5> f5) {
        return f5.apply(f4.apply(f3.apply(f2.apply(f1.apply(value)))));
    }

    public static <T0, T1, T2, T3, T4, T5, T6> T6 pipe(T0 value,
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4,
            Function<? super T4, ? extends T5> f5,
            Function<? super T5, ? extends T6> f6) {
        return f6.apply(f5.apply(f4.apply(f3.apply(f2.apply(f1.apply(value))))));
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7> T7 pipe(T0 value,
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4,
            Function<? super T4, ? extends T5> f5,
            Function<? super T5, ? extends T6> f6,
            Function<? super T6, ? extends T7> f7) {
        return f7.apply(f6.apply(f5.apply(f4.apply(f3.apply(f2.apply(f1.apply(value)))))));
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, T8> T8 pipe(T0 value,
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4,
            Function<? super T4, ? extends T5> f5,
            Function<? super T5, ? extends T6> f6,
            Function<? super T6, ? extends T7> f7,
            Function<? super T7, ? extends T8> f8) {
        return f8.apply(f7.apply(f6.apply(f5.apply(f4.apply(f3.apply(f2.apply(f1.apply(value))))))));
    }

    /**
     * Composes the steps into a function equivalent to {@code value -> pipe(value, steps...)}.
     */
    public static <T0, T1> Function<T0, T1> flow(
            Function<? super T0, ? extends T1> f1) {
        return value -> pipe(value, f1);
    }

    public static <T0, T1, T2> Function<T0, T2> flow(
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2) {
        return value -> pipe(value, f1, f2);
    }

    public static <T0, T1, T2, T3> Function<T0, T3> flow(
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3) {
        return value -> pipe(value, f1, f2, f3);
    }

    public static <T0, T1, T2, T3, T4> Function<T0, T4> flow(
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4) {
        return value -> pipe(value, f1, f2, f3, f4);
    }

    public static <T0, T1, T2, T3, T4, T5> Function<T0, T5> flow(
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4,
            Function<? super T4, ? extends T5> f5) {
        return value -> pipe(value, f1, f2, f3, f4, f5);
    }

    public static <T0, T1, T2, T3, T4, T5, T6> Function<T0, T6> flow(
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4,
            Function<? super T4, ? extends T5> f5,
            Function<? super T5, ? extends T6> f6) {
        return value -> pipe(value, f1, f2, f3, f4, f5, f6);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7> Function<T0, T7> flow(
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4,
            Function<? super T4, ? extends T5> f5,
            Function<? super T5, ? extends T6> f6,
            Function<? super T6, ? extends T7> f7) {
        return value -> pipe(value, f1, f2, f3, f4, f5, f6, f7);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, T8> Function<T0, T8> flow(
            Function<? super T0, ? extends T1> f1,
            Function<? super T1, ? extends T2> f2,
            Function<? super T2, ? extends T3> f3,
            Function<? super T3, ? extends T4> f4,
            Function<? super T4, ? extends T5> f5,
            Function<? super T5, ? extends T6> f6,
            Function<? super T6, ? extends T7> f7,
            Function<? super T7, ? extends T8> f8) {
        return value -> pipe(value, f1, f2, f3, f4, f5, f6, f7, f8);
    }

    /**
     * Applies asynchronous steps in order. Each step starts only after the stage returned by the
     * previous one has completed, and receives its result.
     *
     * <p>Nothing is caught: a step that throws, or whose stage completes exceptionally, completes
     * the returned future exceptionally and the remaining steps do not run.
     *
     * @param value the initial value
     * @return a future of the last step's result
     */
    public static <T0, T1> CompletableFuture<T1> pipeAsync(T0 value,
            Function<? super T0, ? extends CompletionStage<T1>> f1) {
        return CompletableFuture.<T0>completedFuture(value)
                .thenCompose(f1);
    }

    public static <T0, T1, T2> CompletableFuture<T2> pipeAsync(T0 value,
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2) {
        return CompletableFuture.<T0>completedFuture(value)
                .thenCompose(f1)
                .thenCompose(f2);
    }

    public static <T0, T1, T2, T3> CompletableFuture<T3> pipeAsync(T0 value,
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3) {
        return CompletableFuture.<T0>completedFuture(value)
                .thenCompose(f1)
                .thenCompose(f2)
                .thenCompose(f3);
    }

    public static <T0, T1, T2, T3, T4> CompletableFuture<T4> pipeAsync(T0 value,
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4) {
        return CompletableFuture.<T0>completedFuture(value)
                .thenCompose(f1)
                .thenCompose(f2)
                .thenCompose(f3)
                .thenCompose(f4);
    }

    public static <T0, T1, T2, T3, T4, T5> CompletableFuture<T5> pipeAsync(T0 value,
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4,
            Function<? super T4, ? extends CompletionStage<T5>> f5) {
        return CompletableFuture.<T0>completedFuture(value)
                .thenCompose(f1)
                .thenCompose(f2)
                .thenCompose(f3)
                .thenCompose(f4)
                .thenCompose(f5);
    }

    public static <T0, T1, T2, T3, T4, T5, T6> CompletableFuture<T6> pipeAsync(T0 value,
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4,
            Function<? super T4, ? extends CompletionStage<T5>> f5,
            Function<? super T5, ? extends CompletionStage<T6>> f6) {
        return CompletableFuture.<T0>completedFuture(value)
                .thenCompose(f1)
                .thenCompose(f2)
                .thenCompose(f3)
                .thenCompose(f4)
                .thenCompose(f5)
                .thenCompose(f6);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7> CompletableFuture<T7> pipeAsync(T0 value,
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4,
            Function<? super T4, ? extends CompletionStage<T5>> f5,
            Function<? super T5, ? extends CompletionStage<T6>> f6,
            Function<? super T6, ? extends CompletionStage<T7>> f7) {
        return CompletableFuture.<T0>completedFuture(value)
                .thenCompose(f1)
                .thenCompose(f2)
                .thenCompose(f3)
                .thenCompose(f4)
                .thenCompose(f5)
                .thenCompose(f6)
                .thenCompose(f7);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, T8> CompletableFuture<T8> pipeAsync(T0 value,
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4,
            Function<? super T4, ? extends CompletionStage<T5>> f5,
            Function<? super T5, ? extends CompletionStage<T6>> f6,
            Function<? super T6, ? extends CompletionStage<T7>> f7,
            Function<? super T7, ? extends CompletionStage<T8>> f8) {
        return CompletableFuture.<T0>completedFuture(value)
                .thenCompose(f1)
                .thenCompose(f2)
                .thenCompose(f3)
                .thenCompose(f4)
                .thenCompose(f5)
                .thenCompose(f6)
                .thenCompose(f7)
                .thenCompose(f8);
    }

    /**
     * Composes asynchronous steps into a function equivalent to
     * {@code value -> pipeAsync(value, steps...)}.
     */
    public static <T0, T1> Function<T0, CompletableFuture<T1>> flowAsync(
            Function<? super T0, ? extends CompletionStage<T1>> f1) {
        return value -> pipeAsync(value, f1);
    }

    public static <T0, T1, T2> Function<T0, CompletableFuture<T2>> flowAsync(
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2) {
        return value -> pipeAsync(value, f1, f2);
    }

    public static <T0, T1, T2, T3> Function<T0, CompletableFuture<T3>> flowAsync(
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3) {
        return value -> pipeAsync(value, f1, f2, f3);
    }

    public static <T0, T1, T2, T3, T4> Function<T0, CompletableFuture<T4>> flowAsync(
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4) {
        return value -> pipeAsync(value, f1, f2, f3, f4);
    }

    public static <T0, T1, T2, T3, T4, T5> Function<T0, CompletableFuture<T5>> flowAsync(
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4,
            Function<? super T4, ? extends CompletionStage<T5>> f5) {
        return value -> pipeAsync(value, f1, f2, f3, f4, f5);
    }

    public static <T0, T1, T2, T3, T4, T5, T6> Function<T0, CompletableFuture<T6>> flowAsync(
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4,
            Function<? super T4, ? extends CompletionStage<T5>> f5,
            Function<? super T5, ? extends CompletionStage<T6>> f6) {
        return value -> pipeAsync(value, f1, f2, f3, f4, f5, f6);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7> Function<T0, CompletableFuture<T7>> flowAsync(
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4,
            Function<? super T4, ? extends CompletionStage<T5>> f5,
            Function<? super T5, ? extends CompletionStage<T6>> f6,
            Function<? super T6, ? extends CompletionStage<T7>> f7) {
        return value -> pipeAsync(value, f1, f2, f3, f4, f5, f6, f7);
    }

    public static <T0, T1, T2, T3, T4, T5, T6, T7, T8> Function<T0, CompletableFuture<T8>> flowAsync(
            Function<? super T0, ? extends CompletionStage<T1>> f1,
            Function<? super T1, ? extends CompletionStage<T2>> f2,
            Function<? super T2, ? extends CompletionStage<T3>> f3,
            Function<? super T3, ? extends CompletionStage<T4>> f4,
            Function<? super T4, ? extends CompletionStage<T5>> f5,
            Function<? super T5, ? extends CompletionStage<T6>> f6,
            Function<? super T6, ? extends CompletionStage<T7>> f7,
            Function<? super T7, ? extends CompletionStage<T8>> f8) {
        return value -> pipeAsync(value, f1, f2, f3, f4, f5, f6, f7, f8);
    }

    /**
     * Applies any number of steps in order. Types are not checked at compile time; a step
     * receiving a value it cannot handle fails with a {@link ClassCastException} at run time.
     *
     * @param value the initial value
     * @param steps the steps, applied in list order
     * @return the result of the last step, or {@code value} when there are no steps
     */
    public static Object pipeAll(Object value, List<? extends Function<Object, ?>> steps) {
        Objects.requireNonNull(steps, "steps must not be null");
        Object current = value;
        for (Function<Object, ?> step : steps) {
            current = step.apply(current);
        }
        return current;
    }

    public static Function<Object, Object> flowAll(List<? extends Function<Object, ?>> steps) {
        List<? extends Function<Object, ?>> copy = List.copyOf(steps);
        return value -> pipeAll(value, copy);
    }

    /**
     * Asynchronous counterpart of {@link #pipeAll(Object, List)}, with the sequencing and
     * failure behaviour of {@link #pipeAsync(Object, Function)}.
     */
    public static CompletableFuture<Object> pipeAllAsync(
            Object value, List<? extends Function<Object, ? extends CompletionStage<?>>> steps) {
        Objects.requireNonNull(steps, "steps must not be null");
        CompletableFuture<Object> current = CompletableFuture.completedFuture(value);
        for (Function<Object, ? extends CompletionStage<?>> step : steps) {
            current = current.thenCompose(previous -> step.apply(previous).<Object>thenApply(result -> result));
        }
        return current;
    }

    public static Function<Object, CompletableFuture<Object>> flowAllAsync(
            List<? extends Function<Object, ? extends CompletionStage<?>>> steps) {
        List<? extends Function<Object, ? extends CompletionStage<?>>> copy = List.copyOf(steps);
        return value -> pipeAllAsync(value, copy);
    }
}
