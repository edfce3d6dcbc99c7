package org.javai.result.combinator;

import java.util.Objects;
import java.util.function.Function;
import org.javai.result.Option;
import org.javai.result.Outcome;

/**
 * Data-last forms of the {@link Outcome} operations.
 *
 * <p>Each method takes the configuration of an operation and returns a function awaiting the
 * outcome, so {@code Outcomes.map(f).apply(outcome)} is the same as {@code outcome.map(f)}.
 * The returned functions slot into {@link org.javai.result.pipe.Pipe} chains and into
 * {@link java.util.stream.Stream#map(Function)}:
 *
 * <pre>{@code
 * List<Outcome<Integer, String>> doubled = results.stream()
 *     .map(Outcomes.map((Integer x) -> x * 2))
 *     .toList();
 * }</pre>
 */
public final class Outcomes {

    private Outcomes() {
    }

    /**
     * @see Outcome#unwrapOr(Object)
     */
    public static <T, E> Function<Outcome<T, E>, T> unwrapOr(T defaultValue) {
        return outcome -> outcome.unwrapOr(defaultValue);
    }

    /**
     * @see Outcome#unwrapOrElse(Function)
     */
    public static <T, E> Function<Outcome<T, E>, T> unwrapOrElse(Function<? super E, ? extends T> fallback) {
        Objects.requireNonNull(fallback);
        return outcome -> outcome.unwrapOrElse(fallback);
    }

    /**
     * @see Outcome#map(Function)
     */
    public static <T, U, E> Function<Outcome<T, E>, Outcome<U, E>> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        return outcome -> outcome.map(mapper);
    }

    /**
     * @see Outcome#mapOr(Function, Object)
     */
    public static <T, U, E> Function<Outcome<T, E>, U> mapOr(Function<? super T, ? extends U> mapper, U defaultValue) {
        Objects.requireNonNull(mapper);
        return outcome -> outcome.mapOr(mapper, defaultValue);
    }

    /**
     * @see Outcome#mapOrElse(Function, Function)
     */
    public static <T, U, E> Function<Outcome<T, E>, U> mapOrElse(
            Function<? super T, ? extends U> mapper, Function<? super E, ? extends U> fallback) {
        Objects.requireNonNull(mapper);
        Objects.requireNonNull(fallback);
        return outcome -> outcome.mapOrElse(mapper, fallback);
    }

    /**
     * @see Outcome#flatMap(Function)
     */
    public static <T, U, E> Function<Outcome<T, E>, Outcome<U, E>> flatMap(
            Function<? super T, ? extends Outcome<U, E>> mapper) {
        Objects.requireNonNull(mapper);
        return outcome -> outcome.flatMap(mapper);
    }

    /**
     * @see Outcome#mapErr(Function)
     */
    public static <T, E, F> Function<Outcome<T, E>, Outcome<T, F>> mapErr(Function<? super E, ? extends F> mapper) {
        Objects.requireNonNull(mapper);
        return outcome -> outcome.mapErr(mapper);
    }

    /**
     * @see Outcome#toOption()
     */
    public static <T, E> Function<Outcome<T, E>, Option<T>> toOption() {
        return Outcome::toOption;
    }
}
