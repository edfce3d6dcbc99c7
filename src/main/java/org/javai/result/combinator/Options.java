package org.javai.result.combinator;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.javai.result.Option;

/**
 * Data-last forms of the {@link Option} operations.
 *
 * <p>{@code Options.map(f).apply(option)} is the same as {@code option.map(f)}. Argument order
 * within each method follows the instance method it wraps.
 */
public final class Options {

    private Options() {
    }

    public static <T> Function<Option<T>, T> unwrapOr(T defaultValue) {
        return option -> option.unwrapOr(defaultValue);
    }

    public static <T> Function<Option<T>, T> unwrapOrElse(Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier);
        return option -> option.unwrapOrElse(supplier);
    }

    public static <T, U> Function<Option<T>, Option<U>> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        return option -> option.map(mapper);
    }

    public static <T, U> Function<Option<T>, Option<U>> flatMap(Function<? super T, ? extends Option<U>> mapper) {
        Objects.requireNonNull(mapper);
        return option -> option.flatMap(mapper);
    }

    public static <T> Function<Option<T>, Option<T>> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        return option -> option.filter(predicate);
    }

    /**
     * @see Option#mapOr(Object, Function)
     */
    public static <T, U> Function<Option<T>, U> mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        return option -> option.mapOr(defaultValue, mapper);
    }

    /**
     * @see Option#mapOrElse(Function, Object)
     */
    public static <T, U> Function<Option<T>, U> mapOrElse(Function<? super T, ? extends U> mapper, U defaultValue) {
        Objects.requireNonNull(mapper);
        return option -> option.mapOrElse(mapper, defaultValue);
    }
}
