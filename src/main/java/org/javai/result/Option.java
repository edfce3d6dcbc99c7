package org.javai.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * An optional value: either {@link Some} holding a value, or the single {@link None} sentinel.
 *
 * <p>Unlike {@link java.util.Optional}, an {@code Option} can hold {@code null} as an ordinary,
 * present value. Data arriving from outside often uses two empty representations, {@code null}
 * and absence; {@link #from(Object)} and {@link #from(Option)} collapse both into {@code None}.
 * Everywhere else {@code Some(null)} stays present, so {@link #isSome()} and {@link #isNone()}
 * never disagree with the variant, while {@link #isNullish()} matches either representation.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Option<String> name = Option.from(request.getParameter("name"));
 * String greeting = name.map(n -> "Hello, " + n).unwrapOr("Hello, stranger");
 * }</pre>
 *
 * @param <T> The type of the present value
 */
public sealed interface Option<T> permits Option.Some, Option.None {

    /**
     * A present value. The value may be {@code null}.
     *
     * @param value the present value
     */
    record Some<T>(T value) implements Option<T> {

        @Override
        public boolean isSome() {
            return true;
        }

        @Override
        public boolean isNone() {
            return false;
        }

        @Override
        public boolean isNullish() {
            return value == null;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return value;
        }

        @Override
        public T unwrapOrElse(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Some<>(mapper.apply(value));
        }

        @Override
        public <U> Option<U> flatMap(Function<? super T, ? extends Option<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Option<T> filter(Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            return predicate.test(value) ? this : none();
        }

        @Override
        public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <U> U mapOrElse(Function<? super T, ? extends U> mapper, U defaultValue) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <E> Outcome<T, E> okOr(E error) {
            return Outcome.success(value);
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }
    }

    /**
     * The absent sentinel. There is exactly one instance, obtained through {@link Option#none()}.
     */
    final class None<T> implements Option<T> {

        private static final None<?> INSTANCE = new None<>();

        private None() {
        }

        @Override
        public boolean isSome() {
            return false;
        }

        @Override
        public boolean isNone() {
            return true;
        }

        @Override
        public boolean isNullish() {
            return true;
        }

        @Override
        public T unwrap() {
            throw new OptionAbsentException();
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T unwrapOrElse(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
            return none();
        }

        @Override
        public <U> Option<U> flatMap(Function<? super T, ? extends Option<U>> mapper) {
            return none();
        }

        @Override
        public Option<T> filter(Predicate<? super T> predicate) {
            return this;
        }

        @Override
        public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
            return defaultValue;
        }

        @Override
        public <U> U mapOrElse(Function<? super T, ? extends U> mapper, U defaultValue) {
            return defaultValue;
        }

        @Override
        public <E> Outcome<T, E> okOr(E error) {
            return Outcome.failure(error);
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "None";
        }
    }

    // Query methods
    boolean isSome();
    boolean isNone();

    /**
     * Returns true for {@code None} and for a present {@code null}.
     */
    boolean isNullish();

    // Value extraction

    /**
     * Returns the present value.
     *
     * @throws OptionAbsentException if this is {@code None}
     */
    T unwrap();
    T unwrapOr(T defaultValue);
    T unwrapOrElse(Supplier<? extends T> supplier);

    // Transformations
    <U> Option<U> map(Function<? super T, ? extends U> mapper);
    <U> Option<U> flatMap(Function<? super T, ? extends Option<U>> mapper);
    Option<T> filter(Predicate<? super T> predicate);

    /**
     * Applies {@code mapper} to a present value, or returns {@code defaultValue} when absent.
     * The default comes first, ahead of the transform.
     */
    <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper);

    /**
     * Applies {@code mapper} to a present value, or returns {@code defaultValue} when absent.
     * The transform comes first and the static default last.
     */
    <U> U mapOrElse(Function<? super T, ? extends U> mapper, U defaultValue);

    // Conversions

    /**
     * Converts to an outcome: a present value succeeds, absence fails with {@code error}.
     */
    <E> Outcome<T, E> okOr(E error);

    /**
     * Converts to a JDK optional. A present {@code null} becomes empty.
     */
    Optional<T> toOptional();

    // Static factories
    static <T> Option<T> some(T value) {
        return new Some<>(value);
    }

    @SuppressWarnings("unchecked")
    static <T> Option<T> none() {
        return (Option<T>) None.INSTANCE;
    }

    /**
     * Normalizes a nullable value: {@code null} becomes {@code None}, anything else is present.
     *
     * @param value a value that may be {@code null}
     * @param <T> the value type
     * @return {@code None} for null, otherwise {@code Some(value)}
     */
    static <T> Option<T> from(T value) {
        return value == null ? none() : new Some<>(value);
    }

    /**
     * Normalizes an option whose present value is {@code null} to {@code None}.
     * A {@code null} reference is treated the same way, so {@code Option.from(null)} is {@code None}.
     *
     * @param option an option that may hold {@code null}, or {@code null} itself
     * @param <T> the value type
     * @return {@code None} when {@code option} is nullish, otherwise {@code option} itself
     */
    static <T> Option<T> from(Option<T> option) {
        return option == null || option.isNullish() ? none() : option;
    }

    static <T> Option<T> fromOptional(Optional<T> optional) {
        Objects.requireNonNull(optional);
        return optional.isPresent() ? new Some<>(optional.get()) : none();
    }
}
