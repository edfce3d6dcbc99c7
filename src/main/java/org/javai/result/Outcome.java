package org.javai.result;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;
import org.javai.result.boundary.Boundary;
import org.javai.result.boundary.ThrowingSupplier;

/**
 * Represents the outcome of an operation that may fail.
 * Either {@link Success} containing a value, or {@link Failure} containing an error.
 *
 * <p>Failures are ordinary values: every transformation carries them forward untouched, so
 * a chain of operations only needs to inspect the result once at the end. The only method
 * that throws by design is {@link #unwrap()}, which asserts that failure is impossible.
 *
 * <p>Exceptions thrown by third-party code are brought into outcome-space through
 * {@link #perform(ThrowingSupplier)} or a configured {@link Boundary}.
 *
 * @param <T> The type of the successful value
 * @param <E> The type of the error
 */
public sealed interface Outcome<T, E> permits Outcome.Success, Outcome.Failure {

    /**
     * A successful outcome containing a value. The value may be {@code null}.
     *
     * @param value the successful value
     */
    record Success<T, E>(T value) implements Outcome<T, E> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
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
        public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
            return value;
        }

        @Override
        public <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> U mapOr(Function<? super T, ? extends U> mapper, U defaultValue) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <U> U mapOrElse(Function<? super T, ? extends U> mapper, Function<? super E, ? extends U> fallback) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <U> Outcome<U, E> flatMap(Function<? super T, ? extends Outcome<U, E>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <F> Outcome<T, F> mapErr(Function<? super E, ? extends F> mapper) {
            return new Success<>(value);
        }

        @Override
        public Option<T> toOption() {
            return Option.some(value);
        }

        @Override
        public Stream<T> stream() {
            return Stream.of(value);
        }

        @Override
        public Outcome<T, E> ifSuccess(Consumer<? super T> action) {
            Objects.requireNonNull(action);
            action.accept(value);
            return this;
        }

        @Override
        public Outcome<T, E> ifFailure(Consumer<? super E> action) {
            return this;
        }
    }

    /**
     * A failed outcome containing an error. The error may be {@code null}; the variant alone
     * decides that the outcome failed.
     *
     * @param error the error
     */
    record Failure<T, E>(E error) implements Outcome<T, E> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public T unwrap() {
            throw new OutcomeFailedException(error);
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
            Objects.requireNonNull(fallback);
            return fallback.apply(error);
        }

        @Override
        public <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper) {
            return retype();
        }

        @Override
        public <U> U mapOr(Function<? super T, ? extends U> mapper, U defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> U mapOrElse(Function<? super T, ? extends U> mapper, Function<? super E, ? extends U> fallback) {
            Objects.requireNonNull(fallback);
            return fallback.apply(error);
        }

        @Override
        public <U> Outcome<U, E> flatMap(Function<? super T, ? extends Outcome<U, E>> mapper) {
            return retype();
        }

        @Override
        public <F> Outcome<T, F> mapErr(Function<? super E, ? extends F> mapper) {
            Objects.requireNonNull(mapper);
            return new Failure<>(mapper.apply(error));
        }

        @Override
        public Option<T> toOption() {
            return Option.none();
        }

        @Override
        public Stream<T> stream() {
            return Stream.empty();
        }

        @Override
        public Outcome<T, E> ifSuccess(Consumer<? super T> action) {
            return this;
        }

        @Override
        public Outcome<T, E> ifFailure(Consumer<? super E> action) {
            Objects.requireNonNull(action);
            action.accept(error);
            return this;
        }

        // A failure holds no T, so the same instance serves for any success type.
        @SuppressWarnings("unchecked")
        private <U> Outcome<U, E> retype() {
            return (Outcome<U, E>) this;
        }
    }

    // Query methods
    boolean isSuccess();
    boolean isFailure();

    // Value extraction

    /**
     * Returns the successful value.
     *
     * @throws OutcomeFailedException carrying the error if this outcome failed
     */
    T unwrap();
    T unwrapOr(T defaultValue);
    T unwrapOrElse(Function<? super E, ? extends T> fallback);

    // Transformations

    /**
     * Transforms the successful value. A failure is returned as the same instance and
     * {@code mapper} is not invoked.
     */
    <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper);
    <U> U mapOr(Function<? super T, ? extends U> mapper, U defaultValue);
    <U> U mapOrElse(Function<? super T, ? extends U> mapper, Function<? super E, ? extends U> fallback);

    /**
     * Chains an operation that may itself fail. A failure is returned as the same instance
     * and {@code mapper} is not invoked.
     */
    <U> Outcome<U, E> flatMap(Function<? super T, ? extends Outcome<U, E>> mapper);

    /**
     * Transforms the error. A success passes through with its value unchanged.
     */
    <F> Outcome<T, F> mapErr(Function<? super E, ? extends F> mapper);

    // Conversions

    /**
     * Projects to an option, discarding the error of a failure.
     */
    Option<T> toOption();
    Stream<T> stream();

    // Terminal side effects
    Outcome<T, E> ifSuccess(Consumer<? super T> action);
    Outcome<T, E> ifFailure(Consumer<? super E> action);

    // Static factories
    static <E> Outcome<Void, E> success() {
        return new Success<>(null);
    }

    static <T, E> Outcome<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Outcome<T, E> failure(E error) {
        return new Failure<>(error);
    }

    /**
     * Bridges the "value or error, each possibly null" convention into a single outcome.
     * A non-null {@code error} wins regardless of {@code value}; otherwise the value is
     * normalized through {@link Option#from(Object)}, so two nulls give {@code Success(None)}.
     *
     * @param value the value, may be null
     * @param error the error, may be null
     * @param <T> the value type
     * @param <E> the error type
     * @return a failure carrying {@code error}, or a success carrying the optional value
     */
    static <T, E> Outcome<Option<T>, E> fromPair(T value, E error) {
        if (error != null) {
            return new Failure<>(error);
        }
        return new Success<>(Option.from(value));
    }

    /**
     * Variant of {@link #fromPair(Object, Object)} for a value already held in an option.
     * {@code None}, {@code Some(null)} and a {@code null} reference all become {@code Success(None)},
     * so the value is never wrapped twice.
     *
     * @param value the optional value, may be null
     * @param error the error, may be null
     * @param <T> the value type
     * @param <E> the error type
     * @return a failure carrying {@code error}, or a success carrying the normalized option
     */
    static <T, E> Outcome<Option<T>, E> fromPair(Option<T> value, E error) {
        if (error != null) {
            return new Failure<>(error);
        }
        return new Success<>(Option.from(value));
    }

    /**
     * Runs work that may throw, capturing any exception as a failure.
     * Equivalent to {@code Boundary.silent().call("perform", work)}.
     *
     * @param work the work to execute
     * @param <T> the result type
     * @return Success with the result, or Failure with the thrown exception
     */
    static <T> Outcome<T, Exception> perform(ThrowingSupplier<? extends T, ? extends Exception> work) {
        return Boundary.silent().call("perform", work);
    }

    /**
     * Runs asynchronous work, capturing a synchronous throw or an exceptional completion
     * as a failure. The returned future only completes exceptionally for a {@link java.lang.Error}.
     *
     * @param work the work producing a completion stage
     * @param <T> the result type
     * @return a future of Success with the awaited result, or Failure with the exception
     */
    static <T> CompletableFuture<Outcome<T, Exception>> performAsync(
            ThrowingSupplier<? extends CompletionStage<? extends T>, ? extends Exception> work) {
        return Boundary.silent().callAsync("performAsync", work);
    }
}
