package org.javai.result.bridge;

/**
 * The result shape emitted by schema validators: a success flag, paired with the parsed data
 * on success or an error on failure.
 *
 * <p>Adapters for a particular validation library implement this interface, or build instances
 * with {@link #success(Object)} and {@link #failure(Object)}, and hand them to
 * {@link ParseResults#toOutcome(ParseResult)}. Nothing here depends on a validation library.
 *
 * @param <T> The type of the parsed data
 * @param <E> The type of the validation error
 */
public interface ParseResult<T, E> {

    boolean success();

    /**
     * The parsed data; meaningful only when {@link #success()} is true.
     */
    T data();

    /**
     * The validation error; meaningful only when {@link #success()} is false.
     */
    E error();

    static <T, E> ParseResult<T, E> success(T data) {
        return new Parsed<>(true, data, null);
    }

    static <T, E> ParseResult<T, E> failure(E error) {
        return new Parsed<>(false, null, error);
    }

    record Parsed<T, E>(boolean success, T data, E error) implements ParseResult<T, E> {
    }
}
