package org.javai.result.boundary;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link Boundary} to wrap calls that signal failure by throwing.
 *
 * @param <T> The type of value supplied
 * @param <X> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, X extends Exception> {

    T get() throws X;
}
