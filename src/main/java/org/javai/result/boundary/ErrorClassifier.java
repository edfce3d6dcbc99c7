package org.javai.result.boundary;

/**
 * Translates a captured exception into the error type of an outcome.
 * Implementations should be deterministic and must not throw.
 *
 * @param <E> The error type produced
 */
@FunctionalInterface
public interface ErrorClassifier<E> {

    /**
     * Classifies an exception into an error value.
     *
     * @param operation The operation that was being performed
     * @param exception The exception that was captured
     * @return the error to carry in the failed outcome
     */
    E classify(String operation, Exception exception);

    /**
     * A classifier that keeps the exception itself as the error.
     */
    static ErrorClassifier<Exception> identity() {
        return (operation, exception) -> exception;
    }
}
