package org.javai.result;

/**
 * Thrown when {@link Outcome#unwrap()} is called on a failed outcome.
 * The caller should have checked {@link Outcome#isFailure()} first, or used one of the
 * non-throwing accessors such as {@link Outcome#unwrapOr(Object)}.
 *
 * <p>The failure payload is available unchanged through {@link #error()}. When the payload
 * is itself a {@link Throwable} it is also chained as this exception's cause.
 */
public class OutcomeFailedException extends UnwrapException {

    public OutcomeFailedException(Object error) {
        super("Outcome is a failure: " + error, error);
    }

    /**
     * Returns the error carried by the failed outcome.
     */
    public Object error() {
        return reason();
    }
}
