package org.javai.result;

/**
 * Thrown when a value is unwrapped from an {@link Outcome} or {@link Option} that does not hold one.
 * Unchecked: unwrapping asserts that absence or failure is impossible at the call site.
 *
 * <p>{@link #reason()} carries the diagnostic cause: the failure payload for an outcome,
 * or a description of the absence for an option. Unlike {@link #getCause()} it is not
 * restricted to {@link Throwable}.
 */
public abstract class UnwrapException extends RuntimeException {

    private final transient Object reason;

    protected UnwrapException(String message, Object reason) {
        super(message, reason instanceof Throwable t ? t : null);
        this.reason = reason;
    }

    /**
     * Returns the diagnostic cause of this unwrap failure.
     */
    public Object reason() {
        return reason;
    }
}
