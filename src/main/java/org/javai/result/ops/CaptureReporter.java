package org.javai.result.ops;

/**
 * Observes exceptions captured at a {@link org.javai.result.boundary.Boundary}.
 * Implementations might write structured logs or count occurrences.
 *
 * <p>Reporting happens after the exception has already been turned into a failed outcome;
 * a reporter cannot change what the caller receives.
 */
@FunctionalInterface
public interface CaptureReporter {

    /**
     * Reports a captured exception.
     *
     * @param operation The operation that threw
     * @param exception The captured exception
     */
    void report(String operation, Exception exception);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static CaptureReporter noOp() {
        return (operation, exception) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static CaptureReporter composite(CaptureReporter... reporters) {
        return CompositeCaptureReporter.of(reporters);
    }
}
