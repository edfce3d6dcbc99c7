package org.javai.result.boundary;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import org.javai.result.Outcome;
import org.javai.result.ops.CaptureReporter;

/**
 * The boundary adapter for code that signals failure by throwing.
 * Catches exceptions, classifies them into errors, reports them, and returns an Outcome.
 *
 * <p>This is the single point where exceptions are translated into the Outcome world.
 * After passing through a Boundary, code operates entirely in outcome-space.</p>
 *
 * <p>Every {@link Exception}, checked or unchecked, becomes a failure. A {@link java.lang.Error}
 * signals a broken JVM rather than a failed operation and is never captured.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * // Exceptions as the error type, nothing reported
 * Boundary<Exception> boundary = Boundary.silent();
 *
 * // Typed errors, with captured exceptions logged
 * Boundary<String> boundary = Boundary.of(
 *     (operation, e) -> operation + " failed: " + e.getMessage(),
 *     new Log4jCaptureReporter());
 *
 * Outcome<Response, String> result = boundary.call(
 *     "HttpClient.send",
 *     () -> httpClient.send(request, BodyHandlers.ofString())
 * );
 * }</pre>
 *
 * @param <E> The error type of the outcomes produced
 */
public final class Boundary<E> {

    private static final Boundary<Exception> SILENT =
            new Boundary<>(ErrorClassifier.identity(), CaptureReporter.noOp());

    private final ErrorClassifier<? extends E> classifier;
    private final CaptureReporter reporter;

    /**
     * Returns a Boundary that keeps the exception as the error and reports nothing.
     *
     * @return a silent Boundary
     */
    public static Boundary<Exception> silent() {
        return SILENT;
    }

    /**
     * Creates a Boundary that keeps the exception as the error and reports every capture.
     *
     * @param reporter the reporter for captured exceptions
     * @return a reporting Boundary
     */
    public static Boundary<Exception> withReporter(CaptureReporter reporter) {
        return new Boundary<>(ErrorClassifier.identity(), reporter);
    }

    /**
     * Creates a Boundary with custom classification and reporting.
     *
     * <p>The classifier and reporter run on the caller's path and must not throw; wrap
     * reporters that might in a {@link org.javai.result.ops.CompositeCaptureReporter}.
     *
     * @param classifier the classifier translating exceptions into errors
     * @param reporter the reporter for captured exceptions
     * @return a fully configured Boundary
     */
    public static <E> Boundary<E> of(ErrorClassifier<? extends E> classifier, CaptureReporter reporter) {
        return new Boundary<>(classifier, reporter);
    }

    private Boundary(ErrorClassifier<? extends E> classifier, CaptureReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw, translating any exception into a failed Outcome.
     *
     * @param operation The operation name for classification and reporting
     * @param work The work to execute
     * @return Success with the result, or Failure with the classified error
     */
    public <T> Outcome<T, E> call(String operation, ThrowingSupplier<? extends T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.success(work.get());
        } catch (Exception e) {
            return handleException(operation, e);
        }
    }

    /**
     * Executes asynchronous work, translating a synchronous throw or an exceptional
     * completion into a failed Outcome once the work has completed.
     *
     * <p>The returned future completes exceptionally only when the work fails with an
     * {@link java.lang.Error}.
     *
     * @param operation The operation name for classification and reporting
     * @param work The work producing a completion stage
     * @return a future of Success with the awaited result, or Failure with the classified error
     */
    public <T> CompletableFuture<Outcome<T, E>> callAsync(
            String operation, ThrowingSupplier<? extends CompletionStage<? extends T>, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        CompletionStage<? extends T> stage;
        try {
            stage = Objects.requireNonNull(work.get(), "work returned a null stage");
        } catch (Exception e) {
            return CompletableFuture.completedFuture(handleException(operation, e));
        }

        CompletableFuture<Outcome<T, E>> result = new CompletableFuture<>();
        stage.whenComplete((value, thrown) -> {
            if (thrown == null) {
                result.complete(Outcome.success(value));
                return;
            }
            Throwable cause = unwrap(thrown);
            if (!(cause instanceof Exception e)) {
                result.completeExceptionally(cause);
                return;
            }
            try {
                result.complete(handleException(operation, e));
            } catch (RuntimeException classificationFailure) {
                result.completeExceptionally(classificationFailure);
            }
        });
        return result;
    }

    private <T> Outcome<T, E> handleException(String operation, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        E error = classifier.classify(operation, e);
        reporter.report(operation, e);
        return Outcome.failure(error);
    }

    // CompletableFuture wraps the original exception when it crosses a dependent stage.
    private static Throwable unwrap(Throwable thrown) {
        Throwable current = thrown;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
