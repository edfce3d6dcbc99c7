package org.javai.result.ops.log4j;

import java.util.Objects;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.result.ops.CaptureReporter;

/**
 * Reports captured exceptions using Log4j2.
 *
 * <p>Every entry carries the {@code CAPTURE} marker so captured exceptions can be routed or
 * filtered separately from the application's own logging. Entries are written at
 * {@code DEBUG} unless another level is configured: a captured exception has already been
 * turned into a failed outcome and is normally handled by the caller.
 */
public class Log4jCaptureReporter implements CaptureReporter {

	static final String DEFAULT_LOGGER_NAME = "org.javai.result.CaptureReporter";

	private static final Marker CAPTURE_MARKER = MarkerManager.getMarker("CAPTURE");

	private final Logger logger;
	private final Level level;

	/**
	 * Creates a Log4jCaptureReporter using the default logger name, logging at DEBUG.
	 */
	public Log4jCaptureReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME), Level.DEBUG);
	}

	/**
	 * Creates a Log4jCaptureReporter with a custom logger name and level.
	 *
	 * @param loggerName the logger name
	 * @param level the level captured exceptions are logged at
	 */
	public Log4jCaptureReporter(String loggerName, Level level) {
		this(LogManager.getLogger(loggerName), level);
	}

	/**
	 * Creates a Log4jCaptureReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 * @param level the level captured exceptions are logged at
	 */
	public Log4jCaptureReporter(Logger logger, Level level) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		this.level = Objects.requireNonNull(level, "level must not be null");
	}

	@Override
	public void report(String operation, Exception exception) {
		logger.atLevel(level)
			.withMarker(CAPTURE_MARKER)
			.withThrowable(exception)
			.log("Captured {} in operation [{}]: {}",
				exception.getClass().getName(),
				operation,
				exception.getMessage());
	}
}
