package org.javai.result.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.result.Outcome;
import org.javai.result.boundary.Boundary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Log4jCaptureReporterTest {

	private CapturingAppender appender;
	private Logger logger;

	@BeforeEach
	void setUp() {
		appender = new CapturingAppender();
		appender.start();
		logger = (Logger) LogManager.getLogger("org.javai.result.test.capture");
		logger.addAppender(appender);
		logger.setLevel(Level.ALL);
	}

	@AfterEach
	void tearDown() {
		logger.removeAppender(appender);
		appender.stop();
	}

	@Test
	void report_logsCapturedExceptionWithMarkerAndThrowable() {
		IOException cause = new IOException("disk full");

		new Log4jCaptureReporter(logger, Level.WARN).report("Files.write", cause);

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker().getName()).isEqualTo("CAPTURE");
		assertThat(event.getThrown()).isSameAs(cause);
		assertThat(event.getMessage().getFormattedMessage())
				.contains("java.io.IOException")
				.contains("[Files.write]")
				.contains("disk full");
	}

	@Test
	void report_respectsConfiguredLevel() {
		logger.setLevel(Level.INFO);

		new Log4jCaptureReporter(logger, Level.DEBUG).report("Op", new IOException("hidden"));
		new Log4jCaptureReporter(logger, Level.ERROR).report("Op", new IOException("shown"));

		assertThat(appender.events).hasSize(1);
		assertThat(appender.events.get(0).getLevel()).isEqualTo(Level.ERROR);
	}

	@Test
	void boundary_reportsThroughLog4j() {
		Boundary<Exception> boundary = Boundary.withReporter(new Log4jCaptureReporter(logger, Level.DEBUG));

		Outcome<String, Exception> result = boundary.call("Config.load", () -> {
			throw new IOException("missing file");
		});

		assertThat(result.isFailure()).isTrue();
		assertThat(appender.events).hasSize(1);
		assertThat(appender.events.get(0).getMessage().getFormattedMessage()).contains("[Config.load]");
	}

	@Test
	void constructor_rejectsNulls() {
		assertThatThrownBy(() -> new Log4jCaptureReporter(logger, null))
				.isInstanceOf(NullPointerException.class);
	}

	private static final class CapturingAppender extends AbstractAppender {

		private final List<LogEvent> events = new ArrayList<>();

		CapturingAppender() {
			super("capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
