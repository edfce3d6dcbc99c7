package org.javai.result.ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link CaptureReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * CaptureReporter reporter = CompositeCaptureReporter.of(
 *     new Log4jCaptureReporter(),
 *     capturedCounter::record
 * );
 *
 * // Or using the builder for more control:
 * CaptureReporter reporter = CompositeCaptureReporter.builder()
 *     .add(new Log4jCaptureReporter())
 *     .addIf(auditEnabled, auditReporter)
 *     .build();
 * }</pre>
 */
public final class CompositeCaptureReporter implements CaptureReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeCaptureReporter.class);

	private final List<CaptureReporter> reporters;

	private CompositeCaptureReporter(List<CaptureReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeCaptureReporter of(CaptureReporter... reporters) {
		return new CompositeCaptureReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeCaptureReporter of(Collection<? extends CaptureReporter> reporters) {
		return new CompositeCaptureReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(String operation, Exception exception) {
		for (CaptureReporter reporter : reporters) {
			try {
				reporter.report(operation, exception);
			} catch (RuntimeException e) {
				LOG.warn("CaptureReporter {} failed while reporting operation [{}]",
						reporter.getClass().getName(), operation, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	/**
	 * Builder for creating a {@link CompositeCaptureReporter}.
	 */
	public static final class Builder {
		private final List<CaptureReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null reporters are ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(CaptureReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends CaptureReporter> reporters) {
			for (CaptureReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, CaptureReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeCaptureReporter build() {
			return new CompositeCaptureReporter(reporters);
		}
	}
}
