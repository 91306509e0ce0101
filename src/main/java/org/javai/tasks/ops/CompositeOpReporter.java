package org.javai.tasks.ops;

import org.javai.tasks.Failure;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>Every reporter receives every call. A reporter that throws is skipped and the
 * error is written to stderr, so one broken reporter cannot silence the others or
 * disturb the retry loop.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("checkout"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Failure failure) {
		forEach("report", reporter -> reporter.report(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		forEach("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(failure, attemptNumber, delay));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		forEach("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(failure, totalAttempts));
	}

	@Override
	public void reportCancelled(Failure failure, int totalAttempts) {
		forEach("reportCancelled", reporter -> reporter.reportCancelled(failure, totalAttempts));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void forEach(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				System.err.println("OpReporter." + method + " failed for " +
					reporter.getClass().getName() + ": " + e.getMessage());
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter; null is ignored.
		 */
		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
