package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;

import java.time.Duration;

/**
 * Final verdict for one test case.
 *
 * @param classification for a failed or errored test, the classification of the run that decided it
 * @param diagnostic the deciding run's explanation, empty for a plain pass
 */
public record TestOutcome(
	String testId,
	Outcome outcome,
	Classification classification,
	String diagnostic,
	ImmutableList<ScenarioRunResult> runs,
	Duration duration
) {
	public static final String CANCELLED = "run cancelled before the test case completed";

	public static TestOutcome skipped(String testId, String reason) {
		return new TestOutcome(testId, Outcome.SKIPPED, Classification.SKIP, reason, ImmutableList.of(), Duration.ZERO);
	}

	public static TestOutcome errored(String testId, String message, Duration duration) {
		return new TestOutcome(testId, Outcome.ERRORED, Classification.INFRASTRUCTURE_ERROR, message, ImmutableList.of(), duration);
	}

	public static TestOutcome cancelled(String testId, Duration duration) {
		return errored(testId, CANCELLED, duration);
	}
}
