package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;

/**
 * Summary of a whole regression run.
 *
 * @param outcomes every recorded outcome, sorted by test id
 * @param notRun test cases never started because the run was cancelled
 */
public record RunReport(
	ImmutableList<TestOutcome> outcomes,
	ImmutableMap<Outcome, Integer> counts,
	int notRun,
	boolean cancelled
) {
	public static RunReport of(List<TestOutcome> outcomes, int notRun, boolean cancelled) {
		var sorted = outcomes.stream()
			.sorted(Comparator.comparing(TestOutcome::testId))
			.collect(ImmutableList.toImmutableList());

		var counts = new EnumMap<Outcome, Integer>(Outcome.class);
		for(var outcome : Outcome.values()) {
			counts.put(outcome, 0);
		}
		for(var outcome : sorted) {
			counts.merge(outcome.outcome(), 1, Integer::sum);
		}

		return new RunReport(sorted, Maps.immutableEnumMap(counts), notRun, cancelled);
	}

	public int count(Outcome outcome) {
		return counts.getOrDefault(outcome, 0);
	}

	public int total() {
		return outcomes.size() + notRun;
	}

	/**
	 * Failed and errored test cases, by id.
	 */
	public ImmutableList<TestOutcome> failures() {
		return outcomes.stream()
			.filter(outcome -> outcome.outcome().isFailure())
			.collect(ImmutableList.toImmutableList());
	}

	public int exitStatus() {
		return failures().isEmpty() && !cancelled ? 0 : 1;
	}

	public void print(PrintStream out) {
		for(var failure : failures()) {
			out.println(failure.outcome() + " " + failure.testId() + " [" + failure.classification() + "]: " + failure.diagnostic());
		}

		out.println(
			"Finished running " + total() + " test cases: "
				+ count(Outcome.PASSED) + " passed, "
				+ count(Outcome.FAILED) + " failed, "
				+ count(Outcome.ERRORED) + " errored, "
				+ count(Outcome.SKIPPED) + " skipped"
				+ (notRun > 0 ? ", " + notRun + " not run" : "")
				+ (cancelled ? " (cancelled)" : "")
		);
	}
}
