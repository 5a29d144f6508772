package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

public class RunReportTests {

	private static TestOutcome outcome(String id, Outcome outcome, Classification classification, String diagnostic) {
		return new TestOutcome(id, outcome, classification, diagnostic, ImmutableList.of(), Duration.ZERO);
	}

	@Test
	public void countsAndSortsFailures() {
		var report = RunReport.of(List.of(
			outcome("b/t_two", Outcome.FAILED, Classification.ASSERTION_MISMATCH, "b/t_two[vlt]: mismatch"),
			outcome("a/t_one", Outcome.PASSED, Classification.PASS, ""),
			TestOutcome.skipped("c/t_skip", "dist only"),
			outcome("a/t_zero", Outcome.ERRORED, Classification.INFRASTRUCTURE_ERROR, "a/t_zero[vlt]: golden file not found")
		), 0, false);

		Assertions.assertEquals(1, report.count(Outcome.PASSED));
		Assertions.assertEquals(1, report.count(Outcome.FAILED));
		Assertions.assertEquals(1, report.count(Outcome.ERRORED));
		Assertions.assertEquals(1, report.count(Outcome.SKIPPED));
		Assertions.assertEquals(List.of("a/t_zero", "b/t_two"), report.failures().stream().map(TestOutcome::testId).toList());
		Assertions.assertEquals(1, report.exitStatus());
	}

	@Test
	public void passedAndSkippedExitZero() {
		var report = RunReport.of(List.of(
			outcome("t_one", Outcome.PASSED, Classification.EXPECTED_FAILURE, ""),
			TestOutcome.skipped("t_two", "no scenario")
		), 0, false);

		Assertions.assertEquals(0, report.exitStatus());
	}

	@Test
	public void cancelledRunExitsNonzero() {
		var report = RunReport.of(List.of(outcome("t_one", Outcome.PASSED, Classification.PASS, "")), 3, true);

		Assertions.assertEquals(1, report.exitStatus());
		Assertions.assertEquals(4, report.total());
	}

	@Test
	public void printsFailuresAndSummary() {
		var report = RunReport.of(List.of(
			outcome("t_bad", Outcome.FAILED, Classification.UNEXPECTED_STAGE_FAILURE, "t_bad[vlt]: compile: exit 1"),
			outcome("t_good", Outcome.PASSED, Classification.PASS, "")
		), 1, true);

		var buffer = new ByteArrayOutputStream();
		report.print(new PrintStream(buffer, true, StandardCharsets.UTF_8));

		Assertions.assertEquals(
			"FAILED t_bad [UNEXPECTED_STAGE_FAILURE]: t_bad[vlt]: compile: exit 1\n"
				+ "Finished running 3 test cases: 1 passed, 1 failed, 0 errored, 0 skipped, 1 not run (cancelled)\n",
			buffer.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n")
		);
	}
}
