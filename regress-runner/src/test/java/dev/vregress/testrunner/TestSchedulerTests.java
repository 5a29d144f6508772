package dev.vregress.testrunner;

import com.google.common.util.concurrent.Uninterruptibles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class TestSchedulerTests {

	@TempDir
	Path tempDir;

	private List<TestCase> suite() {
		var testCases = new ArrayList<TestCase>();
		for(int i = 0; i < 12; ++i) {
			var name = (i % 3 == 0 ? "t_bad_" : "t_good_") + i;
			var labels = i % 4 == 1 ? "dist" : "vlt_all";
			testCases.add(TestCases.testCase(tempDir.resolve("t"), name, labels, StageSpec.of(StageKind.COMPILE), StageSpec.of(StageKind.EXECUTE)));
		}
		return testCases;
	}

	// Tests named t_bad_* fail to execute under every scenario
	private static ScriptedToolchainInvoker failingBadTests() {
		return new ScriptedToolchainInvoker().on(StageKind.EXECUTE, invocation ->
			invocation.workDir().getFileName().toString().startsWith("t_bad_") ? 1 : 0);
	}

	private static Map<String, String> summarize(RunReport report) {
		return report.outcomes().stream().collect(Collectors.toMap(
			TestOutcome::testId,
			outcome -> outcome.outcome() + " " + outcome.classification() + " " + outcome.diagnostic()
		));
	}

	@Test
	public void outcomesDoNotDependOnWorkerCount() {
		var sequential = new TestScheduler(failingBadTests(), TestCases.config(tempDir.resolve("seq")).activeScenarios("vlt", "vltmt").jobs(1).build(), ScenarioCatalog.DEFAULT)
			.run(suite(), List.of());
		var concurrent = new TestScheduler(failingBadTests(), TestCases.config(tempDir.resolve("par")).activeScenarios("vlt", "vltmt").jobs(6).build(), ScenarioCatalog.DEFAULT)
			.run(suite(), List.of());

		Assertions.assertEquals(summarize(sequential), summarize(concurrent));
		Assertions.assertEquals(sequential.counts(), concurrent.counts());
		Assertions.assertEquals(3, concurrent.count(Outcome.FAILED));
		Assertions.assertEquals(3, concurrent.count(Outcome.SKIPPED));
		Assertions.assertEquals(6, concurrent.count(Outcome.PASSED));
		Assertions.assertEquals(1, concurrent.exitStatus());
	}

	@Test
	public void skippedTestsInvokeNothing() {
		var invoker = new ScriptedToolchainInvoker();
		var testCase = TestCases.testCase(tempDir.resolve("t"), "t_dist", "dist", StageSpec.of(StageKind.LINT));

		var report = new TestScheduler(invoker, TestCases.config(tempDir.resolve("work")).jobs(3).build(), ScenarioCatalog.DEFAULT)
			.run(List.of(testCase), List.of());

		Assertions.assertEquals(1, report.count(Outcome.SKIPPED));
		Assertions.assertTrue(invoker.invocations().isEmpty());
		Assertions.assertEquals(0, report.exitStatus());
	}

	@Test
	public void filterSelectsById() {
		var invoker = failingBadTests();
		var config = TestCases.config(tempDir.resolve("work")).filter(Pattern.compile("t_good_(2|4)$")).build();

		var report = new TestScheduler(invoker, config, ScenarioCatalog.DEFAULT).run(suite(), List.of());

		Assertions.assertEquals(List.of("group/t_good_2", "group/t_good_4"), report.outcomes().stream().map(TestOutcome::testId).toList());
		Assertions.assertEquals(0, report.exitStatus());
	}

	@Test
	public void rejectedDeclarationsAreReported() {
		var rejected = TestOutcome.errored("broken/t_no_stage", "invalid declaration", Duration.ZERO);

		var report = new TestScheduler(new ScriptedToolchainInvoker(), TestCases.config(tempDir.resolve("work")).build(), ScenarioCatalog.DEFAULT)
			.run(List.of(), List.of(rejected));

		Assertions.assertEquals(List.of(rejected), report.failures());
		Assertions.assertEquals(1, report.exitStatus());
	}

	@Test
	public void stopOnFailureLeavesRemainingTestsUnrun() {
		var config = TestCases.config(tempDir.resolve("work")).jobs(1).stopOnFailure(true).build();

		var report = new TestScheduler(failingBadTests(), config, ScenarioCatalog.DEFAULT).run(suite(), List.of());

		Assertions.assertTrue(report.cancelled());
		Assertions.assertEquals(1, report.outcomes().size());
		Assertions.assertEquals("group/t_bad_0", report.outcomes().get(0).testId());
		Assertions.assertEquals(11, report.notRun());
		Assertions.assertEquals(1, report.exitStatus());
	}

	@Test
	public void stopOnFailureKeepsCompletedOutcomes() {
		var testDir = tempDir.resolve("t");
		var passing = TestCases.testCase(testDir, "t_good_first", "vlt_all", StageSpec.of(StageKind.COMPILE), StageSpec.of(StageKind.EXECUTE));
		var failing = TestCases.testCase(testDir, "t_bad_second", "vlt_all", StageSpec.of(StageKind.COMPILE), StageSpec.of(StageKind.EXECUTE));
		var config = TestCases.config(tempDir.resolve("work")).jobs(1).stopOnFailure(true).build();

		var report = new TestScheduler(failingBadTests(), config, ScenarioCatalog.DEFAULT).run(List.of(passing, failing), List.of());

		Assertions.assertTrue(report.cancelled());
		Assertions.assertEquals(
			Map.of(
				"group/t_good_first", "PASSED PASS ",
				"group/t_bad_second", "FAILED UNEXPECTED_STAGE_FAILURE group/t_bad_second[vlt]: execute: exit 1: %Error: scripted failure"
			),
			summarize(report)
		);
	}

	@Test
	@Timeout(30)
	public void cancelledTestIsNeverPassed() {
		var started = new CountDownLatch(1);
		var invoker = new ScriptedToolchainInvoker().on(StageKind.EXECUTE, invocation -> {
			started.countDown();
			Thread.sleep(60_000);
			return 0;
		});
		var testCase = TestCases.testCase(tempDir.resolve("t"), "t_hang", "vlt", StageSpec.of(StageKind.COMPILE), StageSpec.of(StageKind.EXECUTE));
		var scheduler = new TestScheduler(invoker, TestCases.config(tempDir.resolve("work")).jobs(2).build(), ScenarioCatalog.DEFAULT);

		var canceller = CompletableFuture.runAsync(() -> {
			Uninterruptibles.awaitUninterruptibly(started);
			scheduler.cancel();
		});
		var report = scheduler.run(List.of(testCase), List.of());
		canceller.join();

		Assertions.assertTrue(report.cancelled());
		Assertions.assertTrue(scheduler.isCancelled());
		Assertions.assertEquals(Outcome.ERRORED, report.outcomes().get(0).outcome());
		Assertions.assertEquals(TestOutcome.CANCELLED, report.outcomes().get(0).diagnostic());
		Assertions.assertEquals(1, invoker.terminations());
		Assertions.assertEquals(1, report.exitStatus());
	}
}
