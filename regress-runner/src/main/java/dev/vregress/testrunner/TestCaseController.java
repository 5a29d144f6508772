package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import org.apache.commons.io.file.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every scenario run of one test case in order and folds them into a single outcome.
 * The first run that does not pass ends the test case.
 */
public final class TestCaseController {

	private static final Logger log = LoggerFactory.getLogger(TestCaseController.class);

	public TestCaseController(TestCase testCase, ScenarioResolver resolver, PipelineSequencer sequencer, ArtifactComparator comparator, RunConfiguration config) {
		this.testCase = testCase;
		this.resolver = resolver;
		this.sequencer = sequencer;
		this.comparator = comparator;
		this.config = config;
	}

	private final TestCase testCase;
	private final ScenarioResolver resolver;
	private final PipelineSequencer sequencer;
	private final ArtifactComparator comparator;
	private final RunConfiguration config;

	private volatile ControllerState state = ControllerState.NOT_STARTED;

	public ControllerState state() {
		return state;
	}

	public TestOutcome run() throws InterruptedException {
		if(state != ControllerState.NOT_STARTED) {
			throw new IllegalStateException(testCase.id() + " already " + state);
		}
		state = ControllerState.RUNNING;

		var outcome = runTestCase();
		state = ControllerState.of(outcome.outcome());
		log.info("{}: {}{}", outcome.testId(), outcome.outcome(), outcome.diagnostic().isEmpty() ? "" : " (" + outcome.diagnostic() + ")");
		return outcome;
	}

	private TestOutcome runTestCase() throws InterruptedException {
		long start = System.nanoTime();

		ScenarioResolver.Resolution resolution;
		try {
			resolution = resolver.resolve(testCase, config);
		}
		catch(InfrastructureException e) {
			return TestOutcome.errored(testCase.id(), e.getMessage(), Duration.ZERO);
		}

		if(resolution.skipped()) {
			return TestOutcome.skipped(testCase.id(), resolution.skipReason());
		}

		var results = new ArrayList<ScenarioRunResult>();
		for(var run : resolution.runs()) {
			var result = runScenario(run);
			results.add(result);
			if(result.outcome() != Outcome.PASSED) {
				break;
			}
		}

		return fold(testCase.id(), results, Duration.ofNanos(System.nanoTime() - start));
	}

	/**
	 * ERRORED if any run hit an infrastructure error, otherwise FAILED if any run failed, otherwise PASSED.
	 */
	static TestOutcome fold(String testId, List<ScenarioRunResult> results, Duration duration) {
		var deciding = results.stream()
			.filter(result -> result.outcome() == Outcome.ERRORED)
			.findFirst()
			.or(() -> results.stream().filter(result -> result.outcome() == Outcome.FAILED).findFirst());

		if(deciding.isPresent()) {
			var result = deciding.get();
			return new TestOutcome(
				testId,
				result.outcome(),
				result.classification(),
				result.run().id() + ": " + result.diagnostic(),
				ImmutableList.copyOf(results),
				duration
			);
		}

		boolean allExpectedFailures = !results.isEmpty() && results.stream()
			.allMatch(result -> result.classification() == Classification.EXPECTED_FAILURE);

		return new TestOutcome(
			testId,
			Outcome.PASSED,
			allExpectedFailures ? Classification.EXPECTED_FAILURE : Classification.PASS,
			"",
			ImmutableList.copyOf(results),
			duration
		);
	}

	private ScenarioRunResult runScenario(ScenarioRun run) throws InterruptedException {
		log.debug("Starting {} in {}", run.id(), run.objDir());
		try {
			prepareObjDir(run.objDir());
		}
		catch(IOException e) {
			return new ScenarioRunResult(run, null, ImmutableList.of(), Classification.INFRASTRUCTURE_ERROR, "cannot prepare " + run.objDir() + ": " + e.getMessage());
		}

		PipelineResult pipeline;
		try {
			pipeline = sequencer.run(run);
		}
		catch(InfrastructureException e) {
			return new ScenarioRunResult(run, null, ImmutableList.of(), Classification.INFRASTRUCTURE_ERROR, e.getMessage());
		}

		if(!pipeline.completed()) {
			var failure = pipeline.failedStage()
				.map(StageResult::describe)
				.orElse("pipeline aborted");
			return new ScenarioRunResult(run, pipeline, ImmutableList.of(), Classification.UNEXPECTED_STAGE_FAILURE, failure);
		}

		var template = PathTemplate.forRun(run);
		var comparisons = new ArrayList<ComparisonResult>();
		for(var assertion : assertionsFor(run, pipeline)) {
			var comparison = comparator.compare(assertion, template);
			comparisons.add(comparison);
			if(!comparison.passed()) {
				return new ScenarioRunResult(run, pipeline, ImmutableList.copyOf(comparisons), comparison.classification(), comparison.describe());
			}
		}

		var classification = pipeline.endedByExpectedFailure() ? Classification.EXPECTED_FAILURE : Classification.PASS;
		var diagnostic = pipeline.lastStage()
			.filter(stage -> stage.status() == StageStatus.EXPECTED_FAILURE)
			.map(StageResult::describe)
			.orElse("");

		if(!config.keepWorkDirs()) {
			removeObjDir(run.objDir());
		}

		return new ScenarioRunResult(run, pipeline, ImmutableList.copyOf(comparisons), classification, diagnostic);
	}

	// Stage logs with a declared expect file come first, then the declared assertions
	private ImmutableList<Assertion> assertionsFor(ScenarioRun run, PipelineResult pipeline) {
		var assertions = ImmutableList.<Assertion>builder();
		for(var stageResult : pipeline.stages()) {
			run.testCase().stage(stageResult.stage())
				.filter(stage -> stage.expectFile() != null)
				.ifPresent(stage -> assertions.add(new Assertion.TextIdentical(stageResult.logFile().toString(), stage.expectFile())));
		}
		assertions.addAll(run.testCase().assertions());
		return assertions.build();
	}

	private static void prepareObjDir(Path objDir) throws IOException {
		if(Files.exists(objDir)) {
			PathUtils.deleteDirectory(objDir);
		}
		Files.createDirectories(objDir);
	}

	private static void removeObjDir(Path objDir) {
		try {
			PathUtils.deleteDirectory(objDir);
		}
		catch(IOException e) {
			log.warn("Could not remove {}: {}", objDir, e.getMessage());
		}
	}
}
