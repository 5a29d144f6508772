package dev.vregress.testrunner;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs test cases on a bounded pool of workers, one task per test case. Outcomes do not depend on
 * the number of workers or the order in which test cases finish.
 */
public final class TestScheduler {

	private static final Logger log = LoggerFactory.getLogger(TestScheduler.class);

	public TestScheduler(ToolchainInvoker invoker, RunConfiguration config, ScenarioCatalog catalog) {
		this.stages = new TrackingToolchainInvoker(invoker);
		this.config = config;
		this.resolver = new ScenarioResolver(catalog);
		this.sequencer = new PipelineSequencer(stages, config);
		this.comparator = new ArtifactComparator(config);
	}

	private final TrackingToolchainInvoker stages;
	private final RunConfiguration config;
	private final ScenarioResolver resolver;
	private final PipelineSequencer sequencer;
	private final ArtifactComparator comparator;

	private final ResultAggregator aggregator = new ResultAggregator();
	private final AtomicBoolean cancelled = new AtomicBoolean();
	private final AtomicInteger started = new AtomicInteger();
	private volatile @Nullable ExecutorService executor;

	/**
	 * Runs the selected test cases and waits for all of them.
	 *
	 * @param preRecorded outcomes decided before scheduling, such as rejected declarations
	 */
	public RunReport run(List<TestCase> testCases, List<TestOutcome> preRecorded) {
		preRecorded.forEach(aggregator::record);

		var selected = testCases.stream()
			.filter(config::selects)
			.toList();

		log.info("Running {} test cases with {} workers", selected.size(), config.jobs());

		var pool = Executors.newFixedThreadPool(
			config.jobs(),
			new ThreadFactoryBuilder()
				.setNameFormat("regress-worker-%d")
				.setDaemon(true)
				.build()
		);
		executor = pool;

		try {
			for(var testCase : selected) {
				if(cancelled.get()) {
					break;
				}
				pool.submit(() -> runTestCase(testCase));
			}
		}
		catch(RejectedExecutionException e) {
			log.debug("Dispatch stopped: {}", e.getMessage());
		}

		pool.shutdown();
		boolean interrupted = false;
		while(true) {
			try {
				if(pool.awaitTermination(1, TimeUnit.SECONDS)) {
					break;
				}
			}
			catch(InterruptedException e) {
				interrupted = true;
				cancel();
				Uninterruptibles.awaitTerminationUninterruptibly(pool);
				break;
			}
		}

		var report = aggregator.report(selected.size() - started.get(), cancelled.get());
		if(interrupted) {
			Thread.currentThread().interrupt();
		}
		return report;
	}

	/**
	 * Stops dispatching, terminates running toolchain processes and interrupts the workers.
	 * Test cases that were in flight end up ERRORED.
	 */
	public void cancel() {
		if(!cancelled.compareAndSet(false, true)) {
			return;
		}

		log.warn("Cancelling regression run");
		stages.cancelStages();
		var pool = executor;
		if(pool != null) {
			pool.shutdownNow();
		}
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	private void runTestCase(TestCase testCase) {
		if(cancelled.get()) {
			return;
		}
		started.incrementAndGet();
		stages.beginTask();

		long start = System.nanoTime();
		TestOutcome outcome;
		try {
			outcome = new TestCaseController(testCase, resolver, sequencer, comparator, config).run();

			// A stage killed by cancellation must not count as a failure or expected failure
			if(stages.taskCutShort() && outcome.outcome() != Outcome.SKIPPED) {
				outcome = TestOutcome.cancelled(testCase.id(), outcome.duration());
			}
		}
		catch(InterruptedException e) {
			outcome = TestOutcome.cancelled(testCase.id(), Duration.ofNanos(System.nanoTime() - start));
		}
		catch(RuntimeException e) {
			log.error("Unexpected error running {}", testCase.id(), e);
			outcome = TestOutcome.errored(testCase.id(), "internal error: " + e, Duration.ofNanos(System.nanoTime() - start));
		}

		aggregator.record(outcome);

		if(config.stopOnFailure() && outcome.outcome().isFailure() && !cancelled.get()) {
			log.warn("Stopping after {} {}", outcome.testId(), outcome.outcome());
			cancel();
		}
	}
}
