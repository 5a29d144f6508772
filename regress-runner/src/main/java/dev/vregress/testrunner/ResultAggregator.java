package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collects test outcomes from all workers.
 */
public final class ResultAggregator {

	private final ReentrantLock lock = new ReentrantLock();
	private final List<TestOutcome> outcomes = new ArrayList<>();

	public void record(TestOutcome outcome) {
		lock.lock();
		try {
			outcomes.add(outcome);
		}
		finally {
			lock.unlock();
		}
	}

	public ImmutableList<TestOutcome> outcomes() {
		lock.lock();
		try {
			return ImmutableList.copyOf(outcomes);
		}
		finally {
			lock.unlock();
		}
	}

	public RunReport report(int notRun, boolean cancelled) {
		return RunReport.of(outcomes(), notRun, cancelled);
	}
}
