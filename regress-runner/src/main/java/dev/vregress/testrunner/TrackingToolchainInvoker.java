package dev.vregress.testrunner;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which worker threads had a stage cut short by cancellation. A stage counts as cut
 * short if it was running when the run was cancelled or started afterwards.
 */
final class TrackingToolchainInvoker implements ToolchainInvoker {

	TrackingToolchainInvoker(ToolchainInvoker delegate) {
		this.delegate = delegate;
	}

	private final ToolchainInvoker delegate;
	private final Set<Thread> inStage = ConcurrentHashMap.newKeySet();
	private final Set<Thread> cutShort = ConcurrentHashMap.newKeySet();
	private volatile boolean cancelled = false;

	@Override
	public StageResult invoke(Invocation invocation) throws InfrastructureException, InterruptedException {
		var thread = Thread.currentThread();
		inStage.add(thread);
		try {
			if(cancelled) {
				cutShort.add(thread);
			}
			return delegate.invoke(invocation);
		}
		finally {
			inStage.remove(thread);
		}
	}

	@Override
	public void terminateAll() {
		delegate.terminateAll();
	}

	// Marks running stages before signalling them, so every killed stage is recorded
	void cancelStages() {
		cancelled = true;
		cutShort.addAll(inStage);
		delegate.terminateAll();
	}

	void beginTask() {
		cutShort.remove(Thread.currentThread());
	}

	boolean taskCutShort() {
		return cutShort.contains(Thread.currentThread());
	}
}
