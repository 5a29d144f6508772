package dev.vregress.testrunner;

/**
 * Runs the external toolchain, or a program it produced, for one pipeline stage.
 */
public interface ToolchainInvoker extends AutoCloseable {
	StageResult invoke(Invocation invocation) throws InfrastructureException, InterruptedException;

	/**
	 * Sends a termination signal to every subprocess that is still running.
	 */
	void terminateAll();

	@Override
	default void close() {
		terminateAll();
	}
}
