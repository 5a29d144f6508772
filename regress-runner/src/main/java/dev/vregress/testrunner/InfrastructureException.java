package dev.vregress.testrunner;

/**
 * A fault of the test environment rather than of the toolchain under test: a binary that cannot be
 * started, an unusable filesystem, a missing golden file or an invalid test declaration.
 */
public class InfrastructureException extends Exception {
	public InfrastructureException(String message) {
		super(message);
	}

	public InfrastructureException(String message, Throwable cause) {
		super(message, cause);
	}
}
