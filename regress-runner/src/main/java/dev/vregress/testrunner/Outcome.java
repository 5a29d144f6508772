package dev.vregress.testrunner;

public enum Outcome {
	PASSED,
	FAILED,
	SKIPPED,
	ERRORED,
	;

	public boolean isFailure() {
		return this == FAILED || this == ERRORED;
	}
}
