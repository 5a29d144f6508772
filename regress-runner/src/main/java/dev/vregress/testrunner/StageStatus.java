package dev.vregress.testrunner;

public enum StageStatus {
	SUCCEEDED,
	EXPECTED_FAILURE,
	FAILED,
	UNEXPECTED_SUCCESS,
	TIMED_OUT,
	;

	/**
	 * Applies the stage's declared expectation to its exit status. A timeout never satisfies an expected failure.
	 */
	public static StageStatus classify(int exitCode, boolean timedOut, Expectation expectation) {
		if(timedOut) {
			return TIMED_OUT;
		}

		return switch(expectation) {
			case SUCCEED -> exitCode == 0 ? SUCCEEDED : FAILED;
			case FAIL -> exitCode == 0 ? UNEXPECTED_SUCCESS : EXPECTED_FAILURE;
		};
	}

	public boolean allowsNextStage() {
		return this == SUCCEEDED;
	}

	public boolean isUnexpected() {
		return this == FAILED || this == UNEXPECTED_SUCCESS || this == TIMED_OUT;
	}
}
