package dev.vregress.testrunner;

/**
 * Why a scenario run or test case ended the way it did.
 */
public enum Classification {
	PASS(Outcome.PASSED),
	SKIP(Outcome.SKIPPED),
	// A stage failed as declared; counts as a pass
	EXPECTED_FAILURE(Outcome.PASSED),
	UNEXPECTED_STAGE_FAILURE(Outcome.FAILED),
	ASSERTION_MISMATCH(Outcome.FAILED),
	INFRASTRUCTURE_ERROR(Outcome.ERRORED),
	;

	Classification(Outcome outcome) {
		this.outcome = outcome;
	}

	private final Outcome outcome;

	public Outcome outcome() {
		return outcome;
	}
}
