package dev.vregress.testrunner;

public enum ControllerState {
	NOT_STARTED,
	RUNNING,
	PASSED,
	FAILED,
	SKIPPED,
	ERRORED,
	;

	static ControllerState of(Outcome outcome) {
		return switch(outcome) {
			case PASSED -> PASSED;
			case FAILED -> FAILED;
			case SKIPPED -> SKIPPED;
			case ERRORED -> ERRORED;
		};
	}
}
