package dev.vregress.testrunner;

public enum PipelineState {
	PENDING,
	LINTING,
	COMPILING,
	EXECUTING,
	DONE,
	ABORTED,
	;

	public boolean isTerminal() {
		return this == DONE || this == ABORTED;
	}

	static PipelineState forStage(StageKind stage) {
		return switch(stage) {
			case LINT -> LINTING;
			case COMPILE, BUILD -> COMPILING;
			case EXECUTE -> EXECUTING;
		};
	}
}
