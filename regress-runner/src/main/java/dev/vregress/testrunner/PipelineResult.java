package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * @param finalState {@link PipelineState#DONE} or {@link PipelineState#ABORTED}
 * @param stages results of the stages that ran, in order
 */
public record PipelineResult(
	PipelineState finalState,
	ImmutableList<StageResult> stages
) {
	public PipelineResult {
		if(!finalState.isTerminal()) {
			throw new IllegalArgumentException("pipeline result in non-terminal state " + finalState);
		}
	}

	public boolean completed() {
		return finalState == PipelineState.DONE;
	}

	public Optional<StageResult> lastStage() {
		return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1));
	}

	/**
	 * True when the pipeline ended early because a stage failed as declared.
	 */
	public boolean endedByExpectedFailure() {
		return lastStage().map(stage -> stage.status() == StageStatus.EXPECTED_FAILURE).orElse(false);
	}

	public Optional<StageResult> failedStage() {
		return stages.stream()
			.filter(stage -> stage.status().isUnexpected())
			.findFirst();
	}
}
