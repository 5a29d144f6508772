package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

/**
 * @param pipeline stage results, or {@code null} if the pipeline could not run at all
 */
public record ScenarioRunResult(
	ScenarioRun run,
	@Nullable PipelineResult pipeline,
	ImmutableList<ComparisonResult> comparisons,
	Classification classification,
	String diagnostic
) {
	public Outcome outcome() {
		return classification.outcome();
	}
}
