package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.time.Duration;

/**
 * A fully materialized subprocess call for one stage.
 */
public record Invocation(
	StageKind stage,
	ImmutableList<String> command,
	Path workDir,
	Duration timeout,
	Expectation expectation
) {
	public Invocation {
		if(command.isEmpty()) {
			throw new IllegalArgumentException("empty command for stage " + stage.stageId());
		}
	}
}
