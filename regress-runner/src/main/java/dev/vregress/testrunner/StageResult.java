package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.nio.file.Path;
import java.time.Duration;

/**
 * @param logFile combined stdout and stderr of the stage
 * @param artifacts files created or modified in the working directory by the stage
 */
public record StageResult(
	StageKind stage,
	ImmutableList<String> command,
	int exitCode,
	String stdout,
	String stderr,
	Duration duration,
	boolean timedOut,
	StageStatus status,
	Path logFile,
	ImmutableSet<Path> artifacts
) {
	public String describe() {
		var name = stage.stageId();
		return switch(status) {
			case SUCCEEDED -> name + ": succeeded";
			case EXPECTED_FAILURE -> name + ": failed as expected (exit " + exitCode + ")";
			case FAILED -> name + ": exit " + exitCode + firstErrorLine();
			case UNEXPECTED_SUCCESS -> name + ": exit 0 but failure was expected";
			case TIMED_OUT -> name + ": timed out after " + duration.toSeconds() + "s";
		};
	}

	// The first toolchain error message is usually the most useful line of a failure
	private String firstErrorLine() {
		var lines = (stderr + "\n" + stdout).lines()
			.map(String::strip)
			.filter(line -> !line.isEmpty())
			.toList();

		var line = lines.stream()
			.filter(l -> l.startsWith("%Error") || l.contains("error:"))
			.findFirst()
			.or(() -> lines.stream().findFirst());

		return line.map(l -> ": " + l).orElse("");
	}
}
