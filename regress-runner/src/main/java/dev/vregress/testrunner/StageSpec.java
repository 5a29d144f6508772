package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

/**
 * One declared pipeline stage.
 *
 * @param flags extra toolchain flags, or program arguments for the execute stage
 * @param modeFlags replaces the run's lint or compile mode flags when set
 * @param expectFile golden file the stage log is compared against, if any
 * @param executable program to run for the execute stage; defaults to the toolchain's output binary
 */
public record StageSpec(
	StageKind kind,
	Expectation expectation,
	ImmutableList<String> flags,
	@Nullable ImmutableList<String> modeFlags,
	@Nullable String expectFile,
	@Nullable String executable
) {
	public static StageSpec of(StageKind kind) {
		return new StageSpec(kind, Expectation.SUCCEED, ImmutableList.of(), null, null, null);
	}

	public static StageSpec failing(StageKind kind) {
		return new StageSpec(kind, Expectation.FAIL, ImmutableList.of(), null, null, null);
	}

	public StageSpec withFlags(String... flags) {
		return new StageSpec(kind, expectation, ImmutableList.copyOf(flags), modeFlags, expectFile, executable);
	}

	public StageSpec withExpectFile(String expectFile) {
		return new StageSpec(kind, expectation, flags, modeFlags, expectFile, executable);
	}

	public boolean expectsFailure() {
		return expectation == Expectation.FAIL;
	}
}
