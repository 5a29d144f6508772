package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Settings of one regression run. Passed explicitly to every component that needs them.
 *
 * @param toolchain compiler/simulator executable
 * @param buildTool native build tool run in the object directory for build stages
 * @param activeScenarios scenarios selected for this run
 * @param jobs maximum number of test cases running at once
 * @param stageTimeout limit for any single stage
 * @param workRoot directory under which every scenario run gets its own object directory
 * @param keepWorkDirs keep object directories of passing runs
 * @param updateGolden overwrite golden files with produced artifacts instead of failing
 * @param stopOnFailure cancel the run after the first failed or errored test case
 * @param outputDirFlag toolchain flag naming the object directory
 * @param lintModeFlags toolchain flags selecting analysis-only mode
 * @param compileModeFlags toolchain flags selecting compilation, unless a compile stage gives its own
 * @param filter only test ids matching this pattern run
 */
public record RunConfiguration(
	Path toolchain,
	String buildTool,
	ImmutableSet<String> activeScenarios,
	int jobs,
	Duration stageTimeout,
	Path workRoot,
	boolean keepWorkDirs,
	boolean updateGolden,
	boolean stopOnFailure,
	String outputDirFlag,
	ImmutableList<String> lintModeFlags,
	ImmutableList<String> compileModeFlags,
	@Nullable Pattern filter
) {
	public static final Duration DEFAULT_STAGE_TIMEOUT = Duration.ofMinutes(5);

	public RunConfiguration {
		if(jobs < 1) {
			throw new IllegalArgumentException("jobs must be at least 1: " + jobs);
		}
		if(stageTimeout.isNegative() || stageTimeout.isZero()) {
			throw new IllegalArgumentException("stage timeout must be positive: " + stageTimeout);
		}
	}

	public boolean selects(TestCase testCase) {
		return filter == null || filter.matcher(testCase.id()).find();
	}

	public static int defaultJobs() {
		return Runtime.getRuntime().availableProcessors();
	}

	public static Builder builder(Path toolchain, Path workRoot) {
		return new Builder(toolchain, workRoot);
	}

	public static final class Builder {
		private Builder(Path toolchain, Path workRoot) {
			this.toolchain = toolchain;
			this.workRoot = workRoot;
		}

		private final Path toolchain;
		private final Path workRoot;
		private String buildTool = "make";
		private ImmutableSet<String> activeScenarios = ImmutableSet.of("vlt");
		private int jobs = defaultJobs();
		private Duration stageTimeout = DEFAULT_STAGE_TIMEOUT;
		private boolean keepWorkDirs = false;
		private boolean updateGolden = false;
		private boolean stopOnFailure = false;
		private String outputDirFlag = "--Mdir";
		private ImmutableList<String> lintModeFlags = ImmutableList.of("--lint-only");
		private ImmutableList<String> compileModeFlags = ImmutableList.of("--binary");
		private @Nullable Pattern filter = null;

		public Builder buildTool(String buildTool) {
			this.buildTool = buildTool;
			return this;
		}

		public Builder activeScenarios(String... scenarios) {
			return activeScenarios(ImmutableSet.copyOf(scenarios));
		}

		public Builder activeScenarios(ImmutableSet<String> scenarios) {
			this.activeScenarios = scenarios;
			return this;
		}

		public Builder jobs(int jobs) {
			this.jobs = jobs;
			return this;
		}

		public Builder stageTimeout(Duration stageTimeout) {
			this.stageTimeout = stageTimeout;
			return this;
		}

		public Builder keepWorkDirs(boolean keepWorkDirs) {
			this.keepWorkDirs = keepWorkDirs;
			return this;
		}

		public Builder updateGolden(boolean updateGolden) {
			this.updateGolden = updateGolden;
			return this;
		}

		public Builder stopOnFailure(boolean stopOnFailure) {
			this.stopOnFailure = stopOnFailure;
			return this;
		}

		public Builder outputDirFlag(String outputDirFlag) {
			this.outputDirFlag = outputDirFlag;
			return this;
		}

		public Builder lintModeFlags(String... flags) {
			this.lintModeFlags = ImmutableList.copyOf(flags);
			return this;
		}

		public Builder compileModeFlags(String... flags) {
			this.compileModeFlags = ImmutableList.copyOf(flags);
			return this;
		}

		public Builder filter(@Nullable Pattern filter) {
			this.filter = filter;
			return this;
		}

		public RunConfiguration build() {
			return new RunConfiguration(
				toolchain,
				buildTool,
				activeScenarios,
				jobs,
				stageTimeout,
				workRoot,
				keepWorkDirs,
				updateGolden,
				stopOnFailure,
				outputDirFlag,
				lintModeFlags,
				compileModeFlags,
				filter
			);
		}
	}
}
