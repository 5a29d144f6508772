package dev.vregress.testrunner;

import com.beust.jcommander.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

class TestRunnerArgs {

	@Parameter(names = { "-h", "--help" }, help = true)
	public boolean help = false;

	@Parameter(required = true, description = "Test roots")
	public List<Path> testRoots;

	@Parameter(names = { "--toolchain" }, description = "Compiler/simulator executable")
	public Path toolchain = Path.of("verilator");

	@Parameter(names = { "--build-tool" }, description = "Build tool run in the object directory")
	public String buildTool = "make";

	@Parameter(names = { "--scenario" }, description = "Active scenario (repeatable)", validateValueWith = ScenarioValueValidator.class)
	public List<String> scenarios = List.of("vlt");

	@Parameter(names = { "-j", "--jobs" }, description = "Number of test cases run at once", validateWith = PositiveInteger.class)
	public int jobs = RunConfiguration.defaultJobs();

	@Parameter(names = { "--timeout" }, description = "Timeout for a single stage in seconds", validateWith = PositiveInteger.class)
	public int timeoutSeconds = (int)RunConfiguration.DEFAULT_STAGE_TIMEOUT.toSeconds();

	@Parameter(names = { "--work-dir" }, description = "Directory holding object directories")
	public Path workDir = Path.of("obj_regress");

	@Parameter(names = { "--keep" }, description = "Keep object directories of passing runs")
	public boolean keepWorkDirs = false;

	@Parameter(names = { "--update-golden" }, description = "Overwrite golden files with produced artifacts")
	public boolean updateGolden = false;

	@Parameter(names = { "--stop" }, description = "Stop after the first failed test case")
	public boolean stopOnFailure = false;

	@Parameter(names = { "--filter" }, description = "Only run test cases whose id matches this regex", validateWith = RegexValidator.class)
	public String filter;

	public RunConfiguration toConfiguration() {
		return RunConfiguration.builder(toolchain, workDir.toAbsolutePath().normalize())
			.buildTool(buildTool)
			.activeScenarios(scenarios.toArray(String[]::new))
			.jobs(jobs)
			.stageTimeout(Duration.ofSeconds(timeoutSeconds))
			.keepWorkDirs(keepWorkDirs)
			.updateGolden(updateGolden)
			.stopOnFailure(stopOnFailure)
			.filter(filter == null ? null : Pattern.compile(filter))
			.build();
	}

	public static final class ScenarioValueValidator implements IValueValidator<List<String>> {
		@Override
		public void validate(String name, List<String> value) throws ParameterException {
			Set<String> scenarios = new HashSet<>();
			for(var scenario : value) {
				if(!scenarios.add(scenario)) {
					throw new ParameterException("Duplicate scenario: " + scenario);
				}

				if(ScenarioCatalog.DEFAULT.get(scenario).isEmpty()) {
					throw new ParameterException("Unsupported scenario: " + scenario + " (known: " + ScenarioCatalog.DEFAULT.names() + ")");
				}
			}
		}
	}

	public static final class RegexValidator implements IParameterValidator {
		@Override
		public void validate(String name, String value) throws ParameterException {
			try {
				Pattern.compile(value);
			}
			catch(PatternSyntaxException e) {
				throw new ParameterException("Invalid " + name + " pattern: " + e.getDescription());
			}
		}
	}

	public static final class PositiveInteger implements IParameterValidator {
		@Override
		public void validate(String name, String value) throws ParameterException {
			try {
				if(Integer.parseInt(value) < 1) {
					throw new ParameterException(name + " must be at least 1: " + value);
				}
			}
			catch(NumberFormatException e) {
				throw new ParameterException(name + " must be an integer: " + value);
			}
		}
	}
}
