package dev.vregress.testrunner;

import com.google.common.collect.ImmutableMap;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${variable}} references in declared paths and flags for one scenario run.
 * Relative paths are resolved against the test's directory.
 */
public final class PathTemplate {

	private static final Pattern VARIABLE = Pattern.compile("\\$\\{([A-Za-z]+)}");

	private PathTemplate(Path baseDir, ImmutableMap<String, String> variables) {
		this.baseDir = baseDir;
		this.variables = variables;
	}

	private final Path baseDir;
	private final ImmutableMap<String, String> variables;

	public static PathTemplate forRun(ScenarioRun run) {
		var testCase = run.testCase();
		var objDir = run.objDir();
		return new PathTemplate(testCase.testDir(), ImmutableMap.<String, String>builder()
			.put("objDir", objDir.toString())
			.put("testDir", testCase.testDir().toString())
			.put("golden", testCase.golden().toString())
			.put("name", testCase.name())
			.put("scenario", run.scenario().name())
			.put("top", testCase.topFile().toString())
			.put("traceFile", objDir.resolve("simx." + testCase.resolvedTraceFormat()).toString())
			.put("stats", objDir.resolve("V" + testCase.topModule() + "__stats.txt").toString())
			.build());
	}

	public String expand(String template) throws InfrastructureException {
		Matcher matcher = VARIABLE.matcher(template);
		var result = new StringBuilder();
		while(matcher.find()) {
			var value = variables.get(matcher.group(1));
			if(value == null) {
				throw new InfrastructureException("Unknown variable ${" + matcher.group(1) + "} in " + template);
			}
			matcher.appendReplacement(result, Matcher.quoteReplacement(value));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	public Path resolvePath(String template) throws InfrastructureException {
		return baseDir.resolve(expand(template)).normalize();
	}

	public String variable(String name) {
		var value = variables.get(name);
		if(value == null) {
			throw new IllegalArgumentException("Unknown variable: " + name);
		}
		return value;
	}
}
