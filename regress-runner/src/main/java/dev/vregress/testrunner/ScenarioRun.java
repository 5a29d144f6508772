package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;

/**
 * One concrete execution of a test case: a scenario, a flag variant and an object directory that
 * no other run shares.
 *
 * @param variantIndex index into the test's flag variants, or 0 when it declares none
 */
public record ScenarioRun(
	TestCase testCase,
	Scenario scenario,
	int variantIndex,
	ImmutableList<String> variantFlags,
	Path objDir
) {
	public String id() {
		var id = new StringBuilder(testCase.id());
		id.append('[').append(scenario.name());
		if(testCase.flagVariants().size() > 1) {
			id.append("/v").append(variantIndex);
		}
		id.append(']');
		return id.toString();
	}

	@Override
	public String toString() {
		return id();
	}
}
