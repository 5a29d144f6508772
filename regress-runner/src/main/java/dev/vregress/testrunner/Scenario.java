package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A concrete configuration mode of the toolchain.
 *
 * @param labels declaration labels this scenario answers to; always includes its own name
 * @param flags toolchain flags added to every compile or lint invocation under this scenario
 */
public record Scenario(
	String name,
	ImmutableSet<String> labels,
	ImmutableList<String> flags
) {
	public static Scenario of(String name, ImmutableList<String> flags, String... labels) {
		return new Scenario(
			name,
			ImmutableSet.<String>builder().add(labels).add(name).build(),
			flags
		);
	}

	public boolean appliesTo(ImmutableSet<String> declaredLabels) {
		return declaredLabels.stream().anyMatch(labels::contains);
	}
}
