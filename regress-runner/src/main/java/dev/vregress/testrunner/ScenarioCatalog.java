package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The scenario vocabulary, in the order scenarios run.
 */
public final class ScenarioCatalog {

	private ScenarioCatalog(ImmutableMap<String, Scenario> scenarios) {
		this.scenarios = scenarios;
		this.knownLabels = scenarios.values().stream()
			.flatMap(scenario -> scenario.labels().stream())
			.collect(ImmutableSet.toImmutableSet());
	}

	private final ImmutableMap<String, Scenario> scenarios;
	private final ImmutableSet<String> knownLabels;

	public static final ScenarioCatalog DEFAULT = builder()
		.add(Scenario.of("dist", ImmutableList.of()))
		.add(Scenario.of("vlt", ImmutableList.of(), "linter", "simulator", "simulator_st", "vlt_all"))
		.add(Scenario.of("vltmt", ImmutableList.of("--threads", "2"), "simulator", "vlt_all"))
		.build();

	public ImmutableList<Scenario> scenarios() {
		return scenarios.values().asList();
	}

	public Optional<Scenario> get(String name) {
		return Optional.ofNullable(scenarios.get(name));
	}

	public boolean isKnownLabel(String label) {
		return knownLabels.contains(label);
	}

	public ImmutableSet<String> names() {
		return scenarios.keySet();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		var builder = new Builder();
		scenarios.values().forEach(builder::add);
		return builder;
	}

	public static final class Builder {
		private final Map<String, Scenario> scenarios = new LinkedHashMap<>();

		private Builder() {}

		public Builder add(Scenario scenario) {
			if(scenarios.putIfAbsent(scenario.name(), scenario) != null) {
				throw new IllegalArgumentException("Duplicate scenario: " + scenario.name());
			}
			return this;
		}

		public ScenarioCatalog build() {
			return new ScenarioCatalog(ImmutableMap.copyOf(scenarios));
		}
	}
}
