package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Expands a test case into the scenario runs it needs under the active scenarios.
 */
public final class ScenarioResolver {

	public ScenarioResolver(ScenarioCatalog catalog) {
		this.catalog = catalog;
	}

	private final ScenarioCatalog catalog;

	/**
	 * @param skipReason set when the test case does not run at all; {@code runs} is then empty
	 */
	public record Resolution(
		ImmutableList<ScenarioRun> runs,
		@Nullable String skipReason
	) {
		public boolean skipped() {
			return skipReason != null;
		}
	}

	public Resolution resolve(TestCase testCase, RunConfiguration config) throws InfrastructureException {
		for(var label : testCase.scenarios()) {
			if(!catalog.isKnownLabel(label)) {
				throw new InfrastructureException("Unknown scenario label '" + label + "' in " + testCase.id());
			}
		}
		for(var active : config.activeScenarios()) {
			if(catalog.get(active).isEmpty()) {
				throw new InfrastructureException("Unknown active scenario: " + active);
			}
		}

		if(testCase.skipReason() != null) {
			return new Resolution(ImmutableList.of(), testCase.skipReason());
		}

		var variants = testCase.flagVariants().isEmpty()
			? ImmutableList.of(ImmutableList.<String>of())
			: testCase.flagVariants();

		var runs = new ArrayList<ScenarioRun>();
		for(var scenario : catalog.scenarios()) {
			if(!config.activeScenarios().contains(scenario.name()) || !scenario.appliesTo(testCase.scenarios())) {
				continue;
			}

			for(int i = 0; i < variants.size(); ++i) {
				runs.add(new ScenarioRun(
					testCase,
					scenario,
					i,
					variants.get(i),
					objDir(config.workRoot(), testCase, scenario, i, variants.size())
				));
			}
		}

		if(runs.isEmpty()) {
			return new Resolution(ImmutableList.of(), "no active scenario matches " + testCase.scenarios());
		}

		return new Resolution(ImmutableList.copyOf(runs), null);
	}

	static Path objDir(Path workRoot, TestCase testCase, Scenario scenario, int variantIndex, int variantCount) {
		var dir = workRoot.resolve("obj_" + scenario.name());
		for(var part : testCase.group()) {
			dir = dir.resolve(part);
		}

		var name = testCase.name();
		if(variantCount > 1) {
			name += "__v" + variantIndex;
		}
		return dir.resolve(name);
	}
}
