package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.io.FilenameUtils;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A resolved test declaration. Immutable; built by {@link TestCaseLoader}.
 *
 * @param group directories between the test root and the declaration file
 * @param name base name of the declaration file
 * @param testDir directory holding the declaration, against which relative paths are resolved
 * @param topFile top-level HDL source passed to the toolchain
 * @param scenarios declared scenario labels
 * @param flags flags passed to every toolchain invocation of this test
 * @param flagVariants alternative flag groups; each one becomes a separate scenario run
 * @param stages declared stages in pipeline order
 * @param golden default golden reference
 * @param traceFormat explicitly declared trace format, if any
 * @param skipReason set when the test declares itself as skipped
 */
public record TestCase(
	ImmutableList<String> group,
	String name,
	Path testDir,
	Path topFile,
	ImmutableSet<String> scenarios,
	ImmutableList<String> flags,
	ImmutableList<ImmutableList<String>> flagVariants,
	ImmutableList<StageSpec> stages,
	Path golden,
	@Nullable String traceFormat,
	@Nullable String skipReason,
	ImmutableList<Assertion> assertions
) {

	public String id() {
		if(group.isEmpty()) {
			return name;
		}
		return String.join("/", group) + "/" + name;
	}

	public Optional<StageSpec> stage(StageKind kind) {
		return stages.stream()
			.filter(stage -> stage.kind() == kind)
			.findFirst();
	}

	public String topModule() {
		return FilenameUtils.getBaseName(topFile.toString());
	}

	/**
	 * The trace format the simulation writes; unless declared, inferred from the tracing flags.
	 */
	public String resolvedTraceFormat() {
		if(traceFormat != null) {
			return traceFormat;
		}

		var allFlags = ImmutableList.<String>builder().addAll(flags);
		stages.forEach(stage -> allFlags.addAll(stage.flags()));
		flagVariants.forEach(allFlags::addAll);

		for(var flag : allFlags.build()) {
			switch(flag) {
				case "--trace-saif":
					return "saif";
				case "--trace-fst":
					return "fst";
				default:
					break;
			}
		}
		return "vcd";
	}

	@Override
	public String toString() {
		return "TestCase{" + id() + ", top=" + topFile + ", scenarios=" + scenarios + "}";
	}
}
