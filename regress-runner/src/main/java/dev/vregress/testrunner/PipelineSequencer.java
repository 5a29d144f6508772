package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives the stages of one scenario run in order: lint, compile, build, execute. A stage only runs
 * when the one before it succeeded; a declared failure ends the pipeline at {@link PipelineState#DONE},
 * any other failure at {@link PipelineState#ABORTED}.
 */
public final class PipelineSequencer {

	private static final Logger log = LoggerFactory.getLogger(PipelineSequencer.class);

	public PipelineSequencer(ToolchainInvoker invoker, RunConfiguration config) {
		this.invoker = invoker;
		this.config = config;
	}

	private final ToolchainInvoker invoker;
	private final RunConfiguration config;

	public PipelineResult run(ScenarioRun run) throws InfrastructureException, InterruptedException {
		var template = PathTemplate.forRun(run);
		var results = new ArrayList<StageResult>();
		var state = PipelineState.PENDING;

		for(var stage : run.testCase().stages()) {
			state = transition(run, state, PipelineState.forStage(stage.kind()));

			var result = invoker.invoke(createInvocation(run, stage, template));
			results.add(result);

			if(result.status().allowsNextStage()) {
				continue;
			}

			if(result.status() == StageStatus.EXPECTED_FAILURE) {
				transition(run, state, PipelineState.DONE);
				return new PipelineResult(PipelineState.DONE, ImmutableList.copyOf(results));
			}

			log.info("{}: {}", run.id(), result.describe());
			transition(run, state, PipelineState.ABORTED);
			return new PipelineResult(PipelineState.ABORTED, ImmutableList.copyOf(results));
		}

		transition(run, state, PipelineState.DONE);
		return new PipelineResult(PipelineState.DONE, ImmutableList.copyOf(results));
	}

	private static PipelineState transition(ScenarioRun run, PipelineState from, PipelineState to) {
		if(from != to) {
			log.debug("{}: {} -> {}", run.id(), from, to);
		}
		return to;
	}

	Invocation createInvocation(ScenarioRun run, StageSpec stage, PathTemplate template) throws InfrastructureException {
		var testCase = run.testCase();
		var command = new ArrayList<String>();

		switch(stage.kind()) {
			case LINT, COMPILE -> {
				command.add(config.toolchain().toString());
				var modeFlags = stage.modeFlags() != null
					? stage.modeFlags()
					: (stage.kind() == StageKind.LINT ? config.lintModeFlags() : config.compileModeFlags());
				expandAll(modeFlags, template, command);
				command.addAll(run.scenario().flags());
				expandAll(testCase.flags(), template, command);
				expandAll(run.variantFlags(), template, command);
				expandAll(stage.flags(), template, command);
				command.add(config.outputDirFlag());
				command.add(run.objDir().toString());
				command.add(testCase.topFile().toString());
			}

			case BUILD -> {
				command.add(config.buildTool());
				command.add("-f");
				command.add("V" + testCase.topModule() + ".mk");
				expandAll(stage.flags(), template, command);
			}

			case EXECUTE -> {
				if(stage.executable() != null) {
					command.add(template.resolvePath(stage.executable()).toString());
				}
				else {
					command.add(run.objDir().resolve("V" + testCase.topModule()).toString());
				}
				expandAll(stage.flags(), template, command);
			}
		}

		return new Invocation(
			stage.kind(),
			ImmutableList.copyOf(command),
			run.objDir(),
			config.stageTimeout(),
			stage.expectation()
		);
	}

	private static void expandAll(List<String> args, PathTemplate template, List<String> command) throws InfrastructureException {
		for(var arg : args) {
			command.add(template.expand(arg));
		}
	}
}
