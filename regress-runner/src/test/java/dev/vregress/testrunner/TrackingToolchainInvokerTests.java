package dev.vregress.testrunner;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

public class TrackingToolchainInvokerTests {

	@TempDir
	Path tempDir;

	private Invocation execute() {
		return new Invocation(StageKind.EXECUTE, ImmutableList.of("./Vt"), tempDir, Duration.ofSeconds(5), Expectation.SUCCEED);
	}

	@Test
	public void stageFinishedBeforeCancelIsKept() throws Throwable {
		var scripted = new ScriptedToolchainInvoker();
		var tracker = new TrackingToolchainInvoker(scripted);

		tracker.beginTask();
		tracker.invoke(execute());
		tracker.cancelStages();

		Assertions.assertFalse(tracker.taskCutShort());
		Assertions.assertEquals(1, scripted.terminations());
	}

	@Test
	public void stageRunningAtCancelIsCutShort() throws Throwable {
		var scripted = new ScriptedToolchainInvoker();
		var tracker = new TrackingToolchainInvoker(scripted);
		scripted.on(StageKind.EXECUTE, invocation -> {
			tracker.cancelStages();
			return 143;
		});

		tracker.beginTask();
		tracker.invoke(execute());

		Assertions.assertTrue(tracker.taskCutShort());
	}

	@Test
	public void stageStartedAfterCancelIsCutShort() throws Throwable {
		var tracker = new TrackingToolchainInvoker(new ScriptedToolchainInvoker());
		tracker.cancelStages();

		tracker.beginTask();
		Assertions.assertFalse(tracker.taskCutShort());

		tracker.invoke(execute());
		Assertions.assertTrue(tracker.taskCutShort());

		tracker.beginTask();
		Assertions.assertFalse(tracker.taskCutShort());
	}
}
