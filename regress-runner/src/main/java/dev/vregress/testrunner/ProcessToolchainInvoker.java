package dev.vregress.testrunner;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs stages as operating system processes. Output goes to {@code <stage>.stdout.log},
 * {@code <stage>.stderr.log} and the combined {@code <stage>.log} in the working directory.
 */
public final class ProcessToolchainInvoker implements ToolchainInvoker {

	private static final Logger log = LoggerFactory.getLogger(ProcessToolchainInvoker.class);

	private static final Duration TERMINATION_GRACE = Duration.ofSeconds(5);

	private final Set<Process> liveProcesses = ConcurrentHashMap.newKeySet();

	@Override
	public StageResult invoke(Invocation invocation) throws InfrastructureException, InterruptedException {
		var workDir = invocation.workDir();
		var stageId = invocation.stage().stageId();
		var stdoutFile = workDir.resolve(stageId + ".stdout.log");
		var stderrFile = workDir.resolve(stageId + ".stderr.log");
		var logFile = workDir.resolve(stageId + ".log");

		Map<Path, FileTime> before;
		try {
			Files.createDirectories(workDir);
			before = snapshot(workDir);
		}
		catch(IOException e) {
			throw new InfrastructureException("Cannot prepare working directory " + workDir, e);
		}

		var pb = new ProcessBuilder(invocation.command());
		pb.directory(workDir.toFile());
		pb.redirectOutput(stdoutFile.toFile());
		pb.redirectError(stderrFile.toFile());

		log.debug("Running {} in {}: {}", stageId, workDir, invocation.command());

		long start = System.nanoTime();
		Process process;
		try {
			process = pb.start();
		}
		catch(IOException e) {
			throw new InfrastructureException("Could not start " + invocation.command().get(0) + ": " + e.getMessage(), e);
		}

		liveProcesses.add(process);
		boolean timedOut;
		int exitCode;
		try {
			process.getOutputStream().close();

			timedOut = !process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
			if(timedOut) {
				log.warn("{} exceeded {}s in {}, terminating", stageId, invocation.timeout().toSeconds(), workDir);
				terminate(process);
			}
			exitCode = process.waitFor();
		}
		catch(InterruptedException e) {
			process.descendants().forEach(ProcessHandle::destroyForcibly);
			process.destroyForcibly();
			throw e;
		}
		catch(IOException e) {
			process.destroyForcibly();
			throw new InfrastructureException("Could not close input of " + invocation.command().get(0), e);
		}
		finally {
			liveProcesses.remove(process);
		}
		var duration = Duration.ofNanos(System.nanoTime() - start);

		String stdout;
		String stderr;
		ImmutableSet<Path> artifacts;
		try {
			stdout = readOutput(stdoutFile);
			stderr = readOutput(stderrFile);
			Files.writeString(logFile, stdout + stderr, StandardCharsets.UTF_8);
			artifacts = changedFiles(workDir, before, Set.of(stdoutFile, stderrFile, logFile));
		}
		catch(IOException e) {
			throw new InfrastructureException("Cannot collect output of " + stageId + " in " + workDir, e);
		}

		var status = StageStatus.classify(exitCode, timedOut, invocation.expectation());
		log.debug("{} in {} finished with exit {} ({}) after {} ms", stageId, workDir, exitCode, status, duration.toMillis());

		return new StageResult(
			invocation.stage(),
			invocation.command(),
			exitCode,
			stdout,
			stderr,
			duration,
			timedOut,
			status,
			logFile,
			artifacts
		);
	}

	@Override
	public void terminateAll() {
		for(var process : liveProcesses) {
			process.descendants().forEach(ProcessHandle::destroy);
			process.destroy();
		}
	}

	private static void terminate(Process process) throws InterruptedException {
		process.descendants().forEach(ProcessHandle::destroy);
		process.destroy();
		if(!process.waitFor(TERMINATION_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
			process.descendants().forEach(ProcessHandle::destroyForcibly);
			process.destroyForcibly();
		}
	}

	private static String readOutput(Path file) throws IOException {
		try(var is = Files.newInputStream(file)) {
			return IOUtils.toString(is, StandardCharsets.UTF_8);
		}
	}

	private static Map<Path, FileTime> snapshot(Path dir) throws IOException {
		var files = new HashMap<Path, FileTime>();
		try(Stream<Path> stream = Files.walk(dir)) {
			for(var it = stream.filter(Files::isRegularFile).iterator(); it.hasNext(); ) {
				var file = it.next();
				files.put(file, Files.getLastModifiedTime(file));
			}
		}
		return files;
	}

	private static ImmutableSet<Path> changedFiles(Path dir, Map<Path, FileTime> before, Set<Path> excluded) throws IOException {
		var artifacts = ImmutableSet.<Path>builder();
		for(var entry : new TreeMap<>(snapshot(dir)).entrySet()) {
			if(excluded.contains(entry.getKey())) {
				continue;
			}

			var previous = before.get(entry.getKey());
			if(previous == null || !previous.equals(entry.getValue())) {
				artifacts.add(entry.getKey());
			}
		}
		return artifacts.build();
	}
}
