package dev.vregress.testrunner;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class TestRunner {

	private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

	public static void main(String[] args) throws IOException, InterruptedException {
		var testArgs = new TestRunnerArgs();
		var commander = JCommander.newBuilder()
			.programName("vregress")
			.addObject(testArgs)
			.build();

		try {
			commander.parse(args);
		}
		catch(ParameterException e) {
			System.err.println(e.getMessage());
			commander.usage();
			System.exit(2);
			return;
		}

		if(testArgs.help) {
			commander.usage();
			return;
		}

		var config = testArgs.toConfiguration();
		var loaded = new TestCaseLoader().load(testArgs.testRoots);

		System.out.println("Running " + loaded.testCases().size() + " test cases under " + config.activeScenarios());

		var finished = new CountDownLatch(1);
		var shuttingDown = new AtomicBoolean();

		try(var invoker = new ProcessToolchainInvoker()) {
			var scheduler = new TestScheduler(invoker, config, ScenarioCatalog.DEFAULT);

			var mainThread = Thread.currentThread();
			Runtime.getRuntime().addShutdownHook(new Thread(() -> {
				if(finished.getCount() == 0) {
					return;
				}
				shuttingDown.set(true);
				scheduler.cancel();
				mainThread.interrupt();
				try {
					finished.await(30, TimeUnit.SECONDS);
				}
				catch(InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}));

			var report = scheduler.run(loaded.testCases(), loaded.rejected());
			report.print(System.out);
			finished.countDown();

			// The JVM is already exiting; System.exit would block on the running hook
			if(shuttingDown.get()) {
				return;
			}

			int status = report.exitStatus();
			if(status != 0) {
				log.debug("Exiting with status {}", status);
				System.exit(status);
			}
		}
	}
}
