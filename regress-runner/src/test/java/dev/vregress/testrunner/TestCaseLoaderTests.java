package dev.vregress.testrunner;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class TestCaseLoaderTests {

	private static Path declarations;
	private static TestCaseLoader.LoadedTests loaded;

	@BeforeAll
	public static void loadDeclarations() throws Throwable {
		declarations = Path.of(TestCaseLoaderTests.class.getResource("/dev/vregress/testrunner/declarations").toURI());
		loaded = new TestCaseLoader().load(List.of(declarations));
	}

	private static TestCase find(String id) {
		return loaded.testCases().stream()
			.filter(testCase -> testCase.id().equals(id))
			.findFirst()
			.orElseThrow(() -> new AssertionError("no test case " + id));
	}

	@Test
	public void findsDeclarationsInGroupOrder() {
		Assertions.assertEquals(
			List.of("lint/t_lint_bad", "sim/t_counter", "t_skipped"),
			loaded.testCases().stream().map(TestCase::id).toList()
		);
	}

	@Test
	public void resolvesSimulationDeclaration() {
		var testCase = find("sim/t_counter");
		var testDir = declarations.resolve("sim").toAbsolutePath();

		Assertions.assertEquals(List.of("sim"), testCase.group());
		Assertions.assertEquals(testDir.resolve("t_counter.v"), testCase.topFile());
		Assertions.assertEquals(testDir.resolve("t_counter.out"), testCase.golden());
		Assertions.assertEquals("t_counter", testCase.topModule());
		Assertions.assertEquals(List.of("simulator", "vlt_all"), testCase.scenarios().asList());
		Assertions.assertEquals(List.of("--trace", "--stats"), testCase.flags());
		Assertions.assertEquals(List.of(List.of("-O0"), List.of("-O3", "--x-assign", "fast")), testCase.flagVariants());
		Assertions.assertEquals(List.of(StageKind.COMPILE, StageKind.BUILD, StageKind.EXECUTE),
			testCase.stages().stream().map(StageSpec::kind).toList());
		Assertions.assertEquals(List.of("-Wall"), testCase.stage(StageKind.COMPILE).orElseThrow().flags());
		Assertions.assertEquals(List.of("-j", "2"), testCase.stage(StageKind.BUILD).orElseThrow().flags());
		Assertions.assertTrue(testCase.stage(StageKind.EXECUTE).orElseThrow().flags().isEmpty());
		Assertions.assertEquals("vcd", testCase.resolvedTraceFormat());
		Assertions.assertEquals(
			List.of(
				new Assertion.WaveformEqual("${traceFile}", "${golden}"),
				new Assertion.PatternExtract("${stats}", "Threads\\s*:\\s*(\\d+)", 1, "1")
			),
			testCase.assertions()
		);
	}

	@Test
	public void resolvesFailingLintDeclaration() {
		var testCase = find("lint/t_lint_bad");
		var testDir = declarations.resolve("lint").toAbsolutePath();
		var lint = testCase.stage(StageKind.LINT).orElseThrow();

		Assertions.assertTrue(lint.expectsFailure());
		Assertions.assertEquals(List.of("--lint-only", "-Wall"), lint.modeFlags());
		Assertions.assertEquals("${golden}", lint.expectFile());
		Assertions.assertEquals(testDir.resolve("t_lint_bad_top.sv"), testCase.topFile());
		Assertions.assertEquals(testDir.resolve("expected/t_lint_bad.out"), testCase.golden());
		Assertions.assertEquals("t_lint_bad_top", testCase.topModule());
	}

	@Test
	public void emptySkipElementSkips() {
		Assertions.assertEquals("declared as skipped", find("t_skipped").skipReason());
	}

	@Test
	public void invalidDeclarationsAreErrored() {
		Assertions.assertEquals(
			List.of("broken/t_bad_pattern", "broken/t_execute_only", "broken/t_no_stage", "broken/t_not_xml", "broken/t_unknown_kind"),
			loaded.rejected().stream().map(TestOutcome::testId).toList()
		);
		loaded.rejected().forEach(outcome -> {
			Assertions.assertEquals(Outcome.ERRORED, outcome.outcome());
			Assertions.assertEquals(Classification.INFRASTRUCTURE_ERROR, outcome.classification());
		});
	}

	@Test
	public void singleFileRootHasNoGroup() throws Throwable {
		var single = new TestCaseLoader().load(List.of(declarations.resolve("t_skipped.xml")));

		Assertions.assertEquals(List.of("t_skipped"), single.testCases().stream().map(TestCase::id).toList());
		Assertions.assertTrue(single.rejected().isEmpty());
	}

	@Test
	public void sameTestIdUnderTwoRootsIsRejected(@TempDir Path tempDir) throws Throwable {
		var declaration = """
			<RegressTest>
			    <Scenarios>vlt</Scenarios>
			    <Lint/>
			</RegressTest>
			""";
		var first = Files.createDirectories(tempDir.resolve("a")).resolve("t_x.xml");
		var second = Files.createDirectories(tempDir.resolve("b")).resolve("t_x.xml");
		Files.writeString(first, declaration);
		Files.writeString(second, declaration);

		var both = new TestCaseLoader().load(List.of(tempDir.resolve("a"), tempDir.resolve("b")));

		Assertions.assertEquals(1, both.testCases().size());
		Assertions.assertEquals(tempDir.resolve("a").toAbsolutePath(), both.testCases().get(0).testDir());
		Assertions.assertEquals(1, both.rejected().size());
		var rejected = both.rejected().get(0);
		Assertions.assertEquals("t_x", rejected.testId());
		Assertions.assertEquals(Outcome.ERRORED, rejected.outcome());
		Assertions.assertTrue(rejected.diagnostic().startsWith("duplicate test id"), rejected.diagnostic());
	}

	@Test
	public void missingRootFails() {
		Assertions.assertThrows(IOException.class, () -> new TestCaseLoader().load(List.of(declarations.resolve("nowhere"))));
	}

	@Test
	public void splitsFlagsOnWhitespace() {
		Assertions.assertEquals(List.of("-O3", "--trace"), TestCaseLoader.splitFlags("  -O3 \n\t --trace "));
		Assertions.assertTrue(TestCaseLoader.splitFlags(null).isEmpty());
	}
}
