package dev.vregress.testrunner;

import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.io.file.PathUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.StreamSupport;

/**
 * Loads {@code <RegressTest>} declarations from test roots. A root may be a single declaration file
 * or a directory searched recursively; subdirectories below the root form the test's group.
 */
public final class TestCaseLoader {

	private static final Logger log = LoggerFactory.getLogger(TestCaseLoader.class);

	public static final String DECLARATION_SUFFIX = ".xml";

	public TestCaseLoader() {
		mapper = new XmlMapper();
		// <Execute/> declares a stage with default settings
		mapper.coercionConfigFor(LogicalType.POJO)
			.setCoercion(CoercionInputShape.EmptyString, CoercionAction.AsEmpty);
	}

	private final XmlMapper mapper;

	/**
	 * Test cases found under the roots, plus an errored outcome for every declaration that could not be used.
	 */
	public record LoadedTests(
		ImmutableList<TestCase> testCases,
		ImmutableList<TestOutcome> rejected
	) {
	}

	public LoadedTests load(List<Path> roots) throws IOException {
		var testCases = new ArrayList<TestCase>();
		var rejected = new ArrayList<TestOutcome>();
		for(var root : roots) {
			if(!Files.exists(root)) {
				throw new IOException("Test root does not exist: " + root);
			}

			var baseDir = Files.isDirectory(root) ? root : root.toAbsolutePath().getParent();
			loadTestCases(baseDir, root, testCases, rejected);
		}

		// Test ids name object directories, so two declarations must never share one
		var unique = new ArrayList<TestCase>();
		var declaredAt = new HashMap<String, Path>();
		for(var testCase : testCases) {
			var declaration = testCase.testDir().resolve(testCase.name() + DECLARATION_SUFFIX);
			var first = declaredAt.putIfAbsent(testCase.id(), declaration);
			if(first == null) {
				unique.add(testCase);
			}
			else {
				log.warn("Rejecting test declaration {}: duplicate test id {} (first declared in {})", declaration, testCase.id(), first);
				rejected.add(TestOutcome.errored(testCase.id(), "duplicate test id: " + declaration + " and " + first, Duration.ZERO));
			}
		}

		log.info("Loaded {} test cases ({} rejected)", unique.size(), rejected.size());
		return new LoadedTests(ImmutableList.copyOf(unique), ImmutableList.copyOf(rejected));
	}

	private void loadTestCases(Path baseDir, Path path, List<TestCase> testCases, List<TestOutcome> rejected) throws IOException {
		if(Files.isDirectory(path)) {
			List<Path> entries;
			try(var dirStream = Files.list(path)) {
				entries = dirStream.sorted().toList();
			}

			for(var p : entries) {
				if(Files.isDirectory(p) || p.getFileName().toString().endsWith(DECLARATION_SUFFIX)) {
					loadTestCases(baseDir, p, testCases, rejected);
				}
			}
		}
		else {
			var relPath = baseDir.toAbsolutePath().relativize(path.toAbsolutePath());
			var relDir = relPath.getParent();

			ImmutableList<String> group;
			if(relDir == null) {
				group = ImmutableList.of();
			}
			else {
				group = StreamSupport.stream(relDir.spliterator(), false)
					.map(Path::toString)
					.collect(ImmutableList.toImmutableList());
			}

			var name = PathUtils.getBaseName(path);
			try {
				var declaration = mapper.readValue(path.toFile(), TestDeclaration.class);
				testCases.add(resolve(group, name, path.toAbsolutePath().getParent(), declaration));
			}
			catch(IOException | InvalidDeclarationException e) {
				var id = group.isEmpty() ? name : String.join("/", group) + "/" + name;
				log.warn("Rejecting test declaration {}: {}", path, e.getMessage());
				rejected.add(TestOutcome.errored(id, "invalid declaration " + path + ": " + e.getMessage(), Duration.ZERO));
			}
		}
	}

	public TestCase resolve(ImmutableList<String> group, String name, Path testDir, TestDeclaration declaration) throws InvalidDeclarationException {
		var scenarios = ImmutableSet.copyOf(splitFlags(declaration.getScenarios()));
		if(scenarios.isEmpty()) {
			throw new InvalidDeclarationException("no <Scenarios> declared");
		}

		var topFile = testDir.resolve(declaration.getTopFile() != null ? declaration.getTopFile() : name + ".v").normalize();
		var golden = testDir.resolve(declaration.getGolden() != null ? declaration.getGolden() : name + ".out").normalize();

		var stages = ImmutableList.<StageSpec>builder();
		addStage(stages, StageKind.LINT, declaration.getLint());
		addStage(stages, StageKind.COMPILE, declaration.getCompile());
		addStage(stages, StageKind.BUILD, declaration.getBuild());
		addStage(stages, StageKind.EXECUTE, declaration.getExecute());
		var stageList = stages.build();

		if(stageList.isEmpty()) {
			throw new InvalidDeclarationException("declares neither <Lint> nor <Compile>");
		}
		boolean hasCompile = declaration.getCompile() != null;
		if(!hasCompile && (declaration.getBuild() != null || declaration.getExecute() != null)) {
			throw new InvalidDeclarationException("<Build> and <Execute> require <Compile>");
		}

		var variants = ImmutableList.<ImmutableList<String>>builder();
		for(var variant : declaration.getFlagVariants()) {
			variants.add(splitFlags(variant));
		}

		var assertions = ImmutableList.<Assertion>builder();
		for(var assertion : declaration.getAssertions()) {
			assertions.add(resolveAssertion(assertion));
		}

		var skip = declaration.getSkip();

		return new TestCase(
			group,
			name,
			testDir,
			topFile,
			scenarios,
			splitFlags(declaration.getFlags()),
			variants.build(),
			stageList,
			golden,
			declaration.getTraceFormat(),
			skip == null ? null : (skip.isBlank() ? "declared as skipped" : skip.trim()),
			assertions.build()
		);
	}

	private static void addStage(ImmutableList.Builder<StageSpec> stages, StageKind kind, @Nullable StageDeclaration declaration) {
		if(declaration == null) {
			return;
		}

		stages.add(new StageSpec(
			kind,
			Expectation.fails(declaration.isFails()),
			splitFlags(declaration.getFlags()),
			declaration.getMode() == null ? null : splitFlags(declaration.getMode()),
			declaration.getExpect(),
			declaration.getExecutable()
		));
	}

	private static Assertion resolveAssertion(AssertionDeclaration declaration) throws InvalidDeclarationException {
		if(declaration.getKind() == null) {
			throw new InvalidDeclarationException("<Assert> without kind");
		}

		var kind = CompareKind.fromId(declaration.getKind())
			.orElseThrow(() -> new InvalidDeclarationException("unknown assertion kind: " + declaration.getKind()));

		var file = declaration.getFile();
		if(file == null || file.isBlank()) {
			throw new InvalidDeclarationException("<Assert kind=\"" + kind.kindId() + "\"> without file");
		}

		var golden = declaration.getGolden() != null ? declaration.getGolden() : "${golden}";

		return switch(kind) {
			case PATTERN_EXTRACT -> {
				var regex = declaration.getPattern();
				if(regex == null) {
					throw new InvalidDeclarationException("file-grep on " + file + " without pattern");
				}

				Pattern compiled;
				try {
					compiled = Pattern.compile(regex);
				}
				catch(PatternSyntaxException e) {
					throw new InvalidDeclarationException("invalid pattern " + regex + ": " + e.getDescription());
				}

				int group = declaration.getGroup() != null ? declaration.getGroup() : 1;
				if(declaration.getExpected() != null && (group < 0 || group > compiled.matcher("").groupCount())) {
					throw new InvalidDeclarationException("pattern " + regex + " has no capture group " + group);
				}
				yield new Assertion.PatternExtract(file, regex, group, declaration.getExpected());
			}
			case WAVEFORM_EQUAL -> new Assertion.WaveformEqual(file, golden);
			case ACTIVITY_EQUAL -> new Assertion.ActivityEqual(file, golden);
			case TEXT_IDENTICAL -> new Assertion.TextIdentical(file, golden);
		};
	}

	static ImmutableList<String> splitFlags(@Nullable String flags) {
		if(flags == null || flags.isBlank()) {
			return ImmutableList.of();
		}
		return ImmutableList.copyOf(flags.trim().split("\\s+"));
	}

	public static class InvalidDeclarationException extends Exception {
		public InvalidDeclarationException(String message) {
			super(message);
		}
	}
}
