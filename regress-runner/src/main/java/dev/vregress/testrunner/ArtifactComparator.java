package dev.vregress.testrunner;

import dev.vregress.trace.TraceDifference;
import dev.vregress.trace.TraceParseException;
import dev.vregress.trace.saif.SaifComparator;
import dev.vregress.trace.saif.SaifDocument;
import dev.vregress.trace.saif.SaifParser;
import dev.vregress.trace.vcd.VcdComparator;
import dev.vregress.trace.vcd.VcdParser;
import dev.vregress.trace.vcd.VcdTrace;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks produced artifacts against declared expectations. Structured formats are parsed into a
 * canonical model first so that run-specific metadata never causes a mismatch; every check reports
 * only its first divergence.
 */
public final class ArtifactComparator {

	private static final Logger log = LoggerFactory.getLogger(ArtifactComparator.class);

	public ArtifactComparator(RunConfiguration config) {
		this.config = config;
	}

	private final RunConfiguration config;

	private interface StructuredFormat<T> {
		T parse(Path file) throws IOException, TraceParseException;
		Optional<TraceDifference> compare(T golden, T actual);
	}

	private static final StructuredFormat<VcdTrace> WAVEFORM = new StructuredFormat<>() {
		@Override
		public VcdTrace parse(Path file) throws IOException, TraceParseException {
			return VcdParser.parse(file);
		}

		@Override
		public Optional<TraceDifference> compare(VcdTrace golden, VcdTrace actual) {
			return VcdComparator.compare(golden, actual);
		}
	};

	private static final StructuredFormat<SaifDocument> ACTIVITY = new StructuredFormat<>() {
		@Override
		public SaifDocument parse(Path file) throws IOException, TraceParseException {
			return SaifParser.parse(file);
		}

		@Override
		public Optional<TraceDifference> compare(SaifDocument golden, SaifDocument actual) {
			return SaifComparator.compare(golden, actual);
		}
	};

	public ComparisonResult compare(Assertion assertion, PathTemplate template) {
		var label = assertion.describe();
		try {
			var file = template.resolvePath(assertion.file());
			return switch(assertion.kind()) {
				case PATTERN_EXTRACT -> extractPattern((Assertion.PatternExtract)assertion, file, label);
				case WAVEFORM_EQUAL -> compareStructured(label, file, template.resolvePath(((Assertion.WaveformEqual)assertion).golden()), WAVEFORM);
				case ACTIVITY_EQUAL -> compareStructured(label, file, template.resolvePath(((Assertion.ActivityEqual)assertion).golden()), ACTIVITY);
				case TEXT_IDENTICAL -> compareStructured(label, file, template.resolvePath(((Assertion.TextIdentical)assertion).golden()), textFormat(template.variable("objDir")));
			};
		}
		catch(InfrastructureException e) {
			return ComparisonResult.error(label, e.getMessage());
		}
	}

	private ComparisonResult extractPattern(Assertion.PatternExtract assertion, Path file, String label) {
		if(!Files.isRegularFile(file)) {
			return ComparisonResult.mismatch(label, "produced file not found: " + file);
		}

		String content;
		try {
			content = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
		}
		catch(IOException e) {
			return ComparisonResult.error(label, "cannot read " + file + ": " + e.getMessage());
		}

		var matcher = Pattern.compile(assertion.regex(), Pattern.MULTILINE).matcher(content);
		if(!matcher.find()) {
			return ComparisonResult.noMatch(label, "/" + assertion.regex() + "/ does not match " + file);
		}

		if(assertion.expected() == null) {
			return ComparisonResult.pass(label);
		}

		int line = lineNumber(content, matcher.start());
		if(assertion.group() > matcher.groupCount() || matcher.group(assertion.group()) == null) {
			return ComparisonResult.noMatch(label, file + ":" + line + ": capture group " + assertion.group() + " missing in match of /" + assertion.regex() + "/");
		}

		var captured = matcher.group(assertion.group());
		if(!captured.equals(assertion.expected())) {
			return ComparisonResult.mismatch(label,
				file + ":" + line + ": group " + assertion.group() + " is '" + captured + "', expected '" + assertion.expected()
					+ "' in: " + lineText(content, matcher.start()));
		}

		return ComparisonResult.pass(label);
	}

	private <T> ComparisonResult compareStructured(String label, Path actual, Path golden, StructuredFormat<T> format) {
		if(!Files.isRegularFile(actual)) {
			return ComparisonResult.mismatch(label, "produced file not found: " + actual);
		}

		T actualModel;
		try {
			actualModel = format.parse(actual);
		}
		catch(IOException e) {
			return ComparisonResult.error(label, "cannot read " + actual + ": " + e.getMessage());
		}
		catch(TraceParseException e) {
			return ComparisonResult.mismatch(label, "produced file is malformed: " + e.getMessage());
		}

		if(!Files.isRegularFile(golden)) {
			if(config.updateGolden()) {
				return updateGolden(label, actual, golden);
			}
			return ComparisonResult.error(label, "golden file not found: " + golden);
		}

		T goldenModel;
		try {
			goldenModel = format.parse(golden);
		}
		catch(IOException | TraceParseException e) {
			return ComparisonResult.error(label, "cannot use golden " + golden + ": " + e.getMessage());
		}

		var difference = format.compare(goldenModel, actualModel);
		if(difference.isEmpty()) {
			return ComparisonResult.pass(label);
		}

		if(config.updateGolden()) {
			return updateGolden(label, actual, golden);
		}

		return ComparisonResult.mismatch(label, difference.get().describe());
	}

	private static ComparisonResult updateGolden(String label, Path actual, Path golden) {
		try {
			var parent = golden.getParent();
			if(parent != null) {
				Files.createDirectories(parent);
			}
			Files.copy(actual, golden, StandardCopyOption.REPLACE_EXISTING);
		}
		catch(IOException e) {
			return ComparisonResult.error(label, "cannot update golden " + golden + ": " + e.getMessage());
		}

		log.info("Updated golden {} from {}", golden, actual);
		return ComparisonResult.pass(label, "golden updated");
	}

	private static StructuredFormat<List<String>> textFormat(String objDir) {
		return new StructuredFormat<>() {
			@Override
			public List<String> parse(Path file) throws IOException {
				return normalizeText(FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8), objDir);
			}

			@Override
			public Optional<TraceDifference> compare(List<String> golden, List<String> actual) {
				int lines = Math.max(golden.size(), actual.size());
				for(int i = 0; i < lines; ++i) {
					var expectedLine = i < golden.size() ? golden.get(i) : null;
					var actualLine = i < actual.size() ? actual.get(i) : null;
					if(expectedLine == null || !expectedLine.equals(actualLine)) {
						return Optional.of(new TraceDifference("line " + (i + 1), expectedLine, actualLine));
					}
				}
				return Optional.empty();
			}
		};
	}

	/**
	 * Line endings unified, trailing whitespace and trailing blank lines dropped, and the object
	 * directory replaced by {@code obj_dir} so that logs do not depend on where the run happened.
	 */
	static List<String> normalizeText(String text, String objDir) {
		var lines = text.replace(objDir, "obj_dir")
			.lines()
			.map(String::stripTrailing)
			.toList();

		int end = lines.size();
		while(end > 0 && lines.get(end - 1).isEmpty()) {
			--end;
		}
		return lines.subList(0, end);
	}

	private static int lineNumber(String content, int offset) {
		int line = 1;
		for(int i = 0; i < offset; ++i) {
			if(content.charAt(i) == '\n') {
				++line;
			}
		}
		return line;
	}

	private static String lineText(String content, int offset) {
		int start = content.lastIndexOf('\n', offset - 1) + 1;
		int end = content.indexOf('\n', offset);
		if(end < 0) {
			end = content.length();
		}
		return content.substring(start, end).strip();
	}
}
