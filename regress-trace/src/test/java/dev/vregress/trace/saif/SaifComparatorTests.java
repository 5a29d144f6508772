package dev.vregress.trace.saif;

import dev.vregress.trace.TraceDifference;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class SaifComparatorTests {

	private static final String RESULT_SUFFIX = ".result.txt";

	@TestFactory
	Collection<DynamicTest> comparisonTests() throws Throwable {
		List<DynamicTest> tests = new ArrayList<>();

		URI uri = SaifComparatorTests.class.getResource("/dev/vregress/trace/saif").toURI();
		Path dir = Path.of(uri);
		var golden = dir.resolve("activity.golden.saif");
		try(var stream = Files.list(dir)) {
			for(var iterator = stream.sorted().iterator(); iterator.hasNext(); ) {
				var resultFile = iterator.next();
				var fileName = resultFile.getFileName().toString();
				if(!fileName.endsWith(RESULT_SUFFIX)) {
					continue;
				}

				var actual = resultFile.resolveSibling(fileName.substring(0, fileName.length() - RESULT_SUFFIX.length()) + ".saif");
				tests.add(createTest(golden, actual, resultFile));
			}
		}

		return tests;
	}

	private DynamicTest createTest(Path golden, Path actual, Path resultFile) throws Throwable {
		String expectedResult = Files.readString(resultFile, StandardCharsets.UTF_8).strip();

		return DynamicTest.dynamicTest(actual.getFileName().toString(), () -> {
			var difference = SaifComparator.compare(SaifParser.parse(golden), SaifParser.parse(actual));
			Assertions.assertEquals(expectedResult, difference.map(TraceDifference::describe).orElse("identical"));
		});
	}

	@Test
	public void extraInstanceIsReported() throws Throwable {
		var expected = SaifParser.parse("(SAIFILE (INSTANCE top))", "expected.saif");
		var actual = SaifParser.parse("(SAIFILE (INSTANCE top (INSTANCE sub)))", "actual.saif");

		var difference = SaifComparator.compare(expected, actual).orElseThrow();
		Assertions.assertEquals("instance top/sub", difference.location());
		Assertions.assertNull(difference.expected());
	}

	@Test
	public void missingCounterIsReported() throws Throwable {
		var expected = SaifParser.parse("(SAIFILE (INSTANCE top (NET (a (T0 1) (T1 2) (IG 0)))))", "expected.saif");
		var actual = SaifParser.parse("(SAIFILE (INSTANCE top (NET (a (T0 1) (T1 2)))))", "actual.saif");

		Assertions.assertEquals(
			"net top/a IG: missing 0 (present in golden)",
			SaifComparator.compare(expected, actual).orElseThrow().describe()
		);
	}
}
