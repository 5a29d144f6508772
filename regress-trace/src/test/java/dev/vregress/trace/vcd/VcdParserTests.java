package dev.vregress.trace.vcd;

import dev.vregress.trace.TraceParseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class VcdParserTests {

	private static final String DECLARATIONS = """
		$timescale 10 ns $end
		$scope module top $end
		$var wire 1 ! clk $end
		$var wire 16 " bus [15:0] $end
		$var real 64 # temp $end
		$upscope $end
		$enddefinitions $end
		""";

	@Test
	public void parsesHierarchyAndSignals() throws Throwable {
		var trace = VcdParser.parse(DECLARATIONS, "decl.vcd");

		Assertions.assertEquals("10ns", trace.timescale());
		Assertions.assertEquals("module", trace.scopes().get("top"));
		Assertions.assertEquals(new VcdSignal("top.bus[15:0]", "wire", 16), trace.signals().get("top.bus[15:0]"));
		Assertions.assertEquals(3, trace.signals().size());
		Assertions.assertTrue(trace.changes().isEmpty());
	}

	@Test
	public void lastChangeWithinTimestampWins() throws Throwable {
		var trace = VcdParser.parse(DECLARATIONS + "#0\n0!\n1!\n", "glitch.vcd");

		Assertions.assertEquals("1", trace.changes().get(0L).get("top.clk"));
		Assertions.assertEquals(1, trace.changeCount());
	}

	@Test
	public void normalizesValues() throws Throwable {
		var trace = VcdParser.parse(DECLARATIONS + "#3\nX!\nB0000000000001Z1 \"\nr1.5 #\n", "values.vcd");

		var atThree = trace.changes().get(3L);
		Assertions.assertEquals("x", atThree.get("top.clk"));
		Assertions.assertEquals("0".repeat(13) + "1z1", atThree.get("top.bus[15:0]"));
		Assertions.assertEquals("r1.5", atThree.get("top.temp"));
	}

	@Test
	public void vectorsExtendToDeclaredWidth() {
		Assertions.assertEquals("0000", VcdParser.normalizeVector("0", 4));
		Assertions.assertEquals("0001", VcdParser.normalizeVector("1", 4));
		Assertions.assertEquals("000x", VcdParser.normalizeVector("0x", 4));
		Assertions.assertEquals("xxxx", VcdParser.normalizeVector("X", 4));
		Assertions.assertEquals("zz10", VcdParser.normalizeVector("z10", 4));
		Assertions.assertEquals("00x0", VcdParser.normalizeVector("00X0", 4));
	}

	@Test
	public void redundantExtensionBitsAreDropped() {
		Assertions.assertEquals("0101", VcdParser.normalizeVector("000101", 4));
		Assertions.assertEquals("xx01", VcdParser.normalizeVector("xxxx01", 4));
		Assertions.assertEquals("10101", VcdParser.normalizeVector("10101", 4));
		Assertions.assertEquals("0x", VcdParser.normalizeVector("0x", 0));
	}

	@Test
	public void leadingZeroBeforeUnknownIsNotAllUnknown() throws Throwable {
		var partial = VcdParser.parse(DECLARATIONS + "#0\nb0x \"\n", "partial.vcd");
		var unknown = VcdParser.parse(DECLARATIONS + "#0\nbx \"\n", "unknown.vcd");

		Assertions.assertEquals("0".repeat(15) + "x", partial.changes().get(0L).get("top.bus[15:0]"));
		Assertions.assertEquals("x".repeat(16), unknown.changes().get(0L).get("top.bus[15:0]"));
	}

	@Test
	public void emptyTimestampsAreDropped() throws Throwable {
		var trace = VcdParser.parse(DECLARATIONS + "#0\n0!\n#5\n#10\n1!\n", "sparse.vcd");

		Assertions.assertEquals(List.of(0L, 10L), trace.changes().keySet().asList());
	}

	@Test
	public void rejectsUndeclaredIdentifier() {
		var e = Assertions.assertThrows(TraceParseException.class,
			() -> VcdParser.parse(DECLARATIONS + "#0\n1?\n", "bad.vcd"));

		Assertions.assertEquals("bad.vcd", e.getSourceName());
		Assertions.assertEquals(9, e.getLine());
	}

	@Test
	public void rejectsTimeGoingBackwards() {
		Assertions.assertThrows(TraceParseException.class,
			() -> VcdParser.parse(DECLARATIONS + "#10\n1!\n#5\n0!\n", "backwards.vcd"));
	}

	@Test
	public void rejectsUnterminatedSection() {
		Assertions.assertThrows(TraceParseException.class,
			() -> VcdParser.parse("$comment never closed\n#0\n", "unterminated.vcd"));
	}

	@Test
	public void rejectsUnbalancedScopes() {
		Assertions.assertThrows(TraceParseException.class,
			() -> VcdParser.parse("$scope module top $end\n$enddefinitions $end\n", "open.vcd"));
		Assertions.assertThrows(TraceParseException.class,
			() -> VcdParser.parse("$upscope $end\n", "close.vcd"));
	}
}
