package dev.vregress.trace.vcd;

/**
 * A declared variable, keyed by its hierarchical path rather than its identifier code.
 */
public record VcdSignal(
	String path,
	String type,
	int width
) {
	public String describe() {
		return type + " " + width;
	}
}
