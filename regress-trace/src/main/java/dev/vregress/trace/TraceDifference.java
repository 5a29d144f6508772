package dev.vregress.trace;

import org.jetbrains.annotations.Nullable;

/**
 * The first point at which two canonical traces diverge.
 *
 * @param location where the divergence was found, e.g. {@code #20 top.t.clk} or {@code $timescale}
 * @param expected the golden side, or {@code null} if the golden has nothing at this location
 * @param actual the produced side, or {@code null} if the produced trace has nothing at this location
 */
public record TraceDifference(
	String location,
	@Nullable String expected,
	@Nullable String actual
) {
	public String describe() {
		if(expected == null) {
			return location + ": unexpected " + actual + " (not in golden)";
		}
		else if(actual == null) {
			return location + ": missing " + expected + " (present in golden)";
		}
		else {
			return location + ": expected " + expected + ", got " + actual;
		}
	}

	@Override
	public String toString() {
		return describe();
	}
}
