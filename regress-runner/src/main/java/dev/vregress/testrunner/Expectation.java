package dev.vregress.testrunner;

/**
 * Declared result of a stage. When a stage is expected to fail, a nonzero exit is its success condition.
 */
public enum Expectation {
	SUCCEED,
	FAIL,
	;

	public static Expectation fails(boolean fails) {
		return fails ? FAIL : SUCCEED;
	}
}
