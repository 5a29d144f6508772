package dev.vregress.testrunner;

/**
 * @param assertion short description of the check, e.g. {@code vcd-identical ${traceFile}}
 * @param diagnostic the single first divergence, or a note for passing results
 */
public record ComparisonResult(
	Status status,
	String assertion,
	String diagnostic
) {
	public enum Status {
		PASS,
		MISMATCH,
		NO_MATCH,
		ERROR,
	}

	public static ComparisonResult pass(String assertion) {
		return new ComparisonResult(Status.PASS, assertion, "");
	}

	public static ComparisonResult pass(String assertion, String note) {
		return new ComparisonResult(Status.PASS, assertion, note);
	}

	public static ComparisonResult mismatch(String assertion, String diagnostic) {
		return new ComparisonResult(Status.MISMATCH, assertion, diagnostic);
	}

	public static ComparisonResult noMatch(String assertion, String diagnostic) {
		return new ComparisonResult(Status.NO_MATCH, assertion, diagnostic);
	}

	public static ComparisonResult error(String assertion, String diagnostic) {
		return new ComparisonResult(Status.ERROR, assertion, diagnostic);
	}

	public boolean passed() {
		return status == Status.PASS;
	}

	public Classification classification() {
		return switch(status) {
			case PASS -> Classification.PASS;
			case MISMATCH, NO_MATCH -> Classification.ASSERTION_MISMATCH;
			case ERROR -> Classification.INFRASTRUCTURE_ERROR;
		};
	}

	public String describe() {
		return assertion + ": " + status + (diagnostic.isEmpty() ? "" : ": " + diagnostic);
	}
}
