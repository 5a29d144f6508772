package dev.vregress.trace;

public class TraceParseException extends Exception {
	public TraceParseException(String sourceName, int line, String message) {
		super(sourceName + ":" + line + ": " + message);
		this.sourceName = sourceName;
		this.line = line;
	}

	private final String sourceName;
	private final int line;

	public String getSourceName() {
		return sourceName;
	}

	public int getLine() {
		return line;
	}
}
