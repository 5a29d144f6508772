package dev.vregress.testrunner;

import java.util.Arrays;
import java.util.Optional;

public enum CompareKind {
	PATTERN_EXTRACT("file-grep"),
	WAVEFORM_EQUAL("vcd-identical"),
	ACTIVITY_EQUAL("saif-identical"),
	TEXT_IDENTICAL("files-identical"),
	;

	CompareKind(String id) {
		this.id = id;
	}

	private final String id;

	public String kindId() {
		return id;
	}

	public static Optional<CompareKind> fromId(String id) {
		return Arrays.stream(values())
			.filter(kind -> kind.id.equals(id))
			.findFirst();
	}
}
