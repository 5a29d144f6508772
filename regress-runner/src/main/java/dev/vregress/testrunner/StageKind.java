package dev.vregress.testrunner;

public enum StageKind {
	LINT("lint"),
	COMPILE("compile"),
	BUILD("build"),
	EXECUTE("execute"),
	;

	StageKind(String id) {
		this.id = id;
	}

	private final String id;

	public String stageId() {
		return id;
	}
}
