package dev.vregress.testrunner;

import org.jetbrains.annotations.Nullable;

/**
 * A post-run check of a produced artifact. The set of formats is closed; {@link ArtifactComparator}
 * has one handler per {@link CompareKind}.
 */
public sealed interface Assertion {
	CompareKind kind();

	/**
	 * Path template of the produced artifact.
	 */
	String file();

	default String describe() {
		return kind().kindId() + " " + file();
	}

	/**
	 * Searches {@code file} for {@code regex}; if {@code expected} is set, capture group {@code group} must equal it.
	 */
	record PatternExtract(String file, String regex, int group, @Nullable String expected) implements Assertion {
		@Override
		public CompareKind kind() {
			return CompareKind.PATTERN_EXTRACT;
		}
	}

	record WaveformEqual(String file, String golden) implements Assertion {
		@Override
		public CompareKind kind() {
			return CompareKind.WAVEFORM_EQUAL;
		}
	}

	record ActivityEqual(String file, String golden) implements Assertion {
		@Override
		public CompareKind kind() {
			return CompareKind.ACTIVITY_EQUAL;
		}
	}

	record TextIdentical(String file, String golden) implements Assertion {
		@Override
		public CompareKind kind() {
			return CompareKind.TEXT_IDENTICAL;
		}
	}
}
