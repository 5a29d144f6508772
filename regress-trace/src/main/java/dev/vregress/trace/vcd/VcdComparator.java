package dev.vregress.trace.vcd;

import com.google.common.collect.ImmutableSortedMap;
import dev.vregress.trace.Divergences;
import dev.vregress.trace.TraceDifference;

import java.util.Optional;
import java.util.TreeSet;

/**
 * Compares two canonical value change dumps: timescale, then scope hierarchy, then declared signals,
 * then value changes in time order. Only the first divergence is reported.
 */
public final class VcdComparator {
	private VcdComparator() {}

	public static Optional<TraceDifference> compare(VcdTrace expected, VcdTrace actual) {
		if(!expected.timescale().equals(actual.timescale())) {
			return Optional.of(new TraceDifference("$timescale", expected.timescale(), actual.timescale()));
		}

		var scopeDiff = Divergences.firstDifference(
			expected.scopes(),
			actual.scopes(),
			path -> "scope " + path,
			type -> "$scope " + type
		);
		if(scopeDiff != null) {
			return Optional.of(scopeDiff);
		}

		var signalDiff = Divergences.firstDifference(
			expected.signals(),
			actual.signals(),
			path -> "signal " + path,
			VcdSignal::describe
		);
		if(signalDiff != null) {
			return Optional.of(signalDiff);
		}

		var times = new TreeSet<Long>(expected.changes().keySet());
		times.addAll(actual.changes().keySet());

		for(var time : times) {
			var expectedAt = expected.changes().getOrDefault(time, ImmutableSortedMap.of());
			var actualAt = actual.changes().getOrDefault(time, ImmutableSortedMap.of());

			var changeDiff = Divergences.firstDifference(
				expectedAt,
				actualAt,
				path -> "#" + time + " " + path,
				value -> value
			);
			if(changeDiff != null) {
				return Optional.of(changeDiff);
			}
		}

		return Optional.empty();
	}
}
