package dev.vregress.trace;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.function.Function;

public final class Divergences {
	private Divergences() {}

	/**
	 * Walks the union of both key sets in ascending order and returns the first key whose entries differ.
	 */
	public static <K extends Comparable<K>, V> @Nullable TraceDifference firstDifference(
		SortedMap<K, V> expected,
		SortedMap<K, V> actual,
		Function<K, String> location,
		Function<V, String> render
	) {
		var keys = new TreeSet<K>(expected.keySet());
		keys.addAll(actual.keySet());

		for(var key : keys) {
			var expectedValue = expected.get(key);
			var actualValue = actual.get(key);
			if(!Objects.equals(expectedValue, actualValue)) {
				return new TraceDifference(
					location.apply(key),
					expectedValue == null ? null : render.apply(expectedValue),
					actualValue == null ? null : render.apply(actualValue)
				);
			}
		}

		return null;
	}
}
