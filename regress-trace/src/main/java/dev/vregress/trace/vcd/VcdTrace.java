package dev.vregress.trace.vcd;

import com.google.common.collect.ImmutableSortedMap;

/**
 * Canonical form of a value change dump.
 * <p>
 * Identifier codes, declaration order and the {@code $date}, {@code $version} and {@code $comment}
 * sections are not part of the model. Changes are grouped per timestamp and keyed by signal path,
 * so the order of changes within one timestamp does not matter.
 */
public record VcdTrace(
	String timescale,
	ImmutableSortedMap<String, String> scopes,
	ImmutableSortedMap<String, VcdSignal> signals,
	ImmutableSortedMap<Long, ImmutableSortedMap<String, String>> changes
) {
	public int changeCount() {
		return changes.values().stream().mapToInt(ImmutableSortedMap::size).sum();
	}
}
