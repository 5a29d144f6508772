package dev.vregress.trace.saif;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Canonical form of a switching-activity file.
 *
 * @param header semantic header fields; tool metadata such as {@code DATE} and {@code VERSION} is not kept
 * @param instances hierarchical paths of every instance
 * @param nets counters for every net or port, keyed by hierarchical path and then by counter name
 */
public record SaifDocument(
	ImmutableSortedMap<String, String> header,
	ImmutableSortedSet<String> instances,
	ImmutableSortedMap<String, ImmutableSortedMap<String, Long>> nets
) {
}
