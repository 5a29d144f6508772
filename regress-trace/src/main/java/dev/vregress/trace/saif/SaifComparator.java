package dev.vregress.trace.saif;

import dev.vregress.trace.Divergences;
import dev.vregress.trace.TraceDifference;

import java.util.Optional;
import java.util.TreeSet;

/**
 * Exact comparison of two switching-activity documents. Counter values must match exactly; the order
 * in which nets or counters appear in the files is irrelevant.
 */
public final class SaifComparator {
	private SaifComparator() {}

	public static Optional<TraceDifference> compare(SaifDocument expected, SaifDocument actual) {
		var headerDiff = Divergences.firstDifference(
			expected.header(),
			actual.header(),
			field -> "header " + field,
			value -> value
		);
		if(headerDiff != null) {
			return Optional.of(headerDiff);
		}

		var instances = new TreeSet<String>(expected.instances());
		instances.addAll(actual.instances());
		for(var instance : instances) {
			boolean inExpected = expected.instances().contains(instance);
			boolean inActual = actual.instances().contains(instance);
			if(inExpected != inActual) {
				return Optional.of(new TraceDifference(
					"instance " + instance,
					inExpected ? "INSTANCE" : null,
					inActual ? "INSTANCE" : null
				));
			}
		}

		var nets = new TreeSet<String>(expected.nets().keySet());
		nets.addAll(actual.nets().keySet());
		for(var net : nets) {
			var expectedCounters = expected.nets().get(net);
			var actualCounters = actual.nets().get(net);
			if(expectedCounters == null || actualCounters == null) {
				return Optional.of(new TraceDifference(
					"net " + net,
					expectedCounters == null ? null : SaifParser.describeCounters(expectedCounters),
					actualCounters == null ? null : SaifParser.describeCounters(actualCounters)
				));
			}

			var counterDiff = Divergences.firstDifference(
				expectedCounters,
				actualCounters,
				counter -> "net " + net + " " + counter,
				String::valueOf
			);
			if(counterDiff != null) {
				return Optional.of(counterDiff);
			}
		}

		return Optional.empty();
	}

}
