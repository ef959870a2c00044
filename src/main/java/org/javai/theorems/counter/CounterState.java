package org.javai.theorems.counter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable counter values of a single run. Never shared between runs.
 */
final class CounterState {

	private final Map<CounterKey, Integer> scopeCounts = new HashMap<>();
	private final Map<String, BlockNumber> lastRootNumbers = new HashMap<>();

	int increment(CounterKey key) {
		return scopeCounts.merge(key, 1, Integer::sum);
	}

	Optional<BlockNumber> lastRootNumber(String rootEnvId) {
		return Optional.ofNullable(lastRootNumbers.get(rootEnvId));
	}

	void recordRootNumber(String rootEnvId, BlockNumber number) {
		lastRootNumbers.put(rootEnvId, number);
	}
}
