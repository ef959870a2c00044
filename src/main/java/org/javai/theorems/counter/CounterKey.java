package org.javai.theorems.counter;

import java.util.List;
import java.util.Objects;

/**
 * One counting scope: the counter root together with the prefix under which it
 * counts. An empty prefix is the single global scope of the root.
 */
public record CounterKey(String rootEnvId, List<Integer> scopePrefix) {

	public CounterKey {
		Objects.requireNonNull(rootEnvId, "rootEnvId must not be null");
		scopePrefix = scopePrefix == null ? List.of() : List.copyOf(scopePrefix);
	}
}
