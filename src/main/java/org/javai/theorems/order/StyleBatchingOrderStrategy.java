package org.javai.theorems.order;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.theorems.env.CyclicDependencyException;

/**
 * Default ordering: a greedy topological sort that keeps environments of the
 * same style together.
 * <p>
 * At each step the ready environments are those whose dependencies are all
 * declared. Among them the first one, in configuration order, whose style
 * equals the style of the last declared environment wins; when none matches,
 * the first ready environment is taken.
 */
public final class StyleBatchingOrderStrategy implements DeclarationOrderStrategy {

	@Override
	public List<DeclarationStep> order(List<DeclarationStep> steps) {
		Objects.requireNonNull(steps, "steps must not be null");
		Map<String, DeclarationStep> pending = new LinkedHashMap<>();
		for (DeclarationStep step : steps) {
			if (pending.put(step.envId(), step) != null) {
				throw new IllegalArgumentException("Duplicate environment in working set: " + step.envId());
			}
		}
		for (DeclarationStep step : steps) {
			for (String dependency : step.dependsOn()) {
				if (!pending.containsKey(dependency)) {
					throw new IllegalArgumentException("Environment '%s' depends on undeclared environment '%s'"
							.formatted(step.envId(), dependency));
				}
			}
		}

		Set<String> declared = new HashSet<>();
		List<DeclarationStep> ordered = new ArrayList<>(steps.size());
		while (!pending.isEmpty()) {
			String currentStyle = ordered.isEmpty() ? null : ordered.get(ordered.size() - 1).style();
			DeclarationStep next = pickNext(pending.values(), declared, currentStyle, ordered.isEmpty());
			if (next == null) {
				// Nothing is ready although environments remain, so they form or hang off a cycle
				throw new CyclicDependencyException("Cycle detected while ordering declarations:",
						List.copyOf(pending.keySet()));
			}
			ordered.add(next);
			declared.add(next.envId());
			pending.remove(next.envId());
		}
		return ordered;
	}

	private DeclarationStep pickNext(Iterable<DeclarationStep> pending,
			Set<String> declared,
			String currentStyle,
			boolean first) {

		DeclarationStep firstReady = null;
		for (DeclarationStep candidate : pending) {
			if (!candidate.isReadyAfter(declared)) {
				continue;
			}
			if (!first && Objects.equals(candidate.style(), currentStyle)) {
				return candidate;
			}
			if (firstReady == null) {
				firstReady = candidate;
			}
		}
		return firstReady;
	}
}
