package org.javai.theorems.order;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.theorems.env.EnvironmentConfig;
import org.javai.theorems.env.EnvironmentGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link DeclarationOrder} for the environments a document uses.
 * <p>
 * An environment depends on another when it names it in {@code use} or in a
 * symbolic {@code reset}. Only dependencies inside the working set count as
 * edges. A cycle among them is a configuration defect and is reported with a
 * {@link org.javai.theorems.env.CyclicDependencyException}.
 */
public class DeclarationOrderer {

	private static final Logger logger = LoggerFactory.getLogger(DeclarationOrderer.class);

	private final EnvironmentGraph graph;
	private final DeclarationOrderStrategy orderStrategy;

	public DeclarationOrderer(EnvironmentGraph graph) {
		this(graph, new StyleBatchingOrderStrategy());
	}

	public DeclarationOrderer(EnvironmentGraph graph, DeclarationOrderStrategy orderStrategy) {
		this.graph = Objects.requireNonNull(graph, "graph must not be null");
		this.orderStrategy = Objects.requireNonNull(orderStrategy, "orderStrategy must not be null");
	}

	/**
	 * Orders exactly the given environments.
	 *
	 * @param usedEnvIds environments referenced by the document, in any order
	 */
	public DeclarationOrder order(Collection<String> usedEnvIds) {
		Objects.requireNonNull(usedEnvIds, "usedEnvIds must not be null");
		if (usedEnvIds.isEmpty()) {
			return new DeclarationOrder(List.of());
		}

		EnvironmentConfig config = graph.config();
		List<String> workingSet = new ArrayList<>(new LinkedHashSet<>(usedEnvIds));
		workingSet.forEach(config::get);
		workingSet.sort(Comparator.comparingInt(config::position));

		Set<String> members = new LinkedHashSet<>(workingSet);
		List<DeclarationStep> steps = workingSet.stream()
				.map(envId -> toStep(envId, members))
				.toList();
		DeclarationOrder order = new DeclarationOrder(orderStrategy.order(steps));
		logger.debug("Declaration order for {} environments: {}", steps.size(), order.describe());
		return order;
	}

	/**
	 * Orders the given environments together with every environment they depend
	 * on, directly or transitively.
	 */
	public DeclarationOrder orderWithDependencies(Collection<String> usedEnvIds) {
		Objects.requireNonNull(usedEnvIds, "usedEnvIds must not be null");
		Set<String> closure = new LinkedHashSet<>();
		Deque<String> queue = new ArrayDeque<>(usedEnvIds);
		while (!queue.isEmpty()) {
			String envId = queue.remove();
			if (closure.add(envId)) {
				queue.addAll(graph.dependencies(envId));
			}
		}
		return order(closure);
	}

	private DeclarationStep toStep(String envId, Set<String> members) {
		Set<String> dependsOn = new LinkedHashSet<>(graph.dependencies(envId));
		dependsOn.retainAll(members);
		return new DeclarationStep(graph.spec(envId), dependsOn);
	}
}
