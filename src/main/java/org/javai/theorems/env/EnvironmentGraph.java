package org.javai.theorems.env;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validated view of an {@link EnvironmentConfig} that answers, for any numbered
 * environment, which environment owns its counter and which reset rule that
 * counter follows.
 * <p>
 * Instances are immutable. Resolution happens once at construction, so a graph
 * can be cached and shared by every run that uses the same configuration.
 */
public final class EnvironmentGraph {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentGraph.class);

	private final EnvironmentConfig config;
	private final Map<String, String> roots;
	private final Map<String, ResetRule> effectiveResets;

	private EnvironmentGraph(EnvironmentConfig config) {
		this.config = config;
		Map<String, String> resolvedRoots = new LinkedHashMap<>();
		Map<String, ResetRule> resolvedResets = new LinkedHashMap<>();
		for (EnvironmentSpec spec : config.specs().values()) {
			if (!spec.isNumbered()) {
				continue;
			}
			String root = followUseChain(config, spec.id());
			ResetRule rule = config.get(root).reset();
			if (rule instanceof ResetRule.OtherEnv other) {
				rule = new ResetRule.OtherEnv(followUseChain(config, other.envId()));
			}
			resolvedRoots.put(spec.id(), root);
			resolvedResets.put(spec.id(), rule);
			logger.debug("Resolved environment '{}' to counter root '{}' with reset {}", spec.id(), root, rule);
		}
		this.roots = Collections.unmodifiableMap(resolvedRoots);
		this.effectiveResets = Collections.unmodifiableMap(resolvedResets);
	}

	/**
	 * Validates the configuration and resolves every environment.
	 *
	 * @throws EnvironmentConfigException if the configuration is inconsistent
	 */
	public static EnvironmentGraph of(EnvironmentConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		validate(config);
		return new EnvironmentGraph(config);
	}

	/**
	 * Checks the structural invariants of a configuration.
	 * <p>
	 * Conflicts and unknown references are reported first, then cycles in
	 * {@code use} chains, then references to environments that own no counter.
	 *
	 * @throws ConflictingSpecException if an environment sets both {@code use} and {@code reset}
	 * @throws UndefinedReferenceException if a reference names an unknown environment
	 * @throws CyclicDependencyException if a {@code use} chain loops or a reset names its own environment
	 * @throws MissingCounterRootException if a referenced environment has no reset of its own
	 */
	public static void validate(EnvironmentConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		for (EnvironmentSpec spec : config.specs().values()) {
			if (spec.use() != null && spec.reset() != null) {
				throw new ConflictingSpecException(spec.id());
			}
			if (spec.use() != null && !config.contains(spec.use())) {
				throw new UndefinedReferenceException(spec.id(), spec.use());
			}
			String resetTarget = spec.resetTarget();
			if (resetTarget != null && !config.contains(resetTarget)) {
				throw new UndefinedReferenceException(spec.id(), resetTarget);
			}
			if (spec.id().equals(resetTarget)) {
				throw new CyclicDependencyException("Environment resets on its own counter:", List.of(spec.id()));
			}
		}
		for (EnvironmentSpec spec : config.specs().values()) {
			if (spec.use() != null) {
				followUseChain(config, spec.id());
			}
		}
		for (EnvironmentSpec spec : config.specs().values()) {
			requireCounterOwner(config, spec.id(), spec.use());
			requireCounterOwner(config, spec.id(), spec.resetTarget());
		}
	}

	private static void requireCounterOwner(EnvironmentConfig config, String envId, String target) {
		if (target != null && config.get(target).reset() == null) {
			throw new MissingCounterRootException(envId, target);
		}
	}

	/**
	 * Walks {@code use} links until an environment with its own reset is found.
	 * The walk is bounded by the visited set, so a loop is reported rather than
	 * followed.
	 *
	 * @return the counter root, or {@code null} if the chain ends at an
	 * environment without a counter
	 */
	private static String followUseChain(EnvironmentConfig config, String envId) {
		Set<String> visited = new LinkedHashSet<>();
		String current = envId;
		while (current != null) {
			if (!visited.add(current)) {
				List<String> chain = new ArrayList<>(visited);
				chain.add(current);
				throw new CyclicDependencyException("Cycle detected while resolving counter root of '%s':"
						.formatted(envId), chain);
			}
			EnvironmentSpec spec = config.get(current);
			if (spec.reset() != null) {
				return current;
			}
			current = spec.use();
		}
		return null;
	}

	public EnvironmentConfig config() {
		return config;
	}

	public EnvironmentSpec spec(String envId) {
		return config.get(envId);
	}

	public boolean isNumbered(String envId) {
		return config.get(envId).isNumbered();
	}

	/**
	 * Environment owning the counter that {@code envId} increments. For an
	 * environment with its own reset this is the environment itself.
	 *
	 * @throws UndefinedReferenceException if the environment is unknown
	 * @throws IllegalArgumentException if the environment is unnumbered
	 */
	public String resolveRootCounter(String envId) {
		return requireNumbered(envId, roots);
	}

	/**
	 * Reset rule of the counter {@code envId} increments. A symbolic reset is
	 * reported against the counter root of the environment it names.
	 *
	 * @throws UndefinedReferenceException if the environment is unknown
	 * @throws IllegalArgumentException if the environment is unnumbered
	 */
	public ResetRule resolveEffectiveReset(String envId) {
		return requireNumbered(envId, effectiveResets);
	}

	/**
	 * Whether {@code envId} owns its counter directly rather than sharing one via
	 * {@code use}.
	 */
	public boolean isCounterRoot(String envId) {
		return envId.equals(roots.get(envId));
	}

	/**
	 * Immediate dependencies of an environment: its {@code use} target and the
	 * environment its reset names, in that order.
	 */
	public List<String> dependencies(String envId) {
		EnvironmentSpec spec = config.get(envId);
		List<String> dependencies = new ArrayList<>(2);
		if (spec.use() != null) {
			dependencies.add(spec.use());
		}
		String resetTarget = spec.resetTarget();
		if (resetTarget != null && !dependencies.contains(resetTarget)) {
			dependencies.add(resetTarget);
		}
		return List.copyOf(dependencies);
	}

	private <T> T requireNumbered(String envId, Map<String, T> resolved) {
		T value = resolved.get(envId);
		if (value == null) {
			config.get(envId);
			throw new IllegalArgumentException("Environment '%s' is not numbered".formatted(envId));
		}
		return value;
	}
}
