package org.javai.theorems.env;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable set of environment specifications for one configuration. The
 * insertion order is the declaration order used to break ties when ordering
 * output declarations.
 */
public final class EnvironmentConfig {

	private final Map<String, EnvironmentSpec> specs;
	private final Map<String, Integer> positions;

	private EnvironmentConfig(Map<String, EnvironmentSpec> specs) {
		this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
		Map<String, Integer> index = new LinkedHashMap<>();
		for (String id : this.specs.keySet()) {
			index.put(id, index.size());
		}
		this.positions = Collections.unmodifiableMap(index);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static EnvironmentConfig of(Collection<EnvironmentSpec> specs) {
		Objects.requireNonNull(specs, "specs must not be null");
		Builder builder = builder();
		specs.forEach(builder::add);
		return builder.build();
	}

	public Map<String, EnvironmentSpec> specs() {
		return specs;
	}

	public List<String> ids() {
		return List.copyOf(specs.keySet());
	}

	public boolean contains(String envId) {
		return specs.containsKey(envId);
	}

	public Optional<EnvironmentSpec> find(String envId) {
		return Optional.ofNullable(specs.get(envId));
	}

	/**
	 * Returns the spec for the given id.
	 *
	 * @throws UndefinedReferenceException if no such environment is configured
	 */
	public EnvironmentSpec get(String envId) {
		EnvironmentSpec spec = specs.get(envId);
		if (spec == null) {
			throw new UndefinedReferenceException(null, envId);
		}
		return spec;
	}

	/**
	 * Position of the environment in declaration order.
	 */
	public int position(String envId) {
		Integer position = positions.get(envId);
		if (position == null) {
			throw new UndefinedReferenceException(null, envId);
		}
		return position;
	}

	public int size() {
		return specs.size();
	}

	@Override
	public String toString() {
		return "EnvironmentConfig" + specs.keySet();
	}

	public static final class Builder {

		private final Map<String, EnvironmentSpec> specs = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder add(EnvironmentSpec spec) {
			Objects.requireNonNull(spec, "spec must not be null");
			if (specs.putIfAbsent(spec.id(), spec) != null) {
				throw new EnvironmentConfigException("Duplicate environment id: " + spec.id());
			}
			return this;
		}

		public Builder add(String id, UnaryOperator<EnvironmentSpec.Builder> customiser) {
			return add(customiser.apply(EnvironmentSpec.builder(id)).build());
		}

		public EnvironmentConfig build() {
			return new EnvironmentConfig(specs);
		}
	}
}
