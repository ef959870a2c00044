package org.javai.theorems.order;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import org.javai.theorems.env.EnvironmentSpec;

/**
 * One environment awaiting declaration, with the environments of the working
 * set that have to be declared before it: its {@code use} target and the
 * environment its reset names, when those are part of the same document.
 */
public record DeclarationStep(EnvironmentSpec spec, Set<String> dependsOn) {

	public DeclarationStep {
		Objects.requireNonNull(spec, "spec must not be null");
		dependsOn = dependsOn == null ? Set.of() : Set.copyOf(dependsOn);
		if (dependsOn.contains(spec.id())) {
			throw new IllegalArgumentException("Environment '%s' cannot depend on itself".formatted(spec.id()));
		}
	}

	public String envId() {
		return spec.id();
	}

	public String style() {
		return spec.style();
	}

	/**
	 * Whether every dependency is among the already declared environments.
	 */
	public boolean isReadyAfter(Collection<String> declared) {
		return declared.containsAll(dependsOn);
	}
}
