package org.javai.theorems.env;

import java.util.List;

/**
 * A cycle was found while resolving a counter root or while ordering
 * declarations.
 */
public class CyclicDependencyException extends EnvironmentConfigException {

	private final List<String> envIds;

	public CyclicDependencyException(String message, List<String> envIds) {
		super(message + " " + envIds);
		this.envIds = envIds == null ? List.of() : List.copyOf(envIds);
	}

	/**
	 * Environments involved in, or blocked by, the cycle.
	 */
	public List<String> envIds() {
		return envIds;
	}
}
