package org.javai.theorems.env;

/**
 * An environment sets both {@code use} and {@code reset}.
 */
public class ConflictingSpecException extends EnvironmentConfigException {

	private final String envId;

	public ConflictingSpecException(String envId) {
		super("Environment '%s' cannot set both 'use' and 'reset'".formatted(envId));
		this.envId = envId;
	}

	public String envId() {
		return envId;
	}
}
