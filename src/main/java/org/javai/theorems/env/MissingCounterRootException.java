package org.javai.theorems.env;

/**
 * The target of a {@code use} or of a symbolic {@code reset} does not own a
 * counter of its own.
 */
public class MissingCounterRootException extends EnvironmentConfigException {

	private final String envId;
	private final String target;

	public MissingCounterRootException(String envId, String target) {
		super("Environment '%s' refers to '%s', which has no reset of its own".formatted(envId, target));
		this.envId = envId;
		this.target = target;
	}

	public String envId() {
		return envId;
	}

	public String target() {
		return target;
	}
}
