package org.javai.theorems.env;

/**
 * A {@code use} or {@code reset} entry names an environment that is not
 * configured.
 */
public class UndefinedReferenceException extends EnvironmentConfigException {

	private final String envId;
	private final String reference;

	public UndefinedReferenceException(String envId, String reference) {
		super(envId == null
				? "Unknown environment '%s'".formatted(reference)
				: "Environment '%s' references unknown environment '%s'".formatted(envId, reference));
		this.envId = envId;
		this.reference = reference;
	}

	/**
	 * The referring environment, or {@code null} when the unknown id was passed
	 * directly to a query.
	 */
	public String envId() {
		return envId;
	}

	public String reference() {
		return reference;
	}
}
