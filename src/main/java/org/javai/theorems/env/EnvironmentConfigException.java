package org.javai.theorems.env;

/**
 * Raised when an environment configuration cannot be read or is internally
 * inconsistent. Subclasses identify the specific defect; all of them abort the
 * current run.
 */
public class EnvironmentConfigException extends RuntimeException {

	public EnvironmentConfigException(String message) {
		super(message);
	}

	public EnvironmentConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
