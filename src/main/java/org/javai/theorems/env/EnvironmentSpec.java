package org.javai.theorems.env;

import java.util.Locale;
import java.util.Objects;

/**
 * Configuration of one block environment. At most one of {@code reset} and
 * {@code use} is meaningful; {@link EnvironmentGraph#validate(EnvironmentConfig)}
 * rejects specs that set both.
 */
public record EnvironmentSpec(
		/** Unique key, as written in the document's block syntax. */
		String id,
		/** Human-readable heading, e.g. "Theorem". */
		String displayName,
		/** Name the backend declares the environment under. */
		String renderName,
		/** Counter reset rule; {@code null} for environments that own no counter. */
		ResetRule reset,
		/** Environment whose counter this one shares; {@code null} if none. */
		String use,
		/** Style tag used to batch declarations; {@code null} for the backend default. */
		String style
) {

	public EnvironmentSpec {
		Objects.requireNonNull(id, "id must not be null");
		if (id.isBlank()) {
			throw new IllegalArgumentException("id must not be blank");
		}
		displayName = isBlank(displayName) ? defaultDisplayName(id) : displayName;
		renderName = isBlank(renderName) ? id : renderName;
		use = isBlank(use) ? null : use;
		style = isBlank(style) ? null : style;
	}

	public static Builder builder(String id) {
		return new Builder(id);
	}

	/**
	 * Whether occurrences of this environment receive a number.
	 */
	public boolean isNumbered() {
		return reset != null || use != null;
	}

	/**
	 * Id of the environment a symbolic {@code reset} names, or {@code null}.
	 */
	public String resetTarget() {
		return reset instanceof ResetRule.OtherEnv other ? other.envId() : null;
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	private static String defaultDisplayName(String id) {
		return id.substring(0, 1).toUpperCase(Locale.ROOT) + id.substring(1);
	}

	public static final class Builder {

		private final String id;
		private String displayName;
		private String renderName;
		private ResetRule reset;
		private String use;
		private String style;

		private Builder(String id) {
			this.id = id;
		}

		public Builder displayName(String displayName) {
			this.displayName = displayName;
			return this;
		}

		public Builder renderName(String renderName) {
			this.renderName = renderName;
			return this;
		}

		public Builder reset(ResetRule reset) {
			this.reset = reset;
			return this;
		}

		public Builder reset(String reset) {
			this.reset = ResetRule.parse(reset);
			return this;
		}

		public Builder use(String use) {
			this.use = use;
			return this;
		}

		public Builder style(String style) {
			this.style = style;
			return this;
		}

		public EnvironmentSpec build() {
			return new EnvironmentSpec(id, displayName, renderName, reset, use, style);
		}
	}
}
