package org.javai.theorems.env;

import java.util.Locale;
import java.util.Objects;

/**
 * Describes where a counter restarts. Sealed so the numbering engine can rely
 * on every variant being known.
 * <ul>
 *   <li>{@link Global} - never restarts</li>
 *   <li>{@link SectionLevel} - restarts whenever the first {@code n} section
 *   components change</li>
 *   <li>{@link SectionDeepest} - restarts with the innermost enclosing section</li>
 *   <li>{@link OtherEnv} - restarts each time another environment's counter
 *   produces a number</li>
 * </ul>
 */
public sealed interface ResetRule {

	/**
	 * Configuration keyword for this rule, the inverse of {@link #parse(String)}.
	 */
	String keyword();

	/**
	 * Parses a configuration value. Unrecognised tokens are taken to name another
	 * environment.
	 *
	 * @param value raw configuration token
	 * @return the rule, or {@code null} when the value is blank
	 */
	static ResetRule parse(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		String token = value.trim();
		String normalised = token.toLowerCase(Locale.ROOT);
		switch (normalised) {
			case "global":
				return Global.INSTANCE;
			case "section":
				return new SectionLevel(1);
			case "subsection":
				return new SectionLevel(2);
			case "subsubsection":
				return new SectionLevel(3);
			case "deepest":
				return SectionDeepest.INSTANCE;
			default:
				break;
		}
		if (normalised.startsWith("section-")) {
			return new SectionLevel(parseLevel(token, normalised.substring("section-".length())));
		}
		if (normalised.chars().allMatch(Character::isDigit)) {
			return new SectionLevel(parseLevel(token, normalised));
		}
		return new OtherEnv(token);
	}

	private static int parseLevel(String token, String digits) {
		try {
			return Integer.parseInt(digits);
		} catch (NumberFormatException e) {
			throw new EnvironmentConfigException("Invalid section level in reset '%s'".formatted(token), e);
		}
	}

	record Global() implements ResetRule {

		public static final Global INSTANCE = new Global();

		@Override
		public String keyword() {
			return "global";
		}
	}

	/**
	 * Section-scoped counter keyed on the first {@code level} section numbers.
	 */
	record SectionLevel(int level) implements ResetRule {

		public SectionLevel {
			if (level < 1) {
				throw new EnvironmentConfigException("Section level must be >= 1, was " + level);
			}
		}

		@Override
		public String keyword() {
			return switch (level) {
				case 1 -> "section";
				case 2 -> "subsection";
				case 3 -> "subsubsection";
				default -> "section-" + level;
			};
		}
	}

	record SectionDeepest() implements ResetRule {

		public static final SectionDeepest INSTANCE = new SectionDeepest();

		@Override
		public String keyword() {
			return "deepest";
		}
	}

	/**
	 * Counter scoped to the most recent number of another environment.
	 */
	record OtherEnv(String envId) implements ResetRule {

		public OtherEnv {
			Objects.requireNonNull(envId, "envId must not be null");
		}

		@Override
		public String keyword() {
			return envId;
		}
	}
}
