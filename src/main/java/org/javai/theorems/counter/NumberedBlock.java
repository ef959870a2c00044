package org.javai.theorems.counter;

import java.util.Objects;
import java.util.Optional;
import org.javai.theorems.env.EnvironmentSpec;

/**
 * Result of numbering one occurrence. {@code number} is {@code null} for
 * unnumbered environments.
 */
public record NumberedBlock(BlockOccurrence occurrence, EnvironmentSpec spec, BlockNumber number) {

	public NumberedBlock {
		Objects.requireNonNull(occurrence, "occurrence must not be null");
		Objects.requireNonNull(spec, "spec must not be null");
	}

	public Optional<BlockNumber> findNumber() {
		return Optional.ofNullable(number);
	}

	public boolean isNumbered() {
		return number != null;
	}
}
