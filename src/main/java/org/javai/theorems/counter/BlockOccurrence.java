package org.javai.theorems.counter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A block observed during document traversal, with the section numbers
 * enclosing it at that point.
 *
 * @param envId environment of the block
 * @param sectionNumbers enclosing section path, empty outside any section
 * @param label optional raw label used for cross references
 */
public record BlockOccurrence(String envId, List<Integer> sectionNumbers, String label) {

	public BlockOccurrence {
		Objects.requireNonNull(envId, "envId must not be null");
		sectionNumbers = sectionNumbers == null ? List.of() : List.copyOf(sectionNumbers);
		label = label == null || label.isBlank() ? null : label;
	}

	public BlockOccurrence(String envId, List<Integer> sectionNumbers) {
		this(envId, sectionNumbers, null);
	}

	public Optional<String> findLabel() {
		return Optional.ofNullable(label);
	}
}
