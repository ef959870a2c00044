package org.javai.theorems.order;

import java.util.List;
import java.util.Objects;

/**
 * Maximal run of consecutive declarations sharing one style.
 *
 * @param style style tag, {@code null} for the backend default
 * @param envIds environments of the run, in declaration order
 */
public record OrderedDeclarationGroup(String style, List<String> envIds) {

	public OrderedDeclarationGroup {
		Objects.requireNonNull(envIds, "envIds must not be null");
		if (envIds.isEmpty()) {
			throw new IllegalArgumentException("envIds must not be empty");
		}
		envIds = List.copyOf(envIds);
	}
}
