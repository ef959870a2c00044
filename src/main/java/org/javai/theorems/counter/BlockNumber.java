package org.javai.theorems.counter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Hierarchical number assigned to a block, e.g. {@code [2, 1]} for the first
 * item of section 2.
 */
public record BlockNumber(List<Integer> parts) {

	public BlockNumber {
		Objects.requireNonNull(parts, "parts must not be null");
		if (parts.isEmpty()) {
			throw new IllegalArgumentException("parts must not be empty");
		}
		parts = List.copyOf(parts);
	}

	public static BlockNumber of(Integer... parts) {
		return new BlockNumber(List.of(parts));
	}

	/**
	 * Builds the number for the {@code count}-th item within a scope prefix.
	 */
	static BlockNumber within(List<Integer> prefix, int count) {
		List<Integer> parts = new ArrayList<>(prefix.size() + 1);
		parts.addAll(prefix);
		parts.add(count);
		return new BlockNumber(parts);
	}

	/**
	 * Last component: the position within the counting scope.
	 */
	public int ordinal() {
		return parts.get(parts.size() - 1);
	}

	public int depth() {
		return parts.size();
	}

	public String format(String separator) {
		return parts.stream().map(String::valueOf).collect(Collectors.joining(separator));
	}

	public String format() {
		return format(".");
	}

	@Override
	public String toString() {
		return format();
	}
}
