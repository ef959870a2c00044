package org.javai.theorems.order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.theorems.env.EnvironmentSpec;

/**
 * Environments of one document in declaration order, together with the
 * maximal same-style runs a backend switches style for once.
 */
public final class DeclarationOrder {

	private final List<DeclarationStep> steps;
	private final List<OrderedDeclarationGroup> groups;

	DeclarationOrder(List<DeclarationStep> steps) {
		this.steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
		this.groups = collapse(this.steps);
	}

	private static List<OrderedDeclarationGroup> collapse(List<DeclarationStep> ordered) {
		List<OrderedDeclarationGroup> groups = new ArrayList<>();
		List<String> run = new ArrayList<>();
		String style = null;
		for (DeclarationStep step : ordered) {
			if (!run.isEmpty() && !Objects.equals(style, step.style())) {
				groups.add(new OrderedDeclarationGroup(style, run));
				run = new ArrayList<>();
			}
			style = step.style();
			run.add(step.envId());
		}
		if (!run.isEmpty()) {
			groups.add(new OrderedDeclarationGroup(style, run));
		}
		return Collections.unmodifiableList(groups);
	}

	public List<DeclarationStep> steps() {
		return steps;
	}

	public List<String> envIds() {
		return steps.stream().map(DeclarationStep::envId).toList();
	}

	public List<EnvironmentSpec> specs() {
		return steps.stream().map(DeclarationStep::spec).toList();
	}

	public List<OrderedDeclarationGroup> groups() {
		return groups;
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	/**
	 * One-line summary of the groups, e.g. {@code plain[thm, lemma] <default>[proof]}.
	 */
	public String describe() {
		if (groups.isEmpty()) {
			return "<empty>";
		}
		return groups.stream()
				.map(group -> (group.style() == null ? "<default>" : group.style()) + group.envIds())
				.collect(Collectors.joining(" "));
	}

	@Override
	public String toString() {
		return "DeclarationOrder " + describe();
	}
}
