package org.javai.theorems.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.theorems.env.EnvironmentGraph;
import org.javai.theorems.order.DeclarationOrder;
import org.javai.theorems.order.OrderedDeclarationGroup;

/**
 * Renders a {@link DeclarationOrder} into declaration text.
 * <p>
 * For each group the style switch is emitted once, followed by one declaration
 * per environment. Backends without style switches (declarative ones) pass no
 * template; groups without a style never emit a switch.
 */
public class PreambleEmitter {

	/** Style switch of the LaTeX amsthm package. */
	public static final String AMSTHM_STYLE_SWITCH = "\\theoremstyle{%s}";

	private final String switchTemplate;
	private final DeclarationWriter writer;

	/**
	 * @param switchTemplate format string receiving the style, or {@code null} to
	 * emit no switches
	 * @param writer produces each declaration line
	 */
	public PreambleEmitter(String switchTemplate, DeclarationWriter writer) {
		this.switchTemplate = switchTemplate;
		this.writer = Objects.requireNonNull(writer, "writer must not be null");
	}

	/**
	 * LaTeX emitter: amsthm style switches and {@link AmsthmDeclarationWriter}.
	 */
	public static PreambleEmitter amsthm() {
		return new PreambleEmitter(AMSTHM_STYLE_SWITCH, new AmsthmDeclarationWriter());
	}

	/**
	 * Emitter for backends that have no notion of a current style.
	 */
	public static PreambleEmitter declarative(DeclarationWriter writer) {
		return new PreambleEmitter(null, writer);
	}

	public List<String> emitLines(DeclarationOrder order, EnvironmentGraph graph) {
		Objects.requireNonNull(order, "order must not be null");
		Objects.requireNonNull(graph, "graph must not be null");
		List<String> lines = new ArrayList<>();
		for (OrderedDeclarationGroup group : order.groups()) {
			if (switchTemplate != null && group.style() != null) {
				lines.add(switchTemplate.formatted(group.style()));
			}
			for (String envId : group.envIds()) {
				lines.add(writer.declare(graph.spec(envId), graph));
			}
		}
		return lines;
	}

	public String emit(DeclarationOrder order, EnvironmentGraph graph) {
		return String.join("\n", emitLines(order, graph));
	}
}
