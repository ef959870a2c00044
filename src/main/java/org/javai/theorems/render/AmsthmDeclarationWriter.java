package org.javai.theorems.render;

import java.util.List;
import org.javai.theorems.env.EnvironmentGraph;
import org.javai.theorems.env.EnvironmentSpec;
import org.javai.theorems.env.ResetRule;

/**
 * Declares environments with the LaTeX {@code amsthm} commands:
 * <ul>
 *   <li>unnumbered: {@code \newtheorem*{name}{Display}}</li>
 *   <li>shared counter: {@code \newtheorem{name}[shared]{Display}}</li>
 *   <li>global: {@code \newtheorem{name}{Display}}</li>
 *   <li>section scoped: {@code \newtheorem{name}{Display}[subsection]}</li>
 *   <li>reset by another environment: {@code \newtheorem{name}{Display}[other]}</li>
 * </ul>
 * LaTeX has no counter for "the deepest enclosing section", so
 * {@link ResetRule.SectionDeepest} is declared against {@code subsubsection}.
 */
public class AmsthmDeclarationWriter implements DeclarationWriter {

	private static final List<String> SECTION_COUNTERS =
			List.of("section", "subsection", "subsubsection", "paragraph", "subparagraph");

	@Override
	public String declare(EnvironmentSpec spec, EnvironmentGraph graph) {
		if (!spec.isNumbered()) {
			return "\\newtheorem*{%s}{%s}".formatted(spec.renderName(), spec.displayName());
		}
		if (spec.use() != null) {
			return "\\newtheorem{%s}[%s]{%s}".formatted(
					spec.renderName(), graph.spec(spec.use()).renderName(), spec.displayName());
		}
		String parent = parentCounter(spec.reset(), graph);
		if (parent == null) {
			return "\\newtheorem{%s}{%s}".formatted(spec.renderName(), spec.displayName());
		}
		return "\\newtheorem{%s}{%s}[%s]".formatted(spec.renderName(), spec.displayName(), parent);
	}

	private String parentCounter(ResetRule reset, EnvironmentGraph graph) {
		if (reset instanceof ResetRule.SectionLevel level) {
			return SECTION_COUNTERS.get(Math.min(level.level(), SECTION_COUNTERS.size()) - 1);
		}
		if (reset instanceof ResetRule.SectionDeepest) {
			return SECTION_COUNTERS.get(2);
		}
		if (reset instanceof ResetRule.OtherEnv other) {
			return graph.spec(other.envId()).renderName();
		}
		return null;
	}
}
