package org.javai.theorems.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;
import java.util.List;
import org.javai.theorems.env.EnvironmentConfig;
import org.javai.theorems.env.EnvironmentGraph;
import org.javai.theorems.env.EnvironmentSpec;
import org.javai.theorems.order.DeclarationOrder;
import org.javai.theorems.order.DeclarationOrderer;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PreambleEmitterTest {

	private final EnvironmentGraph graph = EnvironmentGraph.of(EnvironmentConfig.builder()
			.add("theorem", b -> b.renderName("thm").reset("section").style("plain"))
			.add("lemma", b -> b.use("theorem").style("plain"))
			.add("definition", b -> b.reset("global").style("definition"))
			.add("proof", b -> b)
			.build());

	private final DeclarationOrder order = new DeclarationOrderer(graph)
			.order(List.of("proof", "definition", "lemma", "theorem"));

	@Mock
	private DeclarationWriter writer;

	@Nested
	class Amsthm {

		@Test
		void emitsOneSwitchPerStyleGroup() {
			String preamble = PreambleEmitter.amsthm().emit(order, graph);

			assertThat(preamble).isEqualTo(String.join("\n",
					"\\theoremstyle{plain}",
					"\\newtheorem{thm}{Theorem}[section]",
					"\\newtheorem{lemma}[thm]{Lemma}",
					"\\theoremstyle{definition}",
					"\\newtheorem{definition}{Definition}",
					"\\newtheorem*{proof}{Proof}"));
		}
	}

	@Nested
	class CustomWriter {

		@Test
		void delegatesEachDeclarationInOrder() {
			when(writer.declare(any(), any())).thenAnswer(invocation ->
					"declare " + invocation.<EnvironmentSpec>getArgument(0).id());

			List<String> lines = new PreambleEmitter("%% style %s", writer).emitLines(order, graph);

			assertThat(lines).containsExactly(
					"% style plain",
					"declare theorem",
					"declare lemma",
					"% style definition",
					"declare definition",
					"declare proof");
			InOrder inOrder = inOrder(writer);
			for (String envId : List.of("theorem", "lemma", "definition", "proof")) {
				inOrder.verify(writer).declare(argThat(spec -> spec.id().equals(envId)), any());
			}
		}

		@Test
		void declarativeBackendsEmitNoSwitches() {
			when(writer.declare(any(), any())).thenReturn("decl");

			List<String> lines = PreambleEmitter.declarative(writer).emitLines(order, graph);

			assertThat(lines).containsExactly("decl", "decl", "decl", "decl");
		}
	}
}
