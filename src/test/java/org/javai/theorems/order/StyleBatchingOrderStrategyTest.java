package org.javai.theorems.order;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import java.util.Set;
import org.javai.theorems.env.CyclicDependencyException;
import org.javai.theorems.env.EnvironmentSpec;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StyleBatchingOrderStrategyTest {

	private final StyleBatchingOrderStrategy strategy = new StyleBatchingOrderStrategy();

	@Nested
	class NoDependencies {

		@Test
		void preservesInputOrderWithinOneStyle() {
			List<DeclarationStep> steps = List.of(
					step("a", "plain"),
					step("b", "plain"),
					step("c", "plain"));

			assertThat(strategy.order(steps)).extracting(DeclarationStep::envId)
					.containsExactly("a", "b", "c");
		}

		@Test
		void pullsMatchingStylesForward() {
			List<DeclarationStep> steps = List.of(
					step("a", "plain"),
					step("b", "definition"),
					step("c", "plain"),
					step("d", "definition"));

			assertThat(strategy.order(steps)).extracting(DeclarationStep::envId)
					.containsExactly("a", "c", "b", "d");
		}
	}

	@Nested
	class WithDependencies {

		@Test
		void dependencyOutranksStylePreference() {
			List<DeclarationStep> steps = List.of(
					step("lemma", "plain", "definition"),
					step("thm", "plain"),
					step("definition", "definition"));

			assertThat(strategy.order(steps)).extracting(DeclarationStep::envId)
					.containsExactly("thm", "definition", "lemma");
		}

		@Test
		void detectsCycles() {
			List<DeclarationStep> steps = List.of(
					step("a", null, "b"),
					step("b", null, "a"));

			assertThatThrownBy(() -> strategy.order(steps))
					.isInstanceOf(CyclicDependencyException.class)
					.hasMessageContaining("Cycle detected");
		}

		@Test
		void rejectsDependenciesOnUndeclaredEnvironments() {
			List<DeclarationStep> steps = List.of(step("a", null, "ghost"));

			assertThatThrownBy(() -> strategy.order(steps))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("ghost");
		}

		@Test
		void rejectsSelfDependency() {
			assertThatThrownBy(() -> step("a", null, "a"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("cannot depend on itself");
		}
	}

	private DeclarationStep step(String id, String style, String... dependsOn) {
		return new DeclarationStep(EnvironmentSpec.builder(id).style(style).build(), Set.of(dependsOn));
	}
}
