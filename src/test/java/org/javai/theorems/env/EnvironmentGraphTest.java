package org.javai.theorems.env;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EnvironmentGraphTest {

	@Nested
	class Validation {

		@Test
		void rejectsUseAndResetOnTheSameEnvironment() {
			EnvironmentConfig config = EnvironmentConfig.builder()
					.add("thm", b -> b.reset("global"))
					.add("lemma", b -> b.use("thm").reset("section"))
					.build();

			assertThatThrownBy(() -> EnvironmentGraph.validate(config))
					.isInstanceOf(ConflictingSpecException.class)
					.hasMessageContaining("lemma");
		}

		@Test
		void rejectsUseOfUnknownEnvironment() {
			EnvironmentConfig config = EnvironmentConfig.builder()
					.add("lemma", b -> b.use("thm"))
					.build();

			assertThatThrownBy(() -> EnvironmentGraph.of(config))
					.isInstanceOfSatisfying(UndefinedReferenceException.class, e -> {
						assertThat(e.envId()).isEqualTo("lemma");
						assertThat(e.reference()).isEqualTo("thm");
					});
		}

		@Test
		void rejectsResetNamingUnknownEnvironment() {
			EnvironmentConfig config = EnvironmentConfig.builder()
					.add("claim", b -> b.reset("proposition"))
					.build();

			assertThatThrownBy(() -> EnvironmentGraph.of(config))
					.isInstanceOf(UndefinedReferenceException.class)
					.hasMessageContaining("proposition");
		}

		@Test
		void rejectsUseTargetWithoutOwnReset() {
			EnvironmentConfig config = EnvironmentConfig.builder()
					.add("remark", b -> b)
					.add("note", b -> b.use("remark"))
					.build();

			assertThatThrownBy(() -> EnvironmentGraph.of(config))
					.isInstanceOfSatisfying(MissingCounterRootException.class, e -> {
						assertThat(e.envId()).isEqualTo("note");
						assertThat(e.target()).isEqualTo("remark");
					});
		}

		@Test
		void rejectsResetTargetWithoutOwnReset() {
			EnvironmentConfig config = EnvironmentConfig.builder()
					.add("thm", b -> b.reset("global"))
					.add("lemma", b -> b.use("thm"))
					.add("claim", b -> b.reset("lemma"))
					.build();

			assertThatThrownBy(() -> EnvironmentGraph.of(config))
					.isInstanceOf(MissingCounterRootException.class)
					.hasMessageContaining("'claim' refers to 'lemma'");
		}

		@Test
		void reportsMutualUseAsCycle() {
			EnvironmentConfig config = EnvironmentConfig.builder()
					.add("a", b -> b.use("b"))
					.add("b", b -> b.use("a"))
					.build();

			assertThatThrownBy(() -> EnvironmentGraph.of(config))
					.isInstanceOfSatisfying(CyclicDependencyException.class,
							e -> assertThat(e.envIds()).containsExactly("a", "b", "a"));
		}

		@Test
		void reportsSelfResetAsCycle() {
			EnvironmentConfig config = EnvironmentConfig.builder()
					.add("thm", b -> b.reset(new ResetRule.OtherEnv("thm")))
					.build();

			assertThatThrownBy(() -> EnvironmentGraph.of(config))
					.isInstanceOf(CyclicDependencyException.class);
		}

		@Test
		void acceptsUnnumberedEnvironments() {
			EnvironmentConfig config = EnvironmentConfig.builder()
					.add("proof", b -> b)
					.build();

			EnvironmentGraph graph = EnvironmentGraph.of(config);

			assertThat(graph.isNumbered("proof")).isFalse();
		}
	}

	@Nested
	class RootResolution {

		private final EnvironmentGraph graph = EnvironmentGraph.of(EnvironmentConfig.builder()
				.add("thm", b -> b.reset("section"))
				.add("lemma", b -> b.use("thm"))
				.add("corollary", b -> b.reset("thm"))
				.add("definition", b -> b.reset("global"))
				.add("proof", b -> b)
				.build());

		@Test
		void environmentWithResetIsItsOwnRoot() {
			assertThat(graph.resolveRootCounter("thm")).isEqualTo("thm");
			assertThat(graph.isCounterRoot("thm")).isTrue();
		}

		@Test
		void useResolvesToTheSharedCounter() {
			assertThat(graph.resolveRootCounter("lemma")).isEqualTo("thm");
			assertThat(graph.isCounterRoot("lemma")).isFalse();
		}

		@Test
		void everyNumberedEnvironmentResolvesToAnEnvironmentWithReset() {
			for (String envId : graph.config().ids()) {
				if (graph.isNumbered(envId)) {
					assertThat(graph.spec(graph.resolveRootCounter(envId)).reset()).isNotNull();
				}
			}
		}

		@Test
		void unnumberedEnvironmentHasNoRoot() {
			assertThatThrownBy(() -> graph.resolveRootCounter("proof"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("not numbered");
		}

		@Test
		void unknownEnvironmentIsAnUndefinedReference() {
			assertThatThrownBy(() -> graph.resolveRootCounter("axiom"))
					.isInstanceOf(UndefinedReferenceException.class)
					.hasMessageContaining("axiom");
		}

		@Test
		void effectiveResetFollowsTheRoot() {
			assertThat(graph.resolveEffectiveReset("lemma")).isEqualTo(new ResetRule.SectionLevel(1));
			assertThat(graph.resolveEffectiveReset("definition")).isEqualTo(ResetRule.Global.INSTANCE);
			assertThat(graph.resolveEffectiveReset("corollary")).isEqualTo(new ResetRule.OtherEnv("thm"));
		}

		@Test
		void dependenciesListUseAndResetTargets() {
			assertThat(graph.dependencies("lemma")).containsExactly("thm");
			assertThat(graph.dependencies("corollary")).containsExactly("thm");
			assertThat(graph.dependencies("thm")).isEmpty();
		}
	}
}
