package org.javai.theorems.counter;

import java.util.List;
import java.util.Objects;
import org.javai.theorems.env.EnvironmentGraph;
import org.javai.theorems.env.EnvironmentSpec;
import org.javai.theorems.env.ResetRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns hierarchical numbers to block occurrences of one document run.
 * <p>
 * Occurrences must be fed in document order. Within one {@link CounterKey}
 * the numbers are consecutive integers starting at 1. The caller supplies the
 * enclosing section numbers with every occurrence; the engine does not track
 * section boundaries itself.
 * <p>
 * An engine holds the counter state of a single run and must not be reused for
 * another export, not even of the same document. Create one per run with
 * {@link #forRun(EnvironmentGraph)}.
 */
public final class CounterEngine {

	private static final Logger logger = LoggerFactory.getLogger(CounterEngine.class);

	/** Scope used when no enclosing section or referenced number exists. */
	static final List<Integer> FALLBACK_SCOPE = List.of(0);

	private final EnvironmentGraph graph;
	private final CounterState state = new CounterState();

	private CounterEngine(EnvironmentGraph graph) {
		this.graph = Objects.requireNonNull(graph, "graph must not be null");
	}

	public static CounterEngine forRun(EnvironmentGraph graph) {
		return new CounterEngine(graph);
	}

	public EnvironmentGraph graph() {
		return graph;
	}

	/**
	 * Numbers one occurrence of a numbered environment.
	 *
	 * @param envId environment of the occurrence
	 * @param sectionNumbers enclosing section path, empty outside any section
	 * @return the assigned number
	 * @throws IllegalArgumentException if the environment is unnumbered
	 */
	public BlockNumber processOccurrence(String envId, List<Integer> sectionNumbers) {
		Objects.requireNonNull(envId, "envId must not be null");
		List<Integer> sections = sectionNumbers == null ? List.of() : sectionNumbers;

		String root = graph.resolveRootCounter(envId);
		ResetRule rule = graph.resolveEffectiveReset(envId);
		CounterKey key = new CounterKey(root, scopePrefix(envId, rule, sections));

		BlockNumber number = BlockNumber.within(key.scopePrefix(), state.increment(key));
		if (graph.isCounterRoot(envId)) {
			state.recordRootNumber(root, number);
		}
		logger.trace("Numbered '{}' in {} as {}", envId, key, number);
		return number;
	}

	/**
	 * Numbers an occurrence if its environment is numbered; occurrences of
	 * unnumbered environments come back without a number.
	 */
	public NumberedBlock number(BlockOccurrence occurrence) {
		Objects.requireNonNull(occurrence, "occurrence must not be null");
		EnvironmentSpec spec = graph.spec(occurrence.envId());
		if (!spec.isNumbered()) {
			return new NumberedBlock(occurrence, spec, null);
		}
		return new NumberedBlock(occurrence, spec, processOccurrence(occurrence.envId(), occurrence.sectionNumbers()));
	}

	private List<Integer> scopePrefix(String envId, ResetRule rule, List<Integer> sections) {
		if (rule instanceof ResetRule.Global) {
			return List.of();
		}
		if (rule instanceof ResetRule.SectionLevel level) {
			return sectionPrefix(sections, level.level());
		}
		if (rule instanceof ResetRule.SectionDeepest) {
			return sections.isEmpty() ? FALLBACK_SCOPE : sections;
		}
		if (rule instanceof ResetRule.OtherEnv other) {
			return state.lastRootNumber(other.envId())
					.map(BlockNumber::parts)
					.orElseGet(() -> {
						logger.debug("'{}' resets on '{}', which has not been numbered yet; counting from {}",
								envId, other.envId(), FALLBACK_SCOPE);
						return FALLBACK_SCOPE;
					});
		}
		throw new IllegalStateException("Unsupported reset rule: " + rule);
	}

	/**
	 * Section path truncated to its first {@code level} numbers. A shallower path
	 * is used as it is, so a subsection-scoped block directly under section 3
	 * counts as 3.n.
	 */
	static List<Integer> sectionPrefix(List<Integer> sections, int level) {
		if (sections.isEmpty()) {
			return FALLBACK_SCOPE;
		}
		return List.copyOf(sections.subList(0, Math.min(level, sections.size())));
	}
}
