package org.javai.theorems.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.theorems.counter.BlockOccurrence;
import org.javai.theorems.counter.CounterEngine;
import org.javai.theorems.counter.NumberedBlock;
import org.javai.theorems.env.EnvironmentGraph;
import org.javai.theorems.order.DeclarationOrder;
import org.javai.theorems.order.DeclarationOrderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentVisitor} for a single export. Numbers blocks as they are
 * visited, remembers which environments the document used and, on
 * {@link #finish()}, computes their declaration order.
 * <p>
 * A session owns fresh counter state. Start a new one for every export; a
 * finished session rejects further events.
 */
public final class NumberingSession implements DocumentVisitor {

	private static final Logger logger = LoggerFactory.getLogger(NumberingSession.class);

	private final CounterEngine counterEngine;
	private final DeclarationOrderer orderer;
	private final boolean declareDependencies;

	private final Set<String> usedEnvIds = new LinkedHashSet<>();
	private final List<NumberedBlock> blocks = new ArrayList<>();
	private final Map<String, NumberedBlock> labels = new LinkedHashMap<>();
	private List<Integer> currentSection = List.of();
	private boolean finished;

	private NumberingSession(Builder builder) {
		this.counterEngine = CounterEngine.forRun(builder.graph);
		this.orderer = builder.orderer != null ? builder.orderer : new DeclarationOrderer(builder.graph);
		this.declareDependencies = builder.declareDependencies;
	}

	public static NumberingSession start(EnvironmentGraph graph) {
		return builder(graph).start();
	}

	public static Builder builder(EnvironmentGraph graph) {
		return new Builder(graph);
	}

	@Override
	public void enterSection(List<Integer> sectionNumbers) {
		ensureOpen();
		currentSection = sectionNumbers == null ? List.of() : List.copyOf(sectionNumbers);
	}

	@Override
	public NumberedBlock visitBlock(String envId, String label) {
		ensureOpen();
		Objects.requireNonNull(envId, "envId must not be null");
		BlockOccurrence occurrence = new BlockOccurrence(envId, currentSection, label);
		if (occurrence.label() != null && labels.containsKey(occurrence.label())) {
			throw new IllegalStateException("Duplicate block label '%s'".formatted(occurrence.label()));
		}
		NumberedBlock block = counterEngine.number(occurrence);
		if (occurrence.label() != null) {
			labels.put(occurrence.label(), block);
		}
		usedEnvIds.add(envId);
		blocks.add(block);
		return block;
	}

	/**
	 * Ends the run and computes the declaration order of the used environments.
	 */
	public NumberingResult finish() {
		ensureOpen();
		finished = true;
		DeclarationOrder order = declareDependencies
				? orderer.orderWithDependencies(usedEnvIds)
				: orderer.order(usedEnvIds);
		logger.debug("Numbered {} blocks across {} environments", blocks.size(), usedEnvIds.size());
		return new NumberingResult(blocks, labels, order);
	}

	private void ensureOpen() {
		if (finished) {
			throw new IllegalStateException("Numbering session already finished; start a new session per export");
		}
	}

	public static final class Builder {

		private final EnvironmentGraph graph;
		private DeclarationOrderer orderer;
		private boolean declareDependencies;

		private Builder(EnvironmentGraph graph) {
			this.graph = Objects.requireNonNull(graph, "graph must not be null");
		}

		public Builder orderer(DeclarationOrderer orderer) {
			this.orderer = orderer;
			return this;
		}

		/**
		 * Also declare environments that used environments depend on but the
		 * document never references itself.
		 */
		public Builder declareDependencies(boolean declareDependencies) {
			this.declareDependencies = declareDependencies;
			return this;
		}

		public NumberingSession start() {
			return new NumberingSession(this);
		}
	}
}
