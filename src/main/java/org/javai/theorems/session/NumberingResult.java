package org.javai.theorems.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.theorems.counter.BlockNumber;
import org.javai.theorems.counter.NumberedBlock;
import org.javai.theorems.order.DeclarationOrder;

/**
 * Outcome of one numbering run.
 *
 * @param blocks every visited block, in document order
 * @param labels labelled blocks by label
 * @param declarationOrder declaration order of the environments the document used
 */
public record NumberingResult(
		List<NumberedBlock> blocks,
		Map<String, NumberedBlock> labels,
		DeclarationOrder declarationOrder
) {

	public NumberingResult {
		blocks = List.copyOf(blocks);
		labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
		Objects.requireNonNull(declarationOrder, "declarationOrder must not be null");
	}

	/**
	 * Number of the block carrying the given label, for cross references.
	 */
	public Optional<BlockNumber> findNumber(String label) {
		return Optional.ofNullable(labels.get(label)).map(NumberedBlock::number);
	}
}
