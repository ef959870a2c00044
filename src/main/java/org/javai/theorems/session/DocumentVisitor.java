package org.javai.theorems.session;

import java.util.List;
import org.javai.theorems.counter.NumberedBlock;

/**
 * Callbacks a document traversal issues while walking a document depth first.
 * Implementations never block or schedule work; each call completes before the
 * traversal moves on.
 */
public interface DocumentVisitor {

	/**
	 * Reports that the traversal entered a section.
	 *
	 * @param sectionNumbers full number path of the section, e.g. {@code [2, 1]};
	 * an empty list means the traversal left all sections
	 */
	void enterSection(List<Integer> sectionNumbers);

	/**
	 * Reports a block occurrence.
	 *
	 * @param envId environment of the block
	 * @param label optional raw label, {@code null} if absent
	 * @return the block with its number, if its environment is numbered
	 */
	NumberedBlock visitBlock(String envId, String label);

	default NumberedBlock visitBlock(String envId) {
		return visitBlock(envId, null);
	}
}
