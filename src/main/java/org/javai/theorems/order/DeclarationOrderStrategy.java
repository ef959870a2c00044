package org.javai.theorems.order;

import java.util.List;

/**
 * Decides the sequence in which the environments of a document are declared.
 * Implementations must place every step after all of its dependencies.
 */
public interface DeclarationOrderStrategy {

	/**
	 * @param steps the working set, in configuration order
	 * @return the same steps in declaration order
	 * @throws org.javai.theorems.env.CyclicDependencyException if the
	 * dependencies admit no such order
	 */
	List<DeclarationStep> order(List<DeclarationStep> steps);
}
