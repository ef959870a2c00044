package org.javai.theorems.render;

import org.javai.theorems.env.EnvironmentGraph;
import org.javai.theorems.env.EnvironmentSpec;

/**
 * Produces the declaration line of one environment. The default is
 * {@link AmsthmDeclarationWriter}; a custom writer can be supplied through
 * {@link PreambleEmitter}.
 */
@FunctionalInterface
public interface DeclarationWriter {

	/**
	 * @param spec environment being declared
	 * @param graph resolved configuration, for looking up referenced environments
	 * @return one declaration line, without a trailing newline
	 */
	String declare(EnvironmentSpec spec, EnvironmentGraph graph);
}
