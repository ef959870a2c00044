/**
 * Environment configuration and its validated graph.
 * <p>
 * {@link org.javai.theorems.env.EnvironmentGraph} is built once per
 * configuration and answers counter-root and reset queries for the numbering
 * and ordering engines.
 */
package org.javai.theorems.env;
