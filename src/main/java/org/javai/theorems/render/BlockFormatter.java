package org.javai.theorems.render;

/**
 * Turns a numbered block into backend text. Implementations are pure functions
 * chosen by the caller per run; backend syntax is entirely their concern.
 */
@FunctionalInterface
public interface BlockFormatter {

	String format(BlockRendering rendering);
}
