package org.javai.theorems.render;

/**
 * Formats a block as {@code "Theorem 2.1. body"}, or {@code "Remark. body"}
 * when it carries no number. The number separator is configurable.
 */
public class PlainTextBlockFormatter implements BlockFormatter {

	private final String separator;

	public PlainTextBlockFormatter() {
		this(".");
	}

	public PlainTextBlockFormatter(String separator) {
		this.separator = separator;
	}

	@Override
	public String format(BlockRendering rendering) {
		StringBuilder sb = new StringBuilder(rendering.displayName());
		if (rendering.number() != null) {
			sb.append(' ').append(rendering.number().format(separator));
		}
		sb.append('.');
		if (!rendering.bodyText().isEmpty()) {
			sb.append(' ').append(rendering.bodyText());
		}
		return sb.toString();
	}
}
