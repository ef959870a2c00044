package org.javai.theorems.render;

import java.util.Objects;
import org.javai.theorems.counter.BlockNumber;
import org.javai.theorems.counter.NumberedBlock;
import org.javai.theorems.env.EnvironmentSpec;

/**
 * Everything a {@link BlockFormatter} needs to render one block. {@code style},
 * {@code number} and {@code label} may be {@code null}.
 */
public record BlockRendering(
		String blockType,
		String renderName,
		String displayName,
		String style,
		BlockNumber number,
		String label,
		String bodyText
) {

	public BlockRendering {
		Objects.requireNonNull(blockType, "blockType must not be null");
		Objects.requireNonNull(renderName, "renderName must not be null");
		Objects.requireNonNull(displayName, "displayName must not be null");
		bodyText = bodyText == null ? "" : bodyText;
	}

	public static BlockRendering of(NumberedBlock block, String bodyText) {
		Objects.requireNonNull(block, "block must not be null");
		EnvironmentSpec spec = block.spec();
		return new BlockRendering(
				spec.id(),
				spec.renderName(),
				spec.displayName(),
				spec.style(),
				block.number(),
				block.occurrence().label(),
				bodyText);
	}
}
