package io.prism.suggestion;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A text edit resolved to a byte range of one file's UTF-8 content.
 *
 * @param start       inclusive start offset
 * @param end         exclusive end offset
 * @param replacement the replacement text
 */
public record Replacement(
	int start,
	int end,
	@Nonnull String replacement
) {

	public Replacement {
		Objects.requireNonNull(replacement, "replacement must not be null");
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid replacement range: " + start + ".." + end);
		}
	}
}
