package io.prism.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Replacement of the text covered by a file range.
 *
 * @param location    the file range to replace
 * @param replacement the new text
 */
public record TextEdit(
	@Nonnull FileRange location,
	@Nonnull String replacement
) {

	public TextEdit {
		Objects.requireNonNull(location, "location must not be null");
		Objects.requireNonNull(replacement, "replacement must not be null");
	}
}
