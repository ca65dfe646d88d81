package io.prism.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Suggested change made of one or more text edits, possibly spanning several files.
 *
 * @param title human-friendly title, if any
 * @param edits the individual edits
 */
public record Suggestion(
	@Nullable String title,
	@Nonnull List<TextEdit> edits
) {

	public Suggestion {
		edits = edits == null ? List.of() : List.copyOf(edits);
	}
}
