package io.prism.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A range within a single file on one side of a diff.
 *
 * @param path  path relative to the repository root
 * @param side  the diff side the range targets
 * @param range line and column span
 */
public record FileRange(
	@Nonnull String path,
	@Nonnull DiffSide side,
	@Nonnull Range range
) {

	public FileRange {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(side, "side must not be null");
		Objects.requireNonNull(range, "range must not be null");
	}
}
