package io.prism.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A range between two positions, start inclusive and end exclusive.
 *
 * @param start inclusive start position
 * @param end   exclusive end position
 */
public record Range(
	@Nonnull Position start,
	@Nonnull Position end
) {

	public Range {
		Objects.requireNonNull(start, "start must not be null");
		Objects.requireNonNull(end, "end must not be null");
	}
}
