package io.prism.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Represents a single hunk of a file diff: a contiguous block of changed lines with surrounding context.
 *
 * @param header  the line ranges of the hunk on both sides
 * @param section optional section label (e.g. enclosing function signature) taken from the hunk header
 * @param lines   the lines of the hunk in emission order
 */
public record DiffHunk(
	@Nonnull DiffRange header,
	@Nullable String section,
	@Nonnull List<DiffLine> lines
) {

	/**
	 * Creates a new DiffHunk with validation.
	 */
	public DiffHunk {
		Objects.requireNonNull(header, "header must not be null");
		lines = lines == null ? List.of() : List.copyOf(lines);
	}

	/**
	 * Returns the number of lines added by this hunk.
	 *
	 * @return count of ADDITION lines
	 */
	public int additions() {
		return (int) this.lines.stream()
			.filter(DiffLine::isAddition)
			.count();
	}

	/**
	 * Returns the number of lines removed by this hunk.
	 *
	 * @return count of DELETION lines
	 */
	public int deletions() {
		return (int) this.lines.stream()
			.filter(DiffLine::isDeletion)
			.count();
	}
}
