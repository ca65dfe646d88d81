package io.prism.model;

/**
 * Intraline highlight of a diff line.
 *
 * @param startColumn zero-based column where the highlight begins (inclusive)
 * @param endColumn   zero-based column where the highlight ends (exclusive)
 */
public record LineHighlight(
	int startColumn,
	int endColumn
) {

	public LineHighlight {
		if (startColumn < 0 || endColumn < startColumn) {
			throw new IllegalArgumentException(
				"Invalid highlight bounds: " + startColumn + ".." + endColumn
			);
		}
	}
}
