package io.prism.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import javax.annotation.Nullable;

/**
 * A 1-based line and optional 1-based column. A missing column means the start of the line.
 *
 * @param line   1-based line number
 * @param column 1-based column counted in Unicode scalar values, or null for column 1
 */
public record Position(
	int line,
	@Nullable Integer column
) {

	/**
	 * Creates a position at the start of a line.
	 *
	 * @param line 1-based line number
	 * @return position with no explicit column
	 */
	public static Position of(int line) {
		return new Position(line, null);
	}

	public static Position of(int line, int column) {
		return new Position(line, column);
	}

	/**
	 * Returns the column, defaulting to 1 when none was given.
	 *
	 * @return effective 1-based column
	 */
	@JsonIgnore
	public int effectiveColumn() {
		return this.column == null ? 1 : this.column;
	}
}
