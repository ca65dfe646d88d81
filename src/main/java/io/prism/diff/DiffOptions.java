package io.prism.diff;

import javax.annotation.Nonnull;

/**
 * Settings of a tree comparison.
 *
 * @param contextLines    number of unchanged lines shown around each change
 * @param interhunkLines  maximum number of unchanged lines between two changes that still merge them into one hunk,
 *                        on top of the shared context
 * @param renameThreshold minimum similarity score (0-100) for a deleted and an added file to be paired as a rename
 * @param copyThreshold   minimum similarity score (0-100) for an added file to be reported as a copy of a base file
 */
public record DiffOptions(
	int contextLines,
	int interhunkLines,
	int renameThreshold,
	int copyThreshold
) {

	public static final int DEFAULT_CONTEXT_LINES = 3;
	public static final int DEFAULT_INTERHUNK_LINES = 0;
	public static final int DEFAULT_RENAME_THRESHOLD = 50;
	public static final int DEFAULT_COPY_THRESHOLD = 100;

	public DiffOptions {
		if (contextLines < 0) {
			throw new IllegalArgumentException("contextLines must be non-negative: " + contextLines);
		}
		if (interhunkLines < 0) {
			throw new IllegalArgumentException("interhunkLines must be non-negative: " + interhunkLines);
		}
		checkThreshold("renameThreshold", renameThreshold);
		checkThreshold("copyThreshold", copyThreshold);
	}

	/**
	 * Returns the default options: three lines of context, no inter-hunk lines, renames at 50% similarity and
	 * copies only for identical content.
	 *
	 * @return default options
	 */
	@Nonnull
	public static DiffOptions defaults() {
		return new DiffOptions(
			DEFAULT_CONTEXT_LINES, DEFAULT_INTERHUNK_LINES, DEFAULT_RENAME_THRESHOLD, DEFAULT_COPY_THRESHOLD
		);
	}

	@Nonnull
	public DiffOptions withContextLines(int contextLines) {
		return new DiffOptions(contextLines, this.interhunkLines, this.renameThreshold, this.copyThreshold);
	}

	@Nonnull
	public DiffOptions withThresholds(int renameThreshold, int copyThreshold) {
		return new DiffOptions(this.contextLines, this.interhunkLines, renameThreshold, copyThreshold);
	}

	private static void checkThreshold(@Nonnull String name, int value) {
		if (value < 0 || value > 100) {
			throw new IllegalArgumentException(name + " must be between 0 and 100: " + value);
		}
	}
}
