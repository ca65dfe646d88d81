package io.prism.suggestion;

import io.prism.model.DiffSide;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Exception thrown when a suggestion cannot be previewed or applied.
 * The {@link Reason} tells callers which validation or I/O step failed.
 */
public final class SuggestionException extends Exception {

	/**
	 * Failure kinds of suggestion processing.
	 */
	public enum Reason {
		ABSOLUTE_PATH,
		PATH_TRAVERSAL,
		MISSING_FILE,
		UNSUPPORTED_SIDE,
		LINE_OUT_OF_BOUNDS,
		COLUMN_OUT_OF_BOUNDS,
		INVALID_RANGE,
		OVERLAPPING_EDITS,
		INVALID_REPLACEMENT,
		IO,
		STAGING
	}

	@Nonnull
	private final Reason reason;
	@Nonnull
	private final String path;
	private final int line;
	private final int column;

	private SuggestionException(
		@Nonnull Reason reason,
		@Nonnull String path,
		int line,
		int column,
		@Nonnull String message,
		@Nullable Throwable cause
	) {
		super(message, cause);
		this.reason = Objects.requireNonNull(reason, "reason must not be null");
		this.path = Objects.requireNonNull(path, "path must not be null");
		this.line = line;
		this.column = column;
	}

	@Nonnull
	static SuggestionException absolutePath(@Nonnull String path) {
		return new SuggestionException(Reason.ABSOLUTE_PATH, path, 0, 0,
			"Suggestion path must be relative: " + path, null);
	}

	@Nonnull
	static SuggestionException pathTraversal(@Nonnull String path) {
		return new SuggestionException(Reason.PATH_TRAVERSAL, path, 0, 0,
			"Suggestion path must not contain parent segments: " + path, null);
	}

	@Nonnull
	static SuggestionException missingFile(@Nonnull String path) {
		return new SuggestionException(Reason.MISSING_FILE, path, 0, 0,
			"Suggestion references missing file: " + path, null);
	}

	@Nonnull
	static SuggestionException unsupportedSide(@Nonnull String path, @Nonnull DiffSide side) {
		return new SuggestionException(Reason.UNSUPPORTED_SIDE, path, 0, 0,
			"Suggestion edits for " + path + " must target the diff head, found " + side, null);
	}

	@Nonnull
	static SuggestionException lineOutOfBounds(@Nonnull String path, int line) {
		return new SuggestionException(Reason.LINE_OUT_OF_BOUNDS, path, line, 0,
			"Line " + line + " is out of bounds for " + describe(path), null);
	}

	@Nonnull
	static SuggestionException columnOutOfBounds(@Nonnull String path, int line, int column) {
		return new SuggestionException(Reason.COLUMN_OUT_OF_BOUNDS, path, line, column,
			"Column " + column + " on line " + line + " is out of bounds for " + describe(path), null);
	}

	@Nonnull
	static SuggestionException invalidRange(@Nonnull String path, int start, int end) {
		return new SuggestionException(Reason.INVALID_RANGE, path, 0, 0,
			"Suggestion range is invalid in " + path + " (start " + start + " > end " + end + ")", null);
	}

	@Nonnull
	static SuggestionException overlappingEdits(@Nonnull String path) {
		return new SuggestionException(Reason.OVERLAPPING_EDITS, path, 0, 0,
			"Suggestion edits overlap in " + path, null);
	}

	@Nonnull
	static SuggestionException invalidReplacement(@Nonnull String path, int index) {
		return new SuggestionException(Reason.INVALID_REPLACEMENT, path, 0, 0,
			"Suggestion replacement for " + path + " has an unpaired surrogate at index " + index, null);
	}

	@Nonnull
	static SuggestionException io(@Nonnull String path, @Nonnull String operation, @Nonnull Throwable cause) {
		return new SuggestionException(Reason.IO, path, 0, 0,
			"Failed to " + operation + " " + path + ": " + cause.getMessage(), cause);
	}

	@Nonnull
	static SuggestionException staging(@Nonnull String path, @Nonnull Throwable cause) {
		return new SuggestionException(Reason.STAGING, path, 0, 0,
			"Failed to stage " + path + " in index: " + cause.getMessage(), cause);
	}

	/**
	 * Returns a copy of a position error attributed to the given file.
	 *
	 * @param path the file the position was resolved against
	 * @return the same error with its path set
	 */
	@Nonnull
	SuggestionException withPath(@Nonnull String path) {
		return switch (this.reason) {
			case LINE_OUT_OF_BOUNDS -> lineOutOfBounds(path, this.line);
			case COLUMN_OUT_OF_BOUNDS -> columnOutOfBounds(path, this.line, this.column);
			default -> this;
		};
	}

	@Nonnull
	private static String describe(@Nonnull String path) {
		return path.isEmpty() ? "<text>" : path;
	}

	@Nonnull
	public Reason getReason() {
		return this.reason;
	}

	/**
	 * Returns the suggestion path the failure relates to.
	 *
	 * @return relative path, empty if the failure was raised outside of a file context
	 */
	@Nonnull
	public String getPath() {
		return this.path;
	}

	/**
	 * Returns the requested line for position errors.
	 *
	 * @return 1-based line, or 0 if not applicable
	 */
	public int getLine() {
		return this.line;
	}

	/**
	 * Returns the requested column for column errors.
	 *
	 * @return 1-based column, or 0 if not applicable
	 */
	public int getColumn() {
		return this.column;
	}
}
