package io.prism.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Represents a single line in a diff hunk.
 * Context lines carry both line numbers, additions only the head line and deletions only the base line.
 *
 * @param kind       the role of the line (context, addition or deletion)
 * @param text       the line text without the trailing line terminator
 * @param baseLine   1-based line number on the base side, if the line exists there
 * @param headLine   1-based line number on the head side, if the line exists there
 * @param highlights intraline highlights, empty when not computed
 */
public record DiffLine(
	@Nonnull DiffLineKind kind,
	@Nonnull String text,
	@Nullable Integer baseLine,
	@Nullable Integer headLine,
	@Nonnull List<LineHighlight> highlights
) {

	/**
	 * Creates a new DiffLine with validation of the line number invariant.
	 */
	public DiffLine {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(text, "text must not be null");
		highlights = highlights == null ? List.of() : List.copyOf(highlights);
		switch (kind) {
			case CONTEXT -> {
				if (baseLine == null || headLine == null) {
					throw new IllegalArgumentException("context line requires both line numbers");
				}
			}
			case ADDITION -> {
				if (baseLine != null || headLine == null) {
					throw new IllegalArgumentException("addition line requires only a head line number");
				}
			}
			case DELETION -> {
				if (baseLine == null || headLine != null) {
					throw new IllegalArgumentException("deletion line requires only a base line number");
				}
			}
		}
	}

	/**
	 * Creates a context line.
	 *
	 * @param text     the line text
	 * @param baseLine base side line number
	 * @param headLine head side line number
	 * @return a new context DiffLine
	 */
	@Nonnull
	public static DiffLine context(@Nonnull String text, int baseLine, int headLine) {
		return new DiffLine(DiffLineKind.CONTEXT, text, baseLine, headLine, List.of());
	}

	/**
	 * Creates an addition line.
	 *
	 * @param text     the line text
	 * @param headLine head side line number
	 * @return a new addition DiffLine
	 */
	@Nonnull
	public static DiffLine addition(@Nonnull String text, int headLine) {
		return new DiffLine(DiffLineKind.ADDITION, text, null, headLine, List.of());
	}

	/**
	 * Creates a deletion line.
	 *
	 * @param text     the line text
	 * @param baseLine base side line number
	 * @return a new deletion DiffLine
	 */
	@Nonnull
	public static DiffLine deletion(@Nonnull String text, int baseLine) {
		return new DiffLine(DiffLineKind.DELETION, text, baseLine, null, List.of());
	}

	@JsonIgnore
	public boolean isAddition() {
		return this.kind == DiffLineKind.ADDITION;
	}

	@JsonIgnore
	public boolean isDeletion() {
		return this.kind == DiffLineKind.DELETION;
	}
}
