package io.prism.diff;

import io.prism.model.DiffLineKind;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Origin of a line reported by the backend, following the line origins of git patch output.
 */
public enum LineOrigin {

	/**
	 * Unchanged context line.
	 */
	CONTEXT,

	/**
	 * Line present only on the new side.
	 */
	ADDITION,

	/**
	 * Line present only on the old side.
	 */
	DELETION,

	/**
	 * Both sides lack a newline at end of file.
	 */
	CONTEXT_EOF_NEWLINE,

	/**
	 * Old side has a newline at end of file, new side does not.
	 */
	ADDITION_EOF_NEWLINE,

	/**
	 * Old side lacks a newline at end of file, new side has one.
	 */
	DELETION_EOF_NEWLINE,

	/**
	 * File header line.
	 */
	FILE_HEADER,

	/**
	 * Hunk header line.
	 */
	HUNK_HEADER,

	/**
	 * Binary content marker.
	 */
	BINARY;

	/**
	 * Maps this origin to the kind of diff line it produces. Line-ending markers and
	 * structural origins produce no diff line.
	 *
	 * @return the diff line kind, or empty for origins that carry no line
	 */
	@Nonnull
	public Optional<DiffLineKind> toLineKind() {
		return switch (this) {
			case CONTEXT -> Optional.of(DiffLineKind.CONTEXT);
			case ADDITION -> Optional.of(DiffLineKind.ADDITION);
			case DELETION -> Optional.of(DiffLineKind.DELETION);
			default -> Optional.empty();
		};
	}
}
