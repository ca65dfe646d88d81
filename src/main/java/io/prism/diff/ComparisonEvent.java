package io.prism.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Event of the ordered stream a backend produces for a tree comparison. For every file the
 * stream holds a {@link FileStarted} event, optionally a {@link BinaryDetected} event, and then
 * {@link HunkStarted} events each followed by the {@link Line} events of that hunk.
 */
public sealed interface ComparisonEvent
	permits ComparisonEvent.FileStarted, ComparisonEvent.BinaryDetected, ComparisonEvent.HunkStarted, ComparisonEvent.Line {

	/**
	 * Start of a new file.
	 *
	 * @param kind      change kind reported by the backend
	 * @param oldPath   path on the old side, null if the file does not exist there
	 * @param newPath   path on the new side, null if the file does not exist there
	 * @param oldBinary true if the old side content is binary
	 * @param newBinary true if the new side content is binary
	 */
	record FileStarted(
		@Nonnull DeltaKind kind,
		@Nullable String oldPath,
		@Nullable String newPath,
		boolean oldBinary,
		boolean newBinary
	) implements ComparisonEvent {

		public FileStarted {
			Objects.requireNonNull(kind, "kind must not be null");
			if (oldPath == null && newPath == null) {
				throw new IllegalArgumentException("at least one of oldPath and newPath must be set");
			}
		}
	}

	/**
	 * The current file was found to have binary content.
	 */
	record BinaryDetected() implements ComparisonEvent {
	}

	/**
	 * Start of a new hunk in the current file.
	 *
	 * @param oldStart  start line on the old side
	 * @param oldLines  number of old lines
	 * @param newStart  start line on the new side
	 * @param newLines  number of new lines
	 * @param rawHeader raw bytes of the hunk header line, including any trailing section text
	 */
	record HunkStarted(
		int oldStart,
		int oldLines,
		int newStart,
		int newLines,
		@Nonnull byte[] rawHeader
	) implements ComparisonEvent {

		public HunkStarted {
			Objects.requireNonNull(rawHeader, "rawHeader must not be null");
		}
	}

	/**
	 * A line of the current hunk.
	 *
	 * @param origin        origin code of the line
	 * @param content       raw bytes of the line, possibly including the line terminator
	 * @param oldLineNumber 1-based old side line number, if the line exists there
	 * @param newLineNumber 1-based new side line number, if the line exists there
	 */
	record Line(
		@Nonnull LineOrigin origin,
		@Nonnull byte[] content,
		@Nullable Integer oldLineNumber,
		@Nullable Integer newLineNumber
	) implements ComparisonEvent {

		public Line {
			Objects.requireNonNull(origin, "origin must not be null");
			Objects.requireNonNull(content, "content must not be null");
		}
	}
}
