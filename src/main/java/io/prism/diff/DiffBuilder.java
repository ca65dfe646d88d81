package io.prism.diff;

import io.prism.model.Diff;
import io.prism.model.DiffFile;
import io.prism.model.DiffHunk;
import io.prism.model.DiffLine;
import io.prism.model.DiffLineKind;
import io.prism.model.DiffRange;
import io.prism.model.DiffStats;
import io.prism.model.FileStatus;
import io.prism.model.RevisionRange;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds an ordered stream of {@link ComparisonEvent}s into a {@link Diff}.
 *
 * Files, hunks and lines keep the order in which the backend reported them. Binary files never
 * carry hunks, even when hunk events arrived before the binary marker. Line events outside of a
 * hunk are ignored.
 *
 * A builder holds the state of a single fold and is not meant to be shared.
 */
public final class DiffBuilder {

	private final List<DiffFile> files = new ArrayList<>();
	@Nullable
	private FileAccumulator current;

	/**
	 * Folds all events of an iterator into a diff for the given range.
	 *
	 * @param range  the compared revisions
	 * @param events the comparison events in backend order
	 * @return the assembled diff
	 */
	@Nonnull
	public static Diff fold(@Nonnull RevisionRange range, @Nonnull Iterator<ComparisonEvent> events) {
		Objects.requireNonNull(events, "events must not be null");
		final DiffBuilder builder = new DiffBuilder();
		while (events.hasNext()) {
			builder.accept(events.next());
		}
		return builder.build(range);
	}

	/**
	 * Consumes the next event of the stream.
	 *
	 * @param event the event
	 * @return this builder
	 */
	@Nonnull
	public DiffBuilder accept(@Nonnull ComparisonEvent event) {
		Objects.requireNonNull(event, "event must not be null");
		if (event instanceof ComparisonEvent.FileStarted fileStarted) {
			startFile(fileStarted);
		} else if (event instanceof ComparisonEvent.BinaryDetected) {
			markBinary();
		} else if (event instanceof ComparisonEvent.HunkStarted hunkStarted) {
			startHunk(hunkStarted);
		} else if (event instanceof ComparisonEvent.Line line) {
			addLine(line);
		}
		return this;
	}

	/**
	 * Finishes the fold and returns the diff.
	 *
	 * @param range the compared revisions
	 * @return the assembled diff
	 */
	@Nonnull
	public Diff build(@Nonnull RevisionRange range) {
		Objects.requireNonNull(range, "range must not be null");
		finishFile();
		return new Diff(range, this.files);
	}

	private void startFile(@Nonnull ComparisonEvent.FileStarted event) {
		finishFile();
		final FileStatus status = StatusClassifier.classify(event.kind());
		final String path = StatusClassifier.canonicalPath(status, event.oldPath(), event.newPath());
		final String oldPath = StatusClassifier.originalPath(status, event.oldPath(), path);
		this.current = new FileAccumulator(path, oldPath, status, event.oldBinary() || event.newBinary());
	}

	private void markBinary() {
		if (this.current == null) {
			return;
		}
		this.current.binary = true;
		this.current.hunks.clear();
		this.current.additions = 0;
		this.current.deletions = 0;
	}

	private void startHunk(@Nonnull ComparisonEvent.HunkStarted event) {
		if (this.current == null || this.current.binary) {
			return;
		}
		final DiffRange header = new DiffRange(event.oldStart(), event.oldLines(), event.newStart(), event.newLines());
		final String section = SectionExtractor.extract(event.rawHeader()).orElse(null);
		this.current.hunks.add(new HunkAccumulator(header, section));
	}

	private void addLine(@Nonnull ComparisonEvent.Line event) {
		if (this.current == null || this.current.binary || this.current.hunks.isEmpty()) {
			return;
		}
		final Optional<DiffLineKind> kind = event.origin().toLineKind();
		if (kind.isEmpty()) {
			return;
		}

		final DiffLineKind lineKind = kind.get();
		switch (lineKind) {
			case ADDITION -> this.current.additions++;
			case DELETION -> this.current.deletions++;
			default -> {
				// context lines are not counted
			}
		}

		final Integer baseLine = lineKind == DiffLineKind.ADDITION ? null : event.oldLineNumber();
		final Integer headLine = lineKind == DiffLineKind.DELETION ? null : event.newLineNumber();
		final HunkAccumulator hunk = this.current.hunks.get(this.current.hunks.size() - 1);
		hunk.lines.add(new DiffLine(lineKind, LineSanitizer.sanitize(event.content()), baseLine, headLine, List.of()));
	}

	private void finishFile() {
		if (this.current == null) {
			return;
		}
		final FileAccumulator file = this.current;
		final List<DiffHunk> hunks = new ArrayList<>(file.hunks.size());
		for (final HunkAccumulator hunk : file.hunks) {
			hunks.add(new DiffHunk(hunk.header, hunk.section, hunk.lines));
		}
		this.files.add(new DiffFile(
			file.path,
			file.oldPath,
			file.status,
			new DiffStats(file.additions, file.deletions),
			file.binary,
			hunks
		));
		this.current = null;
	}

	/**
	 * Mutable state of the file currently being assembled.
	 */
	private static final class FileAccumulator {
		@Nonnull
		private final String path;
		@Nullable
		private final String oldPath;
		@Nonnull
		private final FileStatus status;
		private final List<HunkAccumulator> hunks = new ArrayList<>();
		private boolean binary;
		private int additions;
		private int deletions;

		private FileAccumulator(@Nonnull String path, @Nullable String oldPath, @Nonnull FileStatus status, boolean binary) {
			this.path = path;
			this.oldPath = oldPath;
			this.status = status;
			this.binary = binary;
		}
	}

	/**
	 * Mutable state of a hunk of the current file.
	 */
	private static final class HunkAccumulator {
		@Nonnull
		private final DiffRange header;
		@Nullable
		private final String section;
		private final List<DiffLine> lines = new ArrayList<>();

		private HunkAccumulator(@Nonnull DiffRange header, @Nullable String section) {
			this.header = header;
			this.section = section;
		}
	}
}
