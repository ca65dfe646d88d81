package io.prism.git;

import io.prism.diff.ComparisonEvent;
import io.prism.diff.ComparisonStream;
import io.prism.diff.DeltaKind;
import io.prism.diff.DiffOptions;
import io.prism.diff.LineOrigin;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;
import org.eclipse.jgit.diff.RenameDetector;
import org.eclipse.jgit.errors.LargeObjectException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.TreeFilter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Compares two commit trees of a repository and produces the ordered {@link ComparisonEvent} stream
 * the diff builder consumes.
 *
 * The set of changed files is computed up front; blob content and line diffs are produced file by
 * file while the returned iterator is consumed.
 */
final class TreeComparison {

	static final byte[] NO_NEWLINE_MARKER = "\n\\ No newline at end of file\n".getBytes(StandardCharsets.UTF_8);
	private static final int MAX_SECTION_LENGTH = 80;
	private static final int MAX_BLOB_SIZE = 50 * 1024 * 1024;
	private static final int BINARY_SNIFF_LENGTH = 8000;
	private static final int REWRITE_BREAK_SCORE = 50;

	@Nonnull
	private final Repository repository;
	@Nonnull
	private final DiffOptions options;

	TreeComparison(@Nonnull Repository repository, @Nonnull DiffOptions options) {
		this.repository = repository;
		this.options = options;
	}

	/**
	 * Compares two trees.
	 *
	 * @param baseTree tree of the base revision, null to compare against the empty tree
	 * @param headTree tree of the head revision
	 * @return lazily produced events, ordered by file path; the caller closes the stream
	 * @throws IOException if the trees cannot be walked
	 */
	@Nonnull
	ComparisonStream compare(@Nullable ObjectId baseTree, @Nonnull ObjectId headTree) throws IOException {
		final List<FileDelta> deltas = detectDeltas(baseTree, headTree);
		return new EventIterator(this.repository.newObjectReader(), deltas);
	}

	/**
	 * Lists the changed files between two trees. Submodule entries are skipped.
	 *
	 * @param baseTree base tree or null
	 * @param headTree head tree
	 * @return deltas ordered by path
	 * @throws IOException if the trees cannot be walked
	 */
	@Nonnull
	List<FileDelta> detectDeltas(@Nullable ObjectId baseTree, @Nonnull ObjectId headTree) throws IOException {
		final List<DiffEntry> entries;
		try (ObjectReader reader = this.repository.newObjectReader(); TreeWalk walk = new TreeWalk(reader)) {
			walk.setRecursive(true);
			if (baseTree == null) {
				walk.addTree(new EmptyTreeIterator());
			} else {
				walk.addTree(baseTree);
			}
			walk.addTree(headTree);
			walk.setFilter(TreeFilter.ANY_DIFF);
			entries = new ArrayList<>(DiffEntry.scan(walk));
		}
		entries.removeIf(entry -> entry.getOldMode() == FileMode.GITLINK || entry.getNewMode() == FileMode.GITLINK);

		final List<FileDelta> deltas = new ArrayList<>(extractTypeChanges(entries));

		// modifications less similar than the break score may become the source of a rename
		final RenameDetector renames = new RenameDetector(this.repository);
		renames.setRenameScore(this.options.renameThreshold());
		renames.setBreakScore(REWRITE_BREAK_SCORE);
		renames.addAll(entries);
		final List<DiffEntry> afterRenames = new ArrayList<>(renames.compute());

		final List<DiffEntry> added = new ArrayList<>();
		for (final DiffEntry entry : afterRenames) {
			if (entry.getChangeType() == DiffEntry.ChangeType.ADD && baseTree != null) {
				added.add(entry);
			} else {
				deltas.add(toDelta(entry));
			}
		}
		deltas.addAll(detectCopies(baseTree, added));

		deltas.sort(Comparator.comparing(FileDelta::sortPath));
		return deltas;
	}

	/**
	 * Removes entries whose path changed between a blob and a symlink and returns them as type changes.
	 * The tree scan reports such a change as a deletion and an addition of the same path.
	 */
	@Nonnull
	private static List<FileDelta> extractTypeChanges(@Nonnull List<DiffEntry> entries) {
		final List<FileDelta> typeChanges = new ArrayList<>();
		final Map<String, DiffEntry> deletions = new HashMap<>();
		for (final DiffEntry entry : entries) {
			if (entry.getChangeType() == DiffEntry.ChangeType.DELETE) {
				deletions.put(entry.getOldPath(), entry);
			}
		}

		final Iterator<DiffEntry> it = entries.iterator();
		final List<DiffEntry> consumedDeletions = new ArrayList<>();
		while (it.hasNext()) {
			final DiffEntry entry = it.next();
			if (entry.getChangeType() == DiffEntry.ChangeType.MODIFY
				&& entry.getOldMode().getObjectType() == entry.getNewMode().getObjectType()
				&& isSymlink(entry.getOldMode()) != isSymlink(entry.getNewMode())) {
				typeChanges.add(new FileDelta(
					DeltaKind.TYPE_CHANGED, entry.getOldPath(), entry.getNewPath(),
					entry.getOldId().toObjectId(), entry.getNewId().toObjectId()
				));
				it.remove();
			} else if (entry.getChangeType() == DiffEntry.ChangeType.ADD) {
				final DiffEntry deletion = deletions.get(entry.getNewPath());
				if (deletion != null && isSymlink(deletion.getOldMode()) != isSymlink(entry.getNewMode())) {
					typeChanges.add(new FileDelta(
						DeltaKind.TYPE_CHANGED, deletion.getOldPath(), entry.getNewPath(),
						deletion.getOldId().toObjectId(), entry.getNewId().toObjectId()
					));
					consumedDeletions.add(deletion);
					it.remove();
				}
			}
		}
		entries.removeAll(consumedDeletions);
		return typeChanges;
	}

	/**
	 * Matches added files against every file of the base tree. Matches become copies; additions
	 * without a match stay additions.
	 */
	@Nonnull
	private List<FileDelta> detectCopies(@Nullable ObjectId baseTree, @Nonnull List<DiffEntry> added) throws IOException {
		final List<FileDelta> result = new ArrayList<>();
		if (added.isEmpty() || baseTree == null) {
			added.forEach(entry -> result.add(toDelta(entry)));
			return result;
		}

		final List<DiffEntry> sources;
		try (ObjectReader reader = this.repository.newObjectReader(); TreeWalk walk = new TreeWalk(reader)) {
			walk.setRecursive(true);
			walk.addTree(baseTree);
			walk.addTree(new EmptyTreeIterator());
			sources = new ArrayList<>(DiffEntry.scan(walk));
		}
		sources.removeIf(entry -> entry.getOldMode() == FileMode.GITLINK);

		final RenameDetector copies = new RenameDetector(this.repository);
		copies.setRenameScore(this.options.copyThreshold());
		copies.addAll(sources);
		copies.addAll(added);
		for (final DiffEntry entry : copies.compute()) {
			switch (entry.getChangeType()) {
				case RENAME, COPY -> result.add(new FileDelta(
					DeltaKind.COPIED, entry.getOldPath(), entry.getNewPath(),
					entry.getOldId().toObjectId(), entry.getNewId().toObjectId()
				));
				case ADD -> result.add(toDelta(entry));
				default -> {
					// base files nothing was copied from
				}
			}
		}
		return result;
	}

	@Nonnull
	private static FileDelta toDelta(@Nonnull DiffEntry entry) {
		final DeltaKind kind = switch (entry.getChangeType()) {
			case ADD -> DeltaKind.ADDED;
			case DELETE -> DeltaKind.DELETED;
			case MODIFY -> DeltaKind.MODIFIED;
			// a split rewrite paired back with itself
			case RENAME -> entry.getOldPath().equals(entry.getNewPath()) ? DeltaKind.MODIFIED : DeltaKind.RENAMED;
			case COPY -> DeltaKind.COPIED;
		};
		final String oldPath = pathOrNull(entry.getOldPath());
		final String newPath = pathOrNull(entry.getNewPath());
		return new FileDelta(
			kind,
			oldPath,
			newPath,
			oldPath == null ? null : entry.getOldId().toObjectId(),
			newPath == null ? null : entry.getNewId().toObjectId()
		);
	}

	@Nullable
	private static String pathOrNull(@Nullable String path) {
		return path == null || DiffEntry.DEV_NULL.equals(path) ? null : path;
	}

	private static boolean isSymlink(@Nonnull FileMode mode) {
		return mode == FileMode.SYMLINK;
	}

	/**
	 * Tells whether content is binary: a NUL byte within the first 8000 bytes, as git decides it.
	 * Oversized blobs that were not loaded count as binary.
	 */
	static boolean isBinary(@Nullable byte[] content) {
		if (content == null) {
			return true;
		}
		final int length = Math.min(content.length, BINARY_SNIFF_LENGTH);
		for (int i = 0; i < length; i++) {
			if (content[i] == 0) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Finds the section heading for a hunk: the nearest line above the hunk that starts with a
	 * letter, '_' or '$'.
	 *
	 * @param lines old side lines
	 * @param start 0-based index of the first line of the hunk
	 * @return the heading, or null if there is none
	 */
	@Nullable
	static String findSection(@Nonnull ByteLines lines, int start) {
		for (int i = Math.min(start, lines.size()) - 1; i >= 0; i--) {
			final byte[] line = lines.line(i);
			if (line.length == 0) {
				continue;
			}
			final byte first = line[0];
			if ((first >= 'a' && first <= 'z') || (first >= 'A' && first <= 'Z') || first == '_' || first == '$') {
				final String text = new String(line, StandardCharsets.UTF_8).stripTrailing();
				return text.length() > MAX_SECTION_LENGTH ? text.substring(0, MAX_SECTION_LENGTH) : text;
			}
		}
		return null;
	}

	/**
	 * Formats a hunk header the way git prints it. A count of one is omitted.
	 */
	@Nonnull
	static byte[] formatHeader(int oldStart, int oldLines, int newStart, int newLines, @Nullable String section) {
		final StringBuilder header = new StringBuilder("@@ -").append(oldStart);
		if (oldLines != 1) {
			header.append(',').append(oldLines);
		}
		header.append(" +").append(newStart);
		if (newLines != 1) {
			header.append(',').append(newLines);
		}
		header.append(" @@");
		if (section != null) {
			header.append(' ').append(section);
		}
		header.append('\n');
		return header.toString().getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Stream producing the events of one file at a time. The object reader is released when the
	 * stream is exhausted, fails or is closed.
	 */
	private final class EventIterator implements ComparisonStream {
		@Nonnull
		private final ObjectReader reader;
		@Nonnull
		private final Iterator<FileDelta> deltas;
		private final Deque<ComparisonEvent> pending = new ArrayDeque<>();
		private boolean closed;

		private EventIterator(@Nonnull ObjectReader reader, @Nonnull List<FileDelta> deltas) {
			this.reader = reader;
			this.deltas = deltas.iterator();
		}

		@Override
		public boolean hasNext() {
			if (this.closed) {
				return false;
			}
			while (this.pending.isEmpty() && this.deltas.hasNext()) {
				final FileDelta delta = this.deltas.next();
				try {
					emitFile(delta);
				} catch (IOException e) {
					close();
					throw new UncheckedIOException("Failed to compare " + delta.sortPath(), e);
				}
			}
			if (this.pending.isEmpty()) {
				close();
				return false;
			}
			return true;
		}

		@Override
		public ComparisonEvent next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return this.pending.removeFirst();
		}

		@Override
		public void close() {
			if (!this.closed) {
				this.closed = true;
				this.reader.close();
			}
		}

		private void emitFile(@Nonnull FileDelta delta) throws IOException {
			final byte[] oldContent = load(delta.oldId());
			final byte[] newContent = load(delta.newId());
			final boolean oldBinary = isBinary(oldContent);
			final boolean newBinary = isBinary(newContent);
			this.pending.add(new ComparisonEvent.FileStarted(
				delta.kind(), delta.oldPath(), delta.newPath(), oldBinary, newBinary
			));
			if (oldBinary || newBinary) {
				this.pending.add(new ComparisonEvent.BinaryDetected());
				return;
			}

			final RawText a = new RawText(oldContent);
			final RawText b = new RawText(newContent);
			final EditList edits = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM)
				.diff(RawTextComparator.DEFAULT, a, b);
			emitHunks(edits, new ByteLines(oldContent), new ByteLines(newContent));
		}

		/**
		 * Loads blob bytes. A missing side yields an empty array, an oversized blob yields null.
		 */
		@Nullable
		private byte[] load(@Nullable ObjectId id) throws IOException {
			if (id == null || ObjectId.zeroId().equals(id)) {
				return new byte[0];
			}
			try {
				return this.reader.open(id, Constants.OBJ_BLOB).getCachedBytes(MAX_BLOB_SIZE);
			} catch (LargeObjectException e) {
				return null;
			}
		}

		private void emitHunks(@Nonnull EditList edits, @Nonnull ByteLines a, @Nonnull ByteLines b) {
			final int context = TreeComparison.this.options.contextLines();
			final int maxGap = 2 * context + TreeComparison.this.options.interhunkLines();
			int first = 0;
			while (first < edits.size()) {
				int last = first;
				while (last + 1 < edits.size()
					&& edits.get(last + 1).getBeginA() - edits.get(last).getEndA() <= maxGap) {
					last++;
				}

				final Edit firstEdit = edits.get(first);
				final Edit lastEdit = edits.get(last);
				final int aStart = Math.max(0, firstEdit.getBeginA() - context);
				final int bStart = Math.max(0, firstEdit.getBeginB() - context);
				final int aEnd = Math.min(a.size(), lastEdit.getEndA() + context);
				final int bEnd = Math.min(b.size(), lastEdit.getEndB() + context);
				final int oldLines = aEnd - aStart;
				final int newLines = bEnd - bStart;
				final int oldStart = oldLines == 0 ? aStart : aStart + 1;
				final int newStart = newLines == 0 ? bStart : bStart + 1;
				this.pending.add(new ComparisonEvent.HunkStarted(
					oldStart, oldLines, newStart, newLines,
					formatHeader(oldStart, oldLines, newStart, newLines, findSection(a, aStart))
				));

				int aCur = aStart;
				int bCur = bStart;
				for (int i = first; i <= last; i++) {
					final Edit edit = edits.get(i);
					while (aCur < edit.getBeginA()) {
						emitContext(a, aCur++, bCur++);
					}
					for (; aCur < edit.getEndA(); aCur++) {
						emitLine(a, aCur, LineOrigin.DELETION, LineOrigin.DELETION_EOF_NEWLINE, aCur + 1, null);
					}
					for (; bCur < edit.getEndB(); bCur++) {
						emitLine(b, bCur, LineOrigin.ADDITION, LineOrigin.ADDITION_EOF_NEWLINE, null, bCur + 1);
					}
				}
				while (aCur < aEnd && bCur < bEnd) {
					emitContext(a, aCur++, bCur++);
				}
				first = last + 1;
			}
		}

		private void emitContext(@Nonnull ByteLines a, int aIndex, int bIndex) {
			emitLine(a, aIndex, LineOrigin.CONTEXT, LineOrigin.CONTEXT_EOF_NEWLINE, aIndex + 1, bIndex + 1);
		}

		private void emitLine(
			@Nonnull ByteLines lines,
			int index,
			@Nonnull LineOrigin origin,
			@Nonnull LineOrigin eofOrigin,
			@Nullable Integer oldLineNumber,
			@Nullable Integer newLineNumber
		) {
			this.pending.add(new ComparisonEvent.Line(origin, lines.line(index), oldLineNumber, newLineNumber));
			if (!lines.isTerminated(index)) {
				this.pending.add(new ComparisonEvent.Line(eofOrigin, NO_NEWLINE_MARKER.clone(), null, null));
			}
		}
	}
}
