package io.prism.suggestion;

import io.prism.model.DiffSide;
import io.prism.model.FileRange;
import io.prism.model.Suggestion;
import io.prism.model.TextEdit;

import javax.annotation.Nonnull;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Validates the edits of a suggestion and computes the resulting content of every touched file.
 *
 * Edits are grouped by the file they resolve to (in path order), so spellings such as {@code ./a.txt}
 * and {@code a.txt} address the same file. For each file every edit must target the head side,
 * the file must exist, every position must resolve inside the current text, and the resolved
 * ranges must not overlap (touching ranges are fine). Planning never writes anything.
 */
public final class EditPlanner {

	private static final Comparator<Replacement> BY_START = Comparator.comparingInt(Replacement::start);

	@Nonnull
	private final Workspace workspace;

	public EditPlanner(@Nonnull Workspace workspace) {
		this.workspace = Objects.requireNonNull(workspace, "workspace must not be null");
	}

	/**
	 * Plans the changes of a suggestion, one entry per touched file, including files whose edits
	 * turn out to be no-ops.
	 *
	 * @param suggestion the suggestion to plan
	 * @return validated file changes in path order
	 * @throws SuggestionException if any edit is invalid or a file cannot be read
	 */
	@Nonnull
	public List<FileChange> plan(@Nonnull Suggestion suggestion) throws SuggestionException {
		Objects.requireNonNull(suggestion, "suggestion must not be null");

		final Path root = this.workspace.root();
		final Map<String, List<TextEdit>> grouped = new TreeMap<>();
		for (final TextEdit edit : suggestion.edits()) {
			final Path absolute = WorkspacePaths.resolve(root, edit.location().path());
			grouped.computeIfAbsent(WorkspacePaths.indexPath(root, absolute), key -> new ArrayList<>()).add(edit);
		}

		final List<FileChange> changes = new ArrayList<>(grouped.size());
		for (final Map.Entry<String, List<TextEdit>> entry : grouped.entrySet()) {
			changes.add(planFile(entry.getKey(), entry.getValue()));
		}
		return changes;
	}

	@Nonnull
	private FileChange planFile(@Nonnull String path, @Nonnull List<TextEdit> edits) throws SuggestionException {
		final Path absolute = WorkspacePaths.resolve(this.workspace.root(), path);
		for (final TextEdit edit : edits) {
			if (edit.location().side() != DiffSide.HEAD) {
				throw SuggestionException.unsupportedSide(path, edit.location().side());
			}
		}

		final String original = readOriginal(path, absolute);
		final byte[] originalBytes = original.getBytes(StandardCharsets.UTF_8);
		final OffsetIndex index = new OffsetIndex(originalBytes);

		final List<Replacement> replacements = new ArrayList<>(edits.size());
		for (final TextEdit edit : edits) {
			replacements.add(resolve(path, index, edit));
		}
		replacements.sort(BY_START);

		for (int i = 1; i < replacements.size(); i++) {
			if (replacements.get(i - 1).end() > replacements.get(i).start()) {
				throw SuggestionException.overlappingEdits(path);
			}
		}

		return new FileChange(path, absolute, original, splice(originalBytes, replacements), replacements);
	}

	@Nonnull
	private String readOriginal(@Nonnull String path, @Nonnull Path absolute) throws SuggestionException {
		try {
			return this.workspace.read(absolute);
		} catch (NoSuchFileException | FileNotFoundException e) {
			throw SuggestionException.missingFile(path);
		} catch (IOException e) {
			throw SuggestionException.io(path, "read", e);
		}
	}

	@Nonnull
	private static Replacement resolve(
		@Nonnull String path,
		@Nonnull OffsetIndex index,
		@Nonnull TextEdit edit
	) throws SuggestionException {
		final FileRange location = edit.location();
		final int start;
		final int end;
		try {
			start = index.offset(location.range().start());
			end = index.offset(location.range().end());
		} catch (SuggestionException e) {
			throw e.withPath(path);
		}
		if (start > end) {
			throw SuggestionException.invalidRange(path, start, end);
		}
		checkWellFormed(path, edit.replacement());
		return new Replacement(start, end, edit.replacement());
	}

	/**
	 * Rejects text with unpaired surrogates, which UTF-8 encoding would silently replace.
	 */
	private static void checkWellFormed(@Nonnull String path, @Nonnull String text) throws SuggestionException {
		for (int i = 0; i < text.length(); i++) {
			final char c = text.charAt(i);
			if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
				i++;
			} else if (Character.isSurrogate(c)) {
				throw SuggestionException.invalidReplacement(path, i);
			}
		}
	}

	/**
	 * Applies sorted, non-overlapping replacements from the highest offset down so that lower
	 * offsets stay valid while later ranges are replaced.
	 */
	@Nonnull
	private static String splice(@Nonnull byte[] original, @Nonnull List<Replacement> replacements) {
		byte[] current = original;
		for (int i = replacements.size() - 1; i >= 0; i--) {
			final Replacement replacement = replacements.get(i);
			final byte[] inserted = replacement.replacement().getBytes(StandardCharsets.UTF_8);
			final byte[] next = new byte[current.length - (replacement.end() - replacement.start()) + inserted.length];
			System.arraycopy(current, 0, next, 0, replacement.start());
			System.arraycopy(inserted, 0, next, replacement.start(), inserted.length);
			System.arraycopy(
				current, replacement.end(),
				next, replacement.start() + inserted.length,
				current.length - replacement.end()
			);
			current = next;
		}
		return new String(current, StandardCharsets.UTF_8);
	}
}
