package io.prism.suggestion;

import javax.annotation.Nonnull;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Resolves suggestion paths against a working tree root. Paths must be relative and must not
 * contain parent-directory segments; both checks run before any filesystem access.
 */
final class WorkspacePaths {

	private static final Pattern SEPARATOR = Pattern.compile("[/\\\\]");
	private static final String PARENT_SEGMENT = "..";

	private WorkspacePaths() {
	}

	/**
	 * Resolves a suggestion path.
	 *
	 * @param root     working tree root
	 * @param relative the path from the suggestion
	 * @return normalized absolute path below the root
	 * @throws SuggestionException with ABSOLUTE_PATH or PATH_TRAVERSAL if the path is rejected, IO if it is malformed
	 */
	@Nonnull
	static Path resolve(@Nonnull Path root, @Nonnull String relative) throws SuggestionException {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(relative, "relative must not be null");

		if (relative.startsWith("/") || relative.startsWith("\\")) {
			throw SuggestionException.absolutePath(relative);
		}
		final Path candidate;
		try {
			candidate = Path.of(relative);
		} catch (InvalidPathException e) {
			throw SuggestionException.io(relative, "resolve", e);
		}
		if (candidate.isAbsolute() || candidate.getRoot() != null) {
			throw SuggestionException.absolutePath(relative);
		}
		for (final String segment : SEPARATOR.split(relative)) {
			if (PARENT_SEGMENT.equals(segment)) {
				throw SuggestionException.pathTraversal(relative);
			}
		}
		return root.resolve(candidate).normalize();
	}

	/**
	 * Returns the index form of a resolved path: relative to the root, '/' separated, without
	 * current-directory segments.
	 *
	 * @param root     working tree root
	 * @param absolute a path returned by {@link #resolve(Path, String)}
	 * @return the path as the index records it
	 */
	@Nonnull
	static String indexPath(@Nonnull Path root, @Nonnull Path absolute) {
		final Path relative = root.normalize().relativize(absolute.normalize());
		final StringJoiner joined = new StringJoiner("/");
		for (final Path name : relative) {
			joined.add(name.toString());
		}
		return joined.toString();
	}
}
