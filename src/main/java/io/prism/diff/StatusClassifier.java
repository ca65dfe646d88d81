package io.prism.diff;

import io.prism.model.FileStatus;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Maps backend change kinds to file statuses and picks the canonical path of a file diff.
 */
public final class StatusClassifier {

	private StatusClassifier() {
	}

	/**
	 * Classifies a backend change kind.
	 *
	 * @param kind the backend change kind
	 * @return the file status
	 */
	@Nonnull
	public static FileStatus classify(@Nonnull DeltaKind kind) {
		Objects.requireNonNull(kind, "kind must not be null");
		return switch (kind) {
			case ADDED, UNTRACKED -> FileStatus.ADDED;
			case DELETED -> FileStatus.DELETED;
			case MODIFIED, IGNORED, UNREADABLE, CONFLICTED, UNMODIFIED -> FileStatus.MODIFIED;
			case RENAMED -> FileStatus.RENAMED;
			case COPIED -> FileStatus.COPIED;
			case TYPE_CHANGED -> FileStatus.TYPE_CHANGE;
		};
	}

	/**
	 * Picks the path a file diff is reported under: the old path for deleted files or when the
	 * new path is absent, the new path otherwise.
	 *
	 * @param status  the file status
	 * @param oldPath path on the old side
	 * @param newPath path on the new side
	 * @return the canonical path
	 */
	@Nonnull
	public static String canonicalPath(@Nonnull FileStatus status, @Nullable String oldPath, @Nullable String newPath) {
		Objects.requireNonNull(status, "status must not be null");
		final String path = status == FileStatus.DELETED || newPath == null ? oldPath : newPath;
		if (path == null) {
			throw new IllegalArgumentException("no path available for " + status + " file");
		}
		return path;
	}

	/**
	 * Returns the previous path to report next to the canonical one. Only renamed and copied
	 * files whose old path differs from the canonical path have one.
	 *
	 * @param status        the file status
	 * @param oldPath       path on the old side
	 * @param canonicalPath the canonical path
	 * @return the previous path, or null
	 */
	@Nullable
	public static String originalPath(@Nonnull FileStatus status, @Nullable String oldPath, @Nonnull String canonicalPath) {
		if (status.hasOriginalPath() && oldPath != null && !oldPath.equals(canonicalPath)) {
			return oldPath;
		}
		return null;
	}
}
