package io.prism.diff;

/**
 * Change kind of a file as reported by the version-control backend, before it is mapped to a
 * {@link io.prism.model.FileStatus}.
 */
public enum DeltaKind {
	ADDED,
	DELETED,
	MODIFIED,
	RENAMED,
	COPIED,
	IGNORED,
	UNTRACKED,
	TYPE_CHANGED,
	UNREADABLE,
	CONFLICTED,
	UNMODIFIED
}
