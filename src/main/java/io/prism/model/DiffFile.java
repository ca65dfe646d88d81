package io.prism.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Diff of a single file between two revisions.
 *
 * @param path    path relative to the repository root (head side unless the file was deleted)
 * @param oldPath previous path, set only for renamed or copied files whose path differs
 * @param status  status of the change
 * @param stats   number of added and removed lines
 * @param binary  true if either side has binary content; binary files never carry hunks
 * @param hunks   the hunks in emission order
 */
public record DiffFile(
	@Nonnull String path,
	@Nullable String oldPath,
	@Nonnull FileStatus status,
	@Nonnull DiffStats stats,
	@JsonProperty("is_binary") boolean binary,
	@Nonnull List<DiffHunk> hunks
) {

	/**
	 * Creates a new DiffFile enforcing the old path and binary invariants.
	 */
	public DiffFile {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(status, "status must not be null");
		stats = stats == null ? DiffStats.ZERO : stats;
		hunks = hunks == null || binary ? List.of() : List.copyOf(hunks);
		if (oldPath != null && (!status.hasOriginalPath() || oldPath.equals(path))) {
			throw new IllegalArgumentException(
				"oldPath may only be set for renamed or copied files with a different path: " + path
			);
		}
	}
}
