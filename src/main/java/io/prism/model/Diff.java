package io.prism.model;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A full diff produced for a revision range.
 *
 * @param range the revisions that were compared
 * @param files the file diffs in backend emission order
 */
public record Diff(
	@Nonnull RevisionRange range,
	@Nonnull List<DiffFile> files
) {

	public Diff {
		Objects.requireNonNull(range, "range must not be null");
		files = files == null ? List.of() : List.copyOf(files);
	}

	/**
	 * Finds the file diff with the given path.
	 *
	 * @param path path relative to the repository root
	 * @return the file diff, or empty if the path is not part of this diff
	 */
	@Nonnull
	public Optional<DiffFile> file(@Nonnull String path) {
		Objects.requireNonNull(path, "path must not be null");
		return this.files.stream()
			.filter(file -> file.path().equals(path))
			.findFirst();
	}

	/**
	 * Returns the aggregated stats of all files.
	 *
	 * @return total additions and deletions
	 */
	@Nonnull
	public DiffStats totalStats() {
		return this.files.stream()
			.map(DiffFile::stats)
			.reduce(DiffStats.ZERO, DiffStats::add);
	}
}
