package io.prism.model;

import javax.annotation.Nonnull;

/**
 * Number of added and removed lines of a single file diff.
 *
 * @param additions count of addition lines
 * @param deletions count of deletion lines
 */
public record DiffStats(
	int additions,
	int deletions
) {

	/**
	 * Stats with no additions and no deletions.
	 */
	public static final DiffStats ZERO = new DiffStats(0, 0);

	/**
	 * Creates new stats with validation.
	 *
	 * @param additions count of addition lines
	 * @param deletions count of deletion lines
	 */
	public DiffStats {
		if (additions < 0) {
			throw new IllegalArgumentException("additions must be non-negative: " + additions);
		}
		if (deletions < 0) {
			throw new IllegalArgumentException("deletions must be non-negative: " + deletions);
		}
	}

	/**
	 * Combines these stats with another instance.
	 *
	 * @param other stats to add
	 * @return the sum of both
	 */
	@Nonnull
	public DiffStats add(@Nonnull DiffStats other) {
		return new DiffStats(this.additions + other.additions, this.deletions + other.deletions);
	}
}
