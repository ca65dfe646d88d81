package io.prism.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Identity of a revision that diffs can be computed for.
 *
 * @param oid       full object identifier (commit SHA)
 * @param reference human-friendly reference such as a branch name, if any
 * @param summary   first line of the commit message, if any
 * @param author    author identity, if known
 * @param committer committer identity, if known
 * @param timestamp commit time in seconds since the epoch, if known
 */
public record Revision(
	@Nonnull String oid,
	@Nullable String reference,
	@Nullable String summary,
	@Nullable Signature author,
	@Nullable Signature committer,
	@Nullable Long timestamp
) {

	public Revision {
		Objects.requireNonNull(oid, "oid must not be null");
	}

	/**
	 * Creates a revision that is only known by its object id.
	 *
	 * @param oid full object identifier
	 * @return revision without metadata
	 */
	@Nonnull
	public static Revision of(@Nonnull String oid) {
		return new Revision(oid, null, null, null, null, null);
	}
}
