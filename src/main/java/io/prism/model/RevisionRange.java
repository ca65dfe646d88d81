package io.prism.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The pair of revisions a diff is computed for.
 *
 * @param base base revision, absent when the head is a root commit
 * @param head head revision (the state being reviewed)
 */
public record RevisionRange(
	@Nullable Revision base,
	@Nonnull Revision head
) {

	public RevisionRange {
		Objects.requireNonNull(head, "head must not be null");
	}
}
