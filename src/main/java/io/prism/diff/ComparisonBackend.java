package io.prism.diff;

import io.prism.model.RevisionRange;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Optional;

/**
 * Version-control backend that resolves revisions and compares their trees.
 */
public interface ComparisonBackend {

	/**
	 * Resolves the range under review: the head revision and its first parent as base.
	 *
	 * @return the range, or empty if the repository has no head revision
	 * @throws IOException if the revisions cannot be read
	 */
	@Nonnull
	Optional<RevisionRange> resolveRevisionRange() throws IOException;

	/**
	 * Compares the trees of the given range. The returned stream is consumed once and must be
	 * closed; failures while it is being consumed surface as {@link java.io.UncheckedIOException}.
	 *
	 * @param range   the revisions to compare; a missing base means the empty tree
	 * @param options context and similarity detection settings
	 * @return the ordered comparison events
	 * @throws IOException if the trees cannot be resolved or compared
	 */
	@Nonnull
	ComparisonStream compare(@Nonnull RevisionRange range, @Nonnull DiffOptions options) throws IOException;
}
