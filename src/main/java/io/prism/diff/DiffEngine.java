package io.prism.diff;

import io.prism.model.Diff;
import io.prism.model.DiffFile;
import io.prism.model.RevisionRange;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces structured diffs from a version-control backend.
 *
 * Each call is a single synchronous pass over the backend's comparison stream; the engine keeps
 * no state between calls. Callers must serialize calls that target the same repository.
 */
public final class DiffEngine {

	@Nonnull
	private final DiffOptions options;
	@Nonnull
	private final Log log;

	/**
	 * Creates a diff engine.
	 *
	 * @param options comparison settings
	 * @param log     the Maven log
	 */
	public DiffEngine(@Nonnull DiffOptions options, @Nonnull Log log) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Diffs the head revision of the repository against its first parent, or against the empty
	 * tree for a root commit.
	 *
	 * @param backend the repository backend
	 * @return the diff
	 * @throws DiffException with {@link DiffException.Reason#NO_HEAD_REVISION} if the repository has
	 *                       no head commit, or {@link DiffException.Reason#BACKEND} if the backend fails
	 */
	@Nonnull
	public Diff diff(@Nonnull ComparisonBackend backend) throws DiffException {
		Objects.requireNonNull(backend, "backend must not be null");
		final Optional<RevisionRange> range;
		try {
			range = backend.resolveRevisionRange();
		} catch (IOException e) {
			throw DiffException.backend("Failed to resolve revision range", e);
		}
		return diffForRange(backend, range.orElseThrow(DiffException::noHeadRevision));
	}

	/**
	 * Diffs an explicitly supplied revision range.
	 *
	 * @param backend the repository backend
	 * @param range   the revisions to compare
	 * @return the diff
	 * @throws DiffException with {@link DiffException.Reason#BACKEND} if the backend fails
	 */
	@Nonnull
	public Diff diffForRange(@Nonnull ComparisonBackend backend, @Nonnull RevisionRange range) throws DiffException {
		Objects.requireNonNull(backend, "backend must not be null");
		Objects.requireNonNull(range, "range must not be null");

		final Diff diff;
		try (ComparisonStream events = backend.compare(range, this.options)) {
			diff = DiffBuilder.fold(range, events);
		} catch (IOException e) {
			throw DiffException.backend("Failed to compare " + describe(range), e);
		} catch (UncheckedIOException e) {
			throw DiffException.backend("Failed to compare " + describe(range), e.getCause());
		}

		if (this.log.isDebugEnabled()) {
			for (final DiffFile file : diff.files()) {
				this.log.debug("[" + file.status() + "] " + file.path() +
					(file.oldPath() == null ? "" : " (from " + file.oldPath() + ")") +
					(file.binary() ? " binary" : " +" + file.stats().additions() + " -" + file.stats().deletions()));
			}
		}
		this.log.info("Diff " + describe(range) + ": " + diff.files().size() + " file(s), +" +
			diff.totalStats().additions() + " -" + diff.totalStats().deletions());
		return diff;
	}

	@Nonnull
	private static String describe(@Nonnull RevisionRange range) {
		final String base = range.base() == null ? "<empty>" : abbreviate(range.base().oid());
		return base + ".." + abbreviate(range.head().oid());
	}

	@Nonnull
	private static String abbreviate(@Nonnull String oid) {
		return oid.length() > 7 ? oid.substring(0, 7) : oid;
	}
}
