package io.prism.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Exception thrown when a diff cannot be produced.
 */
public final class DiffException extends Exception {

	/**
	 * Why the diff could not be produced.
	 */
	public enum Reason {

		/**
		 * The repository has no resolvable head commit.
		 */
		NO_HEAD_REVISION,

		/**
		 * An underlying version-control operation failed.
		 */
		BACKEND
	}

	@Nonnull
	private final Reason reason;

	private DiffException(@Nonnull Reason reason, @Nonnull String message, @Nullable Throwable cause) {
		super(message, cause);
		this.reason = Objects.requireNonNull(reason, "reason must not be null");
	}

	/**
	 * Creates the exception for a repository without a head revision.
	 *
	 * @return new exception
	 */
	@Nonnull
	public static DiffException noHeadRevision() {
		return new DiffException(Reason.NO_HEAD_REVISION, "Repository has no head revision to diff", null);
	}

	/**
	 * Creates the exception for a failed backend operation.
	 *
	 * @param message description of the failed operation
	 * @param cause   the backend failure
	 * @return new exception
	 */
	@Nonnull
	public static DiffException backend(@Nonnull String message, @Nonnull Throwable cause) {
		Objects.requireNonNull(cause, "cause must not be null");
		return new DiffException(Reason.BACKEND, message + ": " + cause.getMessage(), cause);
	}

	@Nonnull
	public Reason getReason() {
		return this.reason;
	}
}
