package io.prism.git;

import io.prism.diff.DeltaKind;
import org.eclipse.jgit.lib.ObjectId;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A changed file between two trees, after rename, copy and type change detection.
 *
 * @param kind    change kind
 * @param oldPath path in the base tree, null for additions
 * @param newPath path in the head tree, null for deletions
 * @param oldId   blob in the base tree, null if the file is absent there
 * @param newId   blob in the head tree, null if the file is absent there
 */
record FileDelta(
	@Nonnull DeltaKind kind,
	@Nullable String oldPath,
	@Nullable String newPath,
	@Nullable ObjectId oldId,
	@Nullable ObjectId newId
) {

	FileDelta {
		Objects.requireNonNull(kind, "kind must not be null");
		if (oldPath == null && newPath == null) {
			throw new IllegalArgumentException("at least one of oldPath and newPath must be set");
		}
	}

	/**
	 * @return the path the delta is ordered by
	 */
	@Nonnull
	String sortPath() {
		return this.newPath != null ? this.newPath : this.oldPath;
	}
}
