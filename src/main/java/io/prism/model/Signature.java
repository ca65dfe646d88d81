package io.prism.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Author or committer identity of a revision.
 *
 * @param name  display name
 * @param email email address, if known
 */
public record Signature(
	@Nonnull String name,
	@Nullable String email
) {

	public Signature {
		Objects.requireNonNull(name, "name must not be null");
	}
}
