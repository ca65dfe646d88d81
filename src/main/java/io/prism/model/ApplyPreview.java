package io.prism.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Preview of what applying a suggestion would do to one file.
 *
 * @param path  path of the file relative to the repository root
 * @param patch unified diff between the current and the edited content
 */
public record ApplyPreview(
	@Nonnull String path,
	@Nonnull String patch
) {

	public ApplyPreview {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(patch, "patch must not be null");
	}
}
