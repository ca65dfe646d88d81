package io.prism.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Basic information about a repository.
 *
 * @param root          absolute path of the working tree
 * @param defaultBranch default branch name as advertised by the origin remote, if known
 */
public record RepositoryInfo(
	@Nonnull String root,
	@Nullable String defaultBranch
) {

	public RepositoryInfo {
		Objects.requireNonNull(root, "root must not be null");
	}
}
