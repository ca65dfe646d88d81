package io.prism.suggestion;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * The validated effect of a suggestion on one file.
 *
 * @param path         path relative to the working tree root, normalized and '/' separated
 * @param absolutePath resolved location of the file
 * @param original     current file text
 * @param updated      file text with all replacements applied
 * @param replacements the replacements sorted by start offset, never overlapping
 */
public record FileChange(
	@Nonnull String path,
	@Nonnull Path absolutePath,
	@Nonnull String original,
	@Nonnull String updated,
	@Nonnull List<Replacement> replacements
) {

	public FileChange {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(absolutePath, "absolutePath must not be null");
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(updated, "updated must not be null");
		replacements = List.copyOf(replacements);
	}

	/**
	 * Returns true if the edits actually change the file.
	 *
	 * @return true if the updated text differs from the original
	 */
	public boolean hasChanges() {
		return !this.original.equals(this.updated);
	}
}
