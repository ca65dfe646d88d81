package io.prism.suggestion;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Working tree of a repository that suggestions are applied to.
 */
public interface Workspace {

	/**
	 * Returns the absolute, normalized root of the working tree.
	 *
	 * @return the root directory
	 */
	@Nonnull
	Path root();

	/**
	 * Reads the current text of a file.
	 *
	 * @param file absolute path inside the working tree
	 * @return the file text
	 * @throws java.nio.file.NoSuchFileException if the file does not exist
	 * @throws IOException                       if the file cannot be read or is not valid UTF-8
	 */
	@Nonnull
	String read(@Nonnull Path file) throws IOException;

	/**
	 * Replaces the content of a file.
	 *
	 * @param file    absolute path inside the working tree
	 * @param content the new text
	 * @throws IOException if the file cannot be written
	 */
	void write(@Nonnull Path file, @Nonnull String content) throws IOException;

	/**
	 * Records the current on-disk content of a path in the staging area.
	 *
	 * @param relativePath path relative to the root, using '/' separators
	 * @throws IOException if the path cannot be staged
	 */
	void stage(@Nonnull String relativePath) throws IOException;
}
