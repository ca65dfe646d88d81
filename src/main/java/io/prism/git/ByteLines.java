package io.prism.git;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Objects;

/**
 * Line table over raw file bytes. Lines are split after every '\n' and keep their terminator,
 * so the lines of a file concatenate back to its exact content. Line numbering matches
 * {@link org.eclipse.jgit.diff.RawText}: a trailing fragment without '\n' is a line of its own.
 */
final class ByteLines {

	@Nonnull
	private final byte[] content;
	@Nonnull
	private final int[] starts;

	ByteLines(@Nonnull byte[] content) {
		this.content = Objects.requireNonNull(content, "content must not be null");
		int count = 0;
		for (final byte b : content) {
			if (b == '\n') {
				count++;
			}
		}
		final boolean trailingFragment = content.length > 0 && content[content.length - 1] != '\n';
		final int[] table = new int[count + (trailingFragment ? 1 : 0) + 1];
		int line = 0;
		table[line++] = 0;
		for (int i = 0; i < content.length; i++) {
			if (content[i] == '\n' && i + 1 < content.length) {
				table[line++] = i + 1;
			}
		}
		table[line] = content.length;
		this.starts = table;
	}

	/**
	 * @return number of lines
	 */
	int size() {
		return this.content.length == 0 ? 0 : this.starts.length - 1;
	}

	/**
	 * Returns the bytes of a line including its terminator, if it has one.
	 *
	 * @param index 0-based line index
	 * @return copy of the line bytes
	 */
	@Nonnull
	byte[] line(int index) {
		checkIndex(index);
		return Arrays.copyOfRange(this.content, this.starts[index], this.starts[index + 1]);
	}

	/**
	 * Tells whether a line ends with '\n'. Only the last line of a file can lack it.
	 *
	 * @param index 0-based line index
	 * @return true if the line is terminated
	 */
	boolean isTerminated(int index) {
		checkIndex(index);
		return this.content[this.starts[index + 1] - 1] == '\n';
	}

	private void checkIndex(int index) {
		if (index < 0 || index >= size()) {
			throw new IndexOutOfBoundsException("line " + index + " of " + size());
		}
	}
}
