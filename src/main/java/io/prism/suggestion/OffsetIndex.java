package io.prism.suggestion;

import io.prism.model.Position;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Converts 1-based line/column positions into UTF-8 byte offsets of a text.
 *
 * Columns count Unicode scalar values, never raw bytes, so every offset this index returns falls
 * on a character boundary of the UTF-8 encoding. The position right after the last line (after a
 * trailing newline, or the empty line of an empty text) is addressable with column 1 only.
 */
public final class OffsetIndex {

	@Nonnull
	private final byte[] text;
	@Nonnull
	private final int[] lineStarts;

	/**
	 * Builds the line-start table of a text.
	 *
	 * @param text the full file text
	 */
	public OffsetIndex(@Nonnull String text) {
		this(Objects.requireNonNull(text, "text must not be null").getBytes(StandardCharsets.UTF_8));
	}

	OffsetIndex(@Nonnull byte[] utf8) {
		this.text = utf8;
		int[] starts = new int[16];
		int count = 1;
		for (int i = 0; i < utf8.length; i++) {
			if (utf8[i] == '\n') {
				if (count == starts.length) {
					starts = Arrays.copyOf(starts, count * 2);
				}
				starts[count++] = i + 1;
			}
		}
		this.lineStarts = Arrays.copyOf(starts, count);
	}

	/**
	 * Returns the number of recorded line starts, which is one more than the number of newlines.
	 *
	 * @return line start count
	 */
	public int lineStartCount() {
		return this.lineStarts.length;
	}

	/**
	 * Returns the length of the text in UTF-8 bytes.
	 *
	 * @return byte length
	 */
	public int length() {
		return this.text.length;
	}

	/**
	 * Converts a position into a byte offset.
	 *
	 * @param position 1-based line and optional 1-based column
	 * @return byte offset into the UTF-8 encoded text
	 * @throws SuggestionException with LINE_OUT_OF_BOUNDS or COLUMN_OUT_OF_BOUNDS if the position
	 *                             does not address a location in the text; the path of the error is empty
	 */
	public int offset(@Nonnull Position position) throws SuggestionException {
		Objects.requireNonNull(position, "position must not be null");
		final int line = position.line();
		if (line <= 0) {
			throw SuggestionException.lineOutOfBounds("", line);
		}

		final int lineIndex = line - 1;
		if (lineIndex > this.lineStarts.length) {
			throw SuggestionException.lineOutOfBounds("", line);
		}

		final int targetColumn = position.effectiveColumn();
		if (lineIndex == this.lineStarts.length) {
			if (targetColumn == 1) {
				return this.text.length;
			}
			throw SuggestionException.columnOutOfBounds("", line, targetColumn);
		}

		final int lineStart = this.lineStarts[lineIndex];
		final int lineEnd = lineIndex + 1 < this.lineStarts.length ? this.lineStarts[lineIndex + 1] : this.text.length;
		if (targetColumn == 1) {
			return lineStart;
		}

		int offset = lineStart;
		int column = 1;
		while (offset < lineEnd) {
			if (column == targetColumn) {
				return offset;
			}
			offset += scalarLength(this.text[offset]);
			column++;
		}
		if (column == targetColumn) {
			return lineEnd;
		}
		throw SuggestionException.columnOutOfBounds("", line, targetColumn);
	}

	/**
	 * Returns the byte length of the UTF-8 sequence introduced by a lead byte.
	 */
	private static int scalarLength(byte lead) {
		if ((lead & 0x80) == 0) {
			return 1;
		}
		if ((lead & 0xE0) == 0xC0) {
			return 2;
		}
		if ((lead & 0xF0) == 0xE0) {
			return 3;
		}
		return 4;
	}
}
