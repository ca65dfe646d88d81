package io.prism.diff;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Turns the raw bytes of a diff line into display text.
 */
public final class LineSanitizer {

	private LineSanitizer() {
	}

	/**
	 * Decodes a line as UTF-8, replacing invalid sequences with U+FFFD, and strips one trailing
	 * {@code \n} together with a {@code \r} directly before it.
	 *
	 * @param content raw line bytes
	 * @return the line text without its terminator
	 */
	@Nonnull
	public static String sanitize(@Nonnull byte[] content) {
		Objects.requireNonNull(content, "content must not be null");
		int length = content.length;
		if (length > 0 && content[length - 1] == '\n') {
			length--;
			if (length > 0 && content[length - 1] == '\r') {
				length--;
			}
		}
		// String(byte[], Charset) always substitutes malformed input
		return new String(content, 0, length, StandardCharsets.UTF_8);
	}
}
