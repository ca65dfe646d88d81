package io.prism.diff;

import javax.annotation.Nonnull;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the section label of a hunk (typically the enclosing function signature) from the
 * text that follows the hunk range in its header, e.g. {@code @@ -1,3 +1,4 @@ void run()}.
 */
public final class SectionExtractor {

	private static final String HUNK_DELIMITER = "@@";

	private SectionExtractor() {
	}

	/**
	 * Extracts the section label from a raw hunk header.
	 *
	 * @param rawHeader raw bytes of the hunk header line
	 * @return the trimmed section text, or empty if there is none or the header is not valid UTF-8
	 */
	@Nonnull
	public static Optional<String> extract(@Nonnull byte[] rawHeader) {
		Objects.requireNonNull(rawHeader, "rawHeader must not be null");
		final String header;
		try {
			header = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(rawHeader))
				.toString();
		} catch (CharacterCodingException e) {
			return Optional.empty();
		}

		int end = header.length();
		while (end > 0 && (header.charAt(end - 1) == '\n' || header.charAt(end - 1) == '\r')) {
			end--;
		}
		final String trimmed = header.substring(0, end);

		final int delimiter = trimmed.lastIndexOf(HUNK_DELIMITER);
		if (delimiter < 0) {
			return Optional.empty();
		}
		final String section = trimmed.substring(delimiter + HUNK_DELIMITER.length()).trim();
		return section.isEmpty() ? Optional.empty() : Optional.of(section);
	}
}
