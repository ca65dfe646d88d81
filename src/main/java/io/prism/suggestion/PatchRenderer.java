package io.prism.suggestion;

import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

import javax.annotation.Nonnull;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Renders the unified diff between the original and the updated text of a file change.
 *
 * Output format:
 * ```
 * diff --git a/path b/path
 * --- a/path
 * +++ b/path
 * @@ -oldStart,oldCount +newStart,newCount @@
 *  context line
 * -removed line
 * +added line
 * ```
 */
public final class PatchRenderer {

	public static final int DEFAULT_CONTEXT_LINES = 3;

	private final int contextLines;

	public PatchRenderer() {
		this(DEFAULT_CONTEXT_LINES);
	}

	/**
	 * Creates a renderer with a custom amount of context.
	 *
	 * @param contextLines number of unchanged lines around each change
	 */
	public PatchRenderer(int contextLines) {
		if (contextLines < 0) {
			throw new IllegalArgumentException("contextLines must be non-negative: " + contextLines);
		}
		this.contextLines = contextLines;
	}

	/**
	 * Renders the patch of a file change. Nothing is read from or written to disk.
	 *
	 * @param change the planned change
	 * @return unified diff text, with only the file headers if the change is a no-op
	 * @throws IOException if the diff cannot be formatted
	 */
	@Nonnull
	public String render(@Nonnull FileChange change) throws IOException {
		Objects.requireNonNull(change, "change must not be null");
		return render(change.path(), change.original(), change.updated());
	}

	/**
	 * Renders the unified diff between two versions of a file.
	 *
	 * @param path     path used in the file headers
	 * @param original text before the change
	 * @param updated  text after the change
	 * @return unified diff text
	 * @throws IOException if the diff cannot be formatted
	 */
	@Nonnull
	public String render(@Nonnull String path, @Nonnull String original, @Nonnull String updated) throws IOException {
		Objects.requireNonNull(path, "path must not be null");
		final RawText a = new RawText(original.getBytes(StandardCharsets.UTF_8));
		final RawText b = new RawText(updated.getBytes(StandardCharsets.UTF_8));
		final EditList edits = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM)
			.diff(RawTextComparator.DEFAULT, a, b);

		final ByteArrayOutputStream out = new ByteArrayOutputStream();
		out.writeBytes(("diff --git a/" + path + " b/" + path + "\n").getBytes(StandardCharsets.UTF_8));
		out.writeBytes(("--- a/" + path + "\n").getBytes(StandardCharsets.UTF_8));
		out.writeBytes(("+++ b/" + path + "\n").getBytes(StandardCharsets.UTF_8));
		try (DiffFormatter formatter = new DiffFormatter(out)) {
			formatter.setContext(this.contextLines);
			formatter.format(edits, a, b);
			formatter.flush();
		}
		return out.toString(StandardCharsets.UTF_8);
	}
}
