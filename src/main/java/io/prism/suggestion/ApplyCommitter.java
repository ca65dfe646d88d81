package io.prism.suggestion;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Writes planned file changes to the working tree and stages them.
 *
 * Files are processed in order; the first failure aborts the commit and files handled before it
 * stay written and staged.
 */
public final class ApplyCommitter {

	@Nonnull
	private final Workspace workspace;
	@Nonnull
	private final Log log;

	public ApplyCommitter(@Nonnull Workspace workspace, @Nonnull Log log) {
		this.workspace = Objects.requireNonNull(workspace, "workspace must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Writes and stages every change that modifies its file. No-op changes are skipped.
	 *
	 * @param changes validated changes
	 * @return number of files written
	 * @throws SuggestionException with IO if a write fails or STAGING if staging fails
	 */
	public int commit(@Nonnull List<FileChange> changes) throws SuggestionException {
		Objects.requireNonNull(changes, "changes must not be null");
		int written = 0;
		for (final FileChange change : changes) {
			if (!change.hasChanges()) {
				this.log.debug("[SKIP] " + change.path() + " (no net change)");
				continue;
			}

			try {
				this.workspace.write(change.absolutePath(), change.updated());
			} catch (IOException e) {
				throw SuggestionException.io(change.path(), "write", e);
			}

			try {
				this.workspace.stage(WorkspacePaths.indexPath(this.workspace.root(), change.absolutePath()));
			} catch (IOException e) {
				throw SuggestionException.staging(change.path(), e);
			}

			this.log.info("[APPLIED] " + change.path() + " (" + change.replacements().size() + " edit(s))");
			written++;
		}
		return written;
	}
}
