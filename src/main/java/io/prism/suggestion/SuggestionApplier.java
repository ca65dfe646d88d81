package io.prism.suggestion;

import io.prism.model.ApplyPreview;
import io.prism.model.Suggestion;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Previews and applies suggestions against a workspace.
 *
 * Callers must serialize calls that target the same workspace; the applier keeps no state between calls.
 */
public final class SuggestionApplier {

	@Nonnull
	private final EditPlanner planner;
	@Nonnull
	private final PatchRenderer renderer;
	@Nonnull
	private final ApplyCommitter committer;
	@Nonnull
	private final Log log;

	/**
	 * Creates an applier with the default patch context.
	 *
	 * @param workspace the working tree to edit
	 * @param log       the Maven log
	 */
	public SuggestionApplier(@Nonnull Workspace workspace, @Nonnull Log log) {
		this(new EditPlanner(workspace), new PatchRenderer(), new ApplyCommitter(workspace, log), log);
	}

	SuggestionApplier(
		@Nonnull EditPlanner planner,
		@Nonnull PatchRenderer renderer,
		@Nonnull ApplyCommitter committer,
		@Nonnull Log log
	) {
		this.planner = Objects.requireNonNull(planner, "planner must not be null");
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
		this.committer = Objects.requireNonNull(committer, "committer must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Computes the patches a suggestion would produce without touching the working tree.
	 * Files whose edits leave the content unchanged produce no preview.
	 *
	 * @param suggestion the suggestion to preview
	 * @return one preview per changed file, in path order
	 * @throws SuggestionException if any edit is invalid or a file cannot be read
	 */
	@Nonnull
	public List<ApplyPreview> dryRun(@Nonnull Suggestion suggestion) throws SuggestionException {
		final List<FileChange> changes = this.planner.plan(suggestion);
		final List<ApplyPreview> previews = new ArrayList<>(changes.size());
		for (final FileChange change : changes) {
			if (!change.hasChanges()) {
				continue;
			}
			try {
				previews.add(new ApplyPreview(change.path(), this.renderer.render(change)));
			} catch (IOException e) {
				throw SuggestionException.io(change.path(), "render patch for", e);
			}
		}
		this.log.info("Dry run" + describe(suggestion) + ": " + previews.size() + " file(s) would change");
		return previews;
	}

	/**
	 * Applies a suggestion to the working tree and stages the changed files.
	 *
	 * All files are validated before the first write. Writing and staging then happen file by
	 * file without rollback: if file K fails, files before K stay written and staged while K and
	 * later files are untouched.
	 *
	 * @param suggestion the suggestion to apply
	 * @throws SuggestionException if validation, a write or staging fails
	 */
	public void apply(@Nonnull Suggestion suggestion) throws SuggestionException {
		final List<FileChange> changes = this.planner.plan(suggestion);
		final int written = this.committer.commit(changes);
		this.log.info("Applied" + describe(suggestion) + ": " + written + " file(s) updated");
	}

	@Nonnull
	private static String describe(@Nonnull Suggestion suggestion) {
		return suggestion.title() == null || suggestion.title().isBlank() ? "" : " '" + suggestion.title() + "'";
	}
}
