package io.prism;

import io.prism.diff.DiffEngine;
import io.prism.diff.DiffException;
import io.prism.diff.DiffOptions;
import io.prism.git.GitRepository;
import io.prism.model.ApplyPreview;
import io.prism.model.Diff;
import io.prism.model.JsonCodec;
import io.prism.model.RepositoryInfo;
import io.prism.model.RevisionRange;
import io.prism.model.Suggestion;
import io.prism.suggestion.SuggestionApplier;
import io.prism.suggestion.SuggestionException;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Main Mojo for the Prism plugin providing actions:
 * - show-config: prints current configuration
 * - diff: computes the structured diff of a revision range
 * - dry-run: previews the patches a suggestion file would produce
 * - apply: applies a suggestion file to the working tree and stages the changes
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class PrismMojo extends AbstractMojo {

	/** Which action to perform: "show-config", "diff", "dry-run" or "apply". */
	@Parameter(property = "prism.action", defaultValue = "show-config")
	private String action;

	/** Directory inside the git working tree (default: project base directory). */
	@Parameter(property = "prism.repositoryDir", defaultValue = "${project.basedir}")
	private String repositoryDir;

	/** Base revision of the compared range (default: first parent of the head). */
	@Parameter(property = "prism.baseRevision")
	private String baseRevision;

	/** Head revision of the compared range (default: HEAD). */
	@Parameter(property = "prism.headRevision")
	private String headRevision;

	/** Lines of context around each change. */
	@Parameter(property = "prism.contextLines", defaultValue = "3")
	private int contextLines = DiffOptions.DEFAULT_CONTEXT_LINES;

	/** Minimum similarity (0-100) for rename detection. */
	@Parameter(property = "prism.renameThreshold", defaultValue = "50")
	private int renameThreshold = DiffOptions.DEFAULT_RENAME_THRESHOLD;

	/** Minimum similarity (0-100) for copy detection. */
	@Parameter(property = "prism.copyThreshold", defaultValue = "100")
	private int copyThreshold = DiffOptions.DEFAULT_COPY_THRESHOLD;

	/** JSON file with the suggestion for dry-run and apply (no default). */
	@Parameter(property = "prism.suggestionFile")
	private String suggestionFile;

	/** File the diff JSON or the dry-run patches are written to; logged when not set. */
	@Parameter(property = "prism.outputFile")
	private String outputFile;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "diff":
				diff(getLog());
				break;
			case "dry-run":
				dryRun(getLog());
				break;
			case "apply":
				apply(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, diff, dry-run, apply");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Prism Plugin Configuration:");
		log.info(" - repositoryDir: " + orNotSet(this.repositoryDir));
		if (this.repositoryDir != null && !this.repositoryDir.isBlank()) {
			try (GitRepository repository = GitRepository.open(resolveRepositoryDir())) {
				final RepositoryInfo info = repository.info();
				log.info(" - repository root: " + info.root());
				log.info(" - default branch: " + orNotSet(info.defaultBranch()));
			} catch (IOException e) {
				log.warn("Repository cannot be opened: " + e.getMessage());
			}
		} else {
			log.warn("Repository directory is not set, the current directory is used");
		}
		log.info(" - baseRevision: " + (isBlank(this.baseRevision) ? "<first parent of head>" : this.baseRevision));
		log.info(" - headRevision: " + (isBlank(this.headRevision) ? "<HEAD>" : this.headRevision));
		if (!isBlank(this.baseRevision) && isBlank(this.headRevision)) {
			log.warn("Base revision is ignored unless a head revision is set");
		}
		log.info(" - contextLines: " + this.contextLines);
		log.info(" - renameThreshold: " + this.renameThreshold);
		log.info(" - copyThreshold: " + this.copyThreshold);
		log.info(" - suggestionFile: " + orNotSet(this.suggestionFile));
		if (isBlank(this.suggestionFile)) {
			log.warn("Suggestion file is not set, dry-run and apply actions are unavailable");
		}
		log.info(" - outputFile: " + orNotSet(this.outputFile));
	}

	private void diff(@Nonnull final Log log) throws MojoExecutionException {
		final DiffOptions options = createOptions();
		try (GitRepository repository = GitRepository.open(resolveRepositoryDir())) {
			final DiffEngine engine = new DiffEngine(options, log);
			final Diff diff;
			if (isBlank(this.headRevision)) {
				diff = engine.diff(repository);
			} else {
				final RevisionRange range = repository.resolveRevisionRange(
					isBlank(this.baseRevision) ? null : this.baseRevision, this.headRevision
				);
				diff = engine.diffForRange(repository, range);
			}
			output(log, new JsonCodec().write(diff));
		} catch (DiffException e) {
			throw new MojoExecutionException("Diff failed (" + e.getReason() + "): " + e.getMessage(), e);
		} catch (IOException e) {
			throw new MojoExecutionException("Diff action failed: " + e.getMessage(), e);
		}
	}

	private void dryRun(@Nonnull final Log log) throws MojoExecutionException {
		final Suggestion suggestion = readSuggestion();
		try (GitRepository repository = GitRepository.open(resolveRepositoryDir())) {
			final List<ApplyPreview> previews = new SuggestionApplier(repository, log).dryRun(suggestion);
			final StringBuilder patches = new StringBuilder();
			for (final ApplyPreview preview : previews) {
				patches.append(preview.patch());
			}
			if (previews.isEmpty()) {
				log.info("Suggestion does not change any file");
			} else {
				output(log, patches.toString());
			}
		} catch (SuggestionException e) {
			throw new MojoExecutionException(describe(e), e);
		} catch (IOException e) {
			throw new MojoExecutionException("Dry-run action failed: " + e.getMessage(), e);
		}
	}

	private void apply(@Nonnull final Log log) throws MojoExecutionException {
		final Suggestion suggestion = readSuggestion();
		try (GitRepository repository = GitRepository.open(resolveRepositoryDir())) {
			new SuggestionApplier(repository, log).apply(suggestion);
		} catch (SuggestionException e) {
			log.error(describe(e));
			throw new MojoExecutionException(describe(e), e);
		} catch (IOException e) {
			throw new MojoExecutionException("Apply action failed: " + e.getMessage(), e);
		}
	}

	@Nonnull
	private DiffOptions createOptions() throws MojoExecutionException {
		try {
			return DiffOptions.defaults()
				.withContextLines(this.contextLines)
				.withThresholds(this.renameThreshold, this.copyThreshold);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException("Invalid diff configuration: " + e.getMessage(), e);
		}
	}

	@Nonnull
	private Suggestion readSuggestion() throws MojoExecutionException {
		if (isBlank(this.suggestionFile)) {
			throw new MojoExecutionException("Suggestion file must be specified for " + this.action + " action");
		}
		final Path file = Path.of(this.suggestionFile).toAbsolutePath().normalize();
		try {
			return new JsonCodec().readSuggestion(file);
		} catch (IOException e) {
			throw new MojoExecutionException("Cannot read suggestion file " + file + ": " + e.getMessage(), e);
		}
	}

	private void output(@Nonnull final Log log, @Nonnull final String content) throws IOException {
		if (isBlank(this.outputFile)) {
			log.info(content);
			return;
		}
		final Path file = Path.of(this.outputFile).toAbsolutePath().normalize();
		final Path parent = file.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(file, content, StandardCharsets.UTF_8);
		log.info("Output written to " + file);
	}

	@Nonnull
	private Path resolveRepositoryDir() {
		return isBlank(this.repositoryDir)
			? Path.of("").toAbsolutePath()
			: Path.of(this.repositoryDir).toAbsolutePath().normalize();
	}

	@Nonnull
	private static String describe(@Nonnull final SuggestionException e) {
		return "Suggestion rejected (" + e.getReason() + "): " + e.getMessage();
	}

	@Nonnull
	private static String orNotSet(@Nullable final String value) {
		return isBlank(value) ? "<not set>" : value;
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setRepositoryDir(@Nullable final String repositoryDir) { this.repositoryDir = repositoryDir; }
	void setBaseRevision(@Nullable final String baseRevision) { this.baseRevision = baseRevision; }
	void setHeadRevision(@Nullable final String headRevision) { this.headRevision = headRevision; }
	void setContextLines(final int contextLines) { this.contextLines = contextLines; }
	void setRenameThreshold(final int renameThreshold) { this.renameThreshold = renameThreshold; }
	void setCopyThreshold(final int copyThreshold) { this.copyThreshold = copyThreshold; }
	void setSuggestionFile(@Nullable final String suggestionFile) { this.suggestionFile = suggestionFile; }
	void setOutputFile(@Nullable final String outputFile) { this.outputFile = outputFile; }
}
