package io.prism.git;

import io.prism.diff.ComparisonBackend;
import io.prism.diff.ComparisonStream;
import io.prism.diff.DiffOptions;
import io.prism.model.RepositoryInfo;
import io.prism.model.Revision;
import io.prism.model.RevisionRange;
import io.prism.model.Signature;
import io.prism.suggestion.Workspace;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.dircache.DirCache;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Git repository backed by JGit. Resolves revisions, compares commit trees and gives access to the
 * working tree so suggestions can be written and staged.
 *
 * Instances hold open repository handles and must be closed.
 */
public final class GitRepository implements ComparisonBackend, Workspace, AutoCloseable {

	private static final String ORIGIN_HEAD = Constants.R_REMOTES + Constants.DEFAULT_REMOTE_NAME + "/" + Constants.HEAD;
	private static final String ORIGIN_PREFIX = Constants.R_REMOTES + Constants.DEFAULT_REMOTE_NAME + "/";

	@Nonnull
	private final Repository repository;
	@Nonnull
	private final Git git;
	@Nonnull
	private final Path root;

	private GitRepository(@Nonnull Repository repository) {
		this.repository = repository;
		this.git = new Git(repository);
		this.root = repository.getWorkTree().toPath().toAbsolutePath().normalize();
	}

	/**
	 * Opens the repository that contains the given directory. Parent directories are searched
	 * for the `.git` directory.
	 *
	 * @param directory a directory inside the working tree
	 * @return the opened repository
	 * @throws IOException if no repository is found or it has no working tree
	 */
	@Nonnull
	public static GitRepository open(@Nonnull Path directory) throws IOException {
		Objects.requireNonNull(directory, "directory must not be null");
		final FileRepositoryBuilder builder = new FileRepositoryBuilder()
			.findGitDir(directory.toAbsolutePath().normalize().toFile());
		if (builder.getGitDir() == null) {
			throw new IOException("Not a git repository (or any parent): " + directory);
		}
		final Repository repository = builder.setMustExist(true).build();
		if (repository.isBare()) {
			repository.close();
			throw new IOException("Repository has no working tree: " + builder.getGitDir());
		}
		return new GitRepository(repository);
	}

	/**
	 * Returns the location and default branch of the repository.
	 *
	 * @return repository information
	 * @throws IOException if references cannot be read
	 */
	@Nonnull
	public RepositoryInfo info() throws IOException {
		String defaultBranch = null;
		final Ref originHead = this.repository.exactRef(ORIGIN_HEAD);
		if (originHead != null && originHead.isSymbolic()) {
			final String target = originHead.getTarget().getName();
			defaultBranch = target.startsWith(ORIGIN_PREFIX) ? target.substring(ORIGIN_PREFIX.length()) : target;
		}
		return new RepositoryInfo(this.root.toString(), defaultBranch);
	}

	/**
	 * Resolves HEAD. The reference is the current branch name unless HEAD is detached.
	 *
	 * @return the head revision, or empty if the current branch has no commits yet
	 * @throws IOException if the repository cannot be read
	 */
	@Nonnull
	public Optional<Revision> headRevision() throws IOException {
		final ObjectId head = this.repository.resolve(Constants.HEAD);
		if (head == null) {
			return Optional.empty();
		}
		try (RevWalk walk = new RevWalk(this.repository)) {
			final String branch = this.repository.getFullBranch();
			final String reference = branch != null && branch.startsWith(Constants.R_HEADS)
				? Repository.shortenRefName(branch)
				: null;
			return Optional.of(toRevision(walk.parseCommit(head), reference));
		}
	}

	/**
	 * Resolves the first parent of a revision.
	 *
	 * @param revision the child revision
	 * @return the parent, or empty for a root commit
	 * @throws IOException if the revision cannot be read
	 */
	@Nonnull
	public Optional<Revision> baseRevision(@Nonnull Revision revision) throws IOException {
		Objects.requireNonNull(revision, "revision must not be null");
		try (RevWalk walk = new RevWalk(this.repository)) {
			final RevCommit commit = walk.parseCommit(parseOid(revision.oid()));
			if (commit.getParentCount() == 0) {
				return Optional.empty();
			}
			return Optional.of(toRevision(walk.parseCommit(commit.getParent(0)), null));
		}
	}

	/**
	 * Resolves any revision expression git understands, such as a branch, a tag or `HEAD~2`.
	 *
	 * @param expression the revision expression
	 * @return the revision
	 * @throws IOException if the expression does not name a commit
	 */
	@Nonnull
	public Revision resolveRevision(@Nonnull String expression) throws IOException {
		Objects.requireNonNull(expression, "expression must not be null");
		final ObjectId id = this.repository.resolve(expression + "^{commit}");
		if (id == null) {
			throw new IOException("Unknown revision: " + expression);
		}
		try (RevWalk walk = new RevWalk(this.repository)) {
			final Ref ref = this.repository.findRef(expression);
			final String reference = ref != null && ref.getName().startsWith(Constants.R_HEADS)
				? Repository.shortenRefName(ref.getName())
				: null;
			return toRevision(walk.parseCommit(id), reference);
		}
	}

	@Nonnull
	@Override
	public Optional<RevisionRange> resolveRevisionRange() throws IOException {
		final Optional<Revision> head = headRevision();
		if (head.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new RevisionRange(baseRevision(head.get()).orElse(null), head.get()));
	}

	/**
	 * Resolves a range from revision expressions.
	 *
	 * @param base base expression, or null to use the first parent of the head
	 * @param head head expression
	 * @return the range
	 * @throws IOException if an expression does not name a commit
	 */
	@Nonnull
	public RevisionRange resolveRevisionRange(@Nullable String base, @Nonnull String head) throws IOException {
		final Revision headRevision = resolveRevision(head);
		final Revision baseRevision = base == null
			? baseRevision(headRevision).orElse(null)
			: resolveRevision(base);
		return new RevisionRange(baseRevision, headRevision);
	}

	@Nonnull
	@Override
	public ComparisonStream compare(@Nonnull RevisionRange range, @Nonnull DiffOptions options) throws IOException {
		Objects.requireNonNull(range, "range must not be null");
		Objects.requireNonNull(options, "options must not be null");
		try (RevWalk walk = new RevWalk(this.repository)) {
			final ObjectId headTree = walk.parseCommit(parseOid(range.head().oid())).getTree();
			final ObjectId baseTree = range.base() == null
				? null
				: walk.parseCommit(parseOid(range.base().oid())).getTree();
			return new TreeComparison(this.repository, options).compare(baseTree, headTree);
		}
	}

	@Nonnull
	@Override
	public Path root() {
		return this.root;
	}

	@Nonnull
	@Override
	public String read(@Nonnull Path file) throws IOException {
		final byte[] bytes = Files.readAllBytes(file);
		try {
			return StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(bytes))
				.toString();
		} catch (CharacterCodingException e) {
			throw new IOException("File is not valid UTF-8: " + file, e);
		}
	}

	@Override
	public void write(@Nonnull Path file, @Nonnull String content) throws IOException {
		Files.write(file, content.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Stages a working tree file. The path must be the index form: relative to the root and
	 * separated by '/'.
	 *
	 * @param relativePath index path of the file
	 * @throws IOException if adding fails or the index has no entry for the path afterwards
	 */
	@Override
	public void stage(@Nonnull String relativePath) throws IOException {
		final DirCache index;
		try {
			index = this.git.add().addFilepattern(relativePath).call();
		} catch (GitAPIException e) {
			throw new IOException("Failed to stage " + relativePath + ": " + e.getMessage(), e);
		}
		if (index.getEntry(relativePath) == null) {
			throw new IOException("Failed to stage " + relativePath + ": no index entry matches the path");
		}
	}

	@Override
	public void close() {
		this.git.close();
		this.repository.close();
	}

	@Nonnull
	private static ObjectId parseOid(@Nonnull String oid) throws IOException {
		try {
			return ObjectId.fromString(oid);
		} catch (IllegalArgumentException e) {
			throw new IOException("Unknown revision: " + oid, e);
		}
	}

	@Nonnull
	private static Revision toRevision(@Nonnull RevCommit commit, @Nullable String reference) {
		return new Revision(
			commit.getName(),
			reference,
			commit.getShortMessage(),
			toSignature(commit.getAuthorIdent()),
			toSignature(commit.getCommitterIdent()),
			(long) commit.getCommitTime()
		);
	}

	@Nullable
	private static Signature toSignature(@Nullable PersonIdent ident) {
		if (ident == null) {
			return null;
		}
		final String email = ident.getEmailAddress();
		return new Signature(ident.getName(), email == null || email.isEmpty() ? null : email);
	}
}
