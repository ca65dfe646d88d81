package io.prism.git;

import io.prism.diff.DiffEngine;
import io.prism.diff.DiffException;
import io.prism.diff.DiffOptions;
import io.prism.model.Diff;
import io.prism.model.DiffFile;
import io.prism.model.DiffHunk;
import io.prism.model.DiffLine;
import io.prism.model.DiffLineKind;
import io.prism.model.DiffRange;
import io.prism.model.FileStatus;
import io.prism.model.Revision;
import io.prism.model.RevisionRange;
import org.apache.maven.plugin.logging.Log;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("GitRepository should resolve revisions and diff commit trees")
public class GitRepositoryTest {

	private GitTestRepository fixture;
	private GitRepository repository;
	private DiffEngine engine;

	@BeforeEach
	void setUp() throws Exception {
		fixture = GitTestRepository.create();
		repository = GitRepository.open(fixture.root());
		engine = new DiffEngine(DiffOptions.defaults(), mock(Log.class));
	}

	@AfterEach
	void tearDown() throws Exception {
		repository.close();
		fixture.close();
	}

	@Test
	@DisplayName("shouldReturnEmptyRangeWhenHeadIsUnborn")
	void shouldReturnEmptyRangeWhenHeadIsUnborn() throws Exception {
		assertTrue(repository.resolveRevisionRange().isEmpty());
		assertTrue(repository.headRevision().isEmpty());

		final DiffException ex = assertThrows(DiffException.class, () -> engine.diff(repository));
		assertEquals(DiffException.Reason.NO_HEAD_REVISION, ex.getReason());
	}

	@Test
	@DisplayName("shouldResolveHeadAndFirstParent")
	void shouldResolveHeadAndFirstParent() throws Exception {
		final String first = fixture.write("a.txt", "one\n").commit("First commit");
		final String second = fixture.write("a.txt", "two\n").commit("Second commit\n\nWith a body");

		final RevisionRange range = repository.resolveRevisionRange().orElseThrow();

		assertEquals(second, range.head().oid());
		assertEquals("main", range.head().reference());
		assertEquals("Second commit", range.head().summary());
		assertEquals("Test User", range.head().author().name());
		assertEquals("test@example.com", range.head().committer().email());
		assertNotNull(range.head().timestamp());
		assertNotNull(range.base());
		assertEquals(first, range.base().oid());
		assertNull(range.base().reference());
	}

	@Test
	@DisplayName("shouldResolveExplicitRevisionExpressions")
	void shouldResolveExplicitRevisionExpressions() throws Exception {
		final String first = fixture.write("a.txt", "one\n").commit("First");
		fixture.write("a.txt", "two\n").commit("Second");
		final String third = fixture.write("a.txt", "three\n").commit("Third");

		final RevisionRange range = repository.resolveRevisionRange("HEAD~2", "main");
		assertEquals(first, range.base().oid());
		assertEquals(third, range.head().oid());
		assertEquals("main", range.head().reference());

		assertThrows(IOException.class, () -> repository.resolveRevision("no-such-branch"));
	}

	@Test
	@DisplayName("shouldReportEveryFileOfRootCommitAsAdded")
	void shouldReportEveryFileOfRootCommitAsAdded() throws Exception {
		fixture.write("b.txt", "beta\n").write("a.txt", "alpha\nsecond\n").commit("Initial");

		final Diff diff = engine.diff(repository);

		assertNull(diff.range().base());
		assertEquals(2, diff.files().size());
		assertEquals("a.txt", diff.files().get(0).path());
		assertEquals("b.txt", diff.files().get(1).path());
		for (final DiffFile file : diff.files()) {
			assertEquals(FileStatus.ADDED, file.status());
			assertNull(file.oldPath());
		}
		final DiffFile a = diff.files().get(0);
		assertEquals(2, a.stats().additions());
		assertEquals(0, a.stats().deletions());
		assertEquals(new DiffRange(0, 0, 1, 2), a.hunks().get(0).header());
	}

	@Test
	@DisplayName("shouldDiffSingleLineModification")
	void shouldDiffSingleLineModification() throws Exception {
		fixture.write("greeting.txt", "hello\n").commit("Initial");
		fixture.write("greeting.txt", "world\n").commit("Change greeting");

		final Diff diff = engine.diff(repository);

		assertEquals(1, diff.files().size());
		final DiffFile file = diff.files().get(0);
		assertEquals(FileStatus.MODIFIED, file.status());
		assertFalse(file.binary());
		assertEquals(1, file.stats().additions());
		assertEquals(1, file.stats().deletions());
		assertEquals(1, file.hunks().size());

		final DiffHunk hunk = file.hunks().get(0);
		assertEquals(new DiffRange(1, 1, 1, 1), hunk.header());
		assertNull(hunk.section());
		assertEquals(
			List.of(DiffLine.deletion("hello", 1), DiffLine.addition("world", 1)),
			hunk.lines()
		);
	}

	@Test
	@DisplayName("shouldClassifyMixedChanges")
	void shouldClassifyMixedChanges() throws Exception {
		fixture.write("a.txt", "one\ntwo\nthree\n")
			.write("b.txt", "keep\n")
			.write("gone.txt", "bye\n")
			.write("old.txt", numberedLines(10))
			.commit("Initial");
		fixture.write("a.txt", "one\nTWO\nthree\n")
			.write("new.txt", "fresh\n")
			.delete("gone.txt")
			.delete("old.txt")
			.write("moved.txt", numberedLines(10).replace("line 5\n", "line five\n"))
			.commit("Mixed changes");

		final Diff diff = engine.diff(repository);

		assertEquals(
			List.of("a.txt", "gone.txt", "moved.txt", "new.txt"),
			diff.files().stream().map(DiffFile::path).toList()
		);

		final DiffFile modified = diff.file("a.txt").orElseThrow();
		assertEquals(FileStatus.MODIFIED, modified.status());
		final List<DiffLine> lines = modified.hunks().get(0).lines();
		assertEquals(DiffLine.context("one", 1, 1), lines.get(0));
		assertEquals(DiffLine.deletion("two", 2), lines.get(1));
		assertEquals(DiffLine.addition("TWO", 2), lines.get(2));
		assertEquals(DiffLine.context("three", 3, 3), lines.get(3));

		final DiffFile deleted = diff.file("gone.txt").orElseThrow();
		assertEquals(FileStatus.DELETED, deleted.status());
		assertEquals(1, deleted.stats().deletions());

		final DiffFile renamed = diff.file("moved.txt").orElseThrow();
		assertEquals(FileStatus.RENAMED, renamed.status());
		assertEquals("old.txt", renamed.oldPath());
		assertEquals(1, renamed.stats().additions());
		assertEquals(1, renamed.stats().deletions());

		final DiffFile added = diff.file("new.txt").orElseThrow();
		assertEquals(FileStatus.ADDED, added.status());
		assertNull(added.oldPath());

		assertEquals(3, diff.totalStats().additions());
		assertEquals(3, diff.totalStats().deletions());
	}

	@Test
	@DisplayName("shouldDetectPureRenameWithoutHunks")
	void shouldDetectPureRenameWithoutHunks() throws Exception {
		fixture.write("docs/readme.txt", numberedLines(5)).commit("Initial");
		fixture.delete("docs/readme.txt").write("docs/guide.txt", numberedLines(5)).commit("Rename");

		final Diff diff = engine.diff(repository);

		assertEquals(1, diff.files().size());
		final DiffFile file = diff.files().get(0);
		assertEquals(FileStatus.RENAMED, file.status());
		assertEquals("docs/guide.txt", file.path());
		assertEquals("docs/readme.txt", file.oldPath());
		assertTrue(file.hunks().isEmpty());
		assertEquals(0, file.stats().additions());
		assertEquals(0, file.stats().deletions());
	}

	@Test
	@DisplayName("shouldDetectCopyOfUnmodifiedFile")
	void shouldDetectCopyOfUnmodifiedFile() throws Exception {
		fixture.write("src.txt", "alpha\nbeta\n").commit("Initial");
		fixture.write("copy.txt", "alpha\nbeta\n").commit("Copy");

		final Diff diff = engine.diff(repository);

		assertEquals(1, diff.files().size());
		final DiffFile file = diff.files().get(0);
		assertEquals(FileStatus.COPIED, file.status());
		assertEquals("copy.txt", file.path());
		assertEquals("src.txt", file.oldPath());
		assertTrue(file.hunks().isEmpty());
	}

	@Test
	@DisplayName("shouldReportSimilarFileAsAddedWhenCopyThresholdRequiresIdenticalContent")
	void shouldReportSimilarFileAsAddedWhenCopyThresholdRequiresIdenticalContent() throws Exception {
		fixture.write("src.txt", numberedLines(10)).commit("Initial");
		fixture.write("copy.txt", numberedLines(10).replace("line 3\n", "line three\n")).commit("Copy with edit");

		final DiffFile strict = engine.diff(repository).files().get(0);
		assertEquals(FileStatus.ADDED, strict.status());

		final DiffEngine lenient = new DiffEngine(DiffOptions.defaults().withThresholds(50, 50), mock(Log.class));
		final DiffFile copied = lenient.diff(repository).files().get(0);
		assertEquals(FileStatus.COPIED, copied.status());
		assertEquals("src.txt", copied.oldPath());
	}

	@Test
	@DisplayName("shouldDetectRenameFromRewrittenFile")
	void shouldDetectRenameFromRewrittenFile() throws Exception {
		fixture.write("a.txt", numberedLines(10)).commit("Initial");
		fixture.write("a.txt", "alpha\nbeta\ngamma\ndelta\nepsilon\n")
			.write("b.txt", numberedLines(10))
			.commit("Move content and rewrite");

		final Diff diff = engine.diff(repository);

		final DiffFile moved = diff.file("b.txt").orElseThrow();
		assertEquals(FileStatus.RENAMED, moved.status());
		assertEquals("a.txt", moved.oldPath());
		assertTrue(moved.hunks().isEmpty());

		final DiffFile rewritten = diff.file("a.txt").orElseThrow();
		assertNull(rewritten.oldPath());
		assertEquals(5, rewritten.stats().additions());
	}

	@Test
	@DisplayName("shouldKeepSlightlyModifiedFileAsModification")
	void shouldKeepSlightlyModifiedFileAsModification() throws Exception {
		fixture.write("a.txt", numberedLines(10)).commit("Initial");
		fixture.write("a.txt", numberedLines(10).replace("line 4\n", "line four\n"))
			.write("b.txt", numberedLines(10))
			.commit("Copy and edit");

		final Diff diff = engine.diff(repository);

		assertEquals(FileStatus.MODIFIED, diff.file("a.txt").orElseThrow().status());
		final DiffFile copy = diff.file("b.txt").orElseThrow();
		assertEquals(FileStatus.COPIED, copy.status());
		assertEquals("a.txt", copy.oldPath());
	}

	@Test
	@DisplayName("shouldDiffTextWithLoneCarriageReturn")
	void shouldDiffTextWithLoneCarriageReturn() throws Exception {
		fixture.write("a.txt", "one\rtwo\nthree\n").commit("Initial");
		fixture.write("a.txt", "one\rtwo\nTHREE\n").commit("Change");

		final DiffFile file = engine.diff(repository).file("a.txt").orElseThrow();

		assertFalse(file.binary());
		assertEquals(1, file.hunks().size());
		assertEquals(1, file.stats().additions());
		assertEquals(1, file.stats().deletions());
		assertEquals(DiffLine.context("one\rtwo", 1, 1), file.hunks().get(0).lines().get(0));
	}

	@Test
	@DisplayName("shouldReportMalformedRevisionIdAsBackendFailure")
	void shouldReportMalformedRevisionIdAsBackendFailure() throws Exception {
		final String commit = fixture.write("a.txt", "x\n").commit("Initial");

		final DiffException ex = assertThrows(
			DiffException.class,
			() -> engine.diffForRange(repository, new RevisionRange(Revision.of(commit), Revision.of("not-an-oid")))
		);

		assertEquals(DiffException.Reason.BACKEND, ex.getReason());
		assertInstanceOf(IOException.class, ex.getCause());
		assertTrue(ex.getCause().getMessage().contains("not-an-oid"));
		assertThrows(IOException.class, () -> repository.baseRevision(Revision.of("zz")));
	}

	@Test
	@DisplayName("shouldMarkBinaryFilesWithoutHunks")
	void shouldMarkBinaryFilesWithoutHunks() throws Exception {
		fixture.write("a.txt", "text\n").commit("Initial");
		fixture.write("data.bin", new byte[]{0, 1, 2, 0, 'x', '\n'}).commit("Add binary");

		final DiffFile file = engine.diff(repository).file("data.bin").orElseThrow();

		assertEquals(FileStatus.ADDED, file.status());
		assertTrue(file.binary());
		assertTrue(file.hunks().isEmpty());
		assertEquals(0, file.stats().additions());
	}

	@Test
	@DisplayName("shouldReportSymlinkReplacingFileAsTypeChange")
	void shouldReportSymlinkReplacingFileAsTypeChange() throws Exception {
		fixture.write("target.txt", "target\n").write("link.txt", "plain\n").commit("Initial");
		fixture.delete("link.txt");
		try {
			Files.createSymbolicLink(fixture.root().resolve("link.txt"), Path.of("target.txt"));
		} catch (UnsupportedOperationException | IOException e) {
			Assumptions.abort("Symbolic links are not supported: " + e.getMessage());
		}
		fixture.commit("Replace file with link");

		final Diff diff = engine.diff(repository);

		assertEquals(1, diff.files().size());
		final DiffFile file = diff.files().get(0);
		assertEquals(FileStatus.TYPE_CHANGE, file.status());
		assertEquals("link.txt", file.path());
		assertNull(file.oldPath());
	}

	@Test
	@DisplayName("shouldDropEndOfFileMarkerFromLines")
	void shouldDropEndOfFileMarkerFromLines() throws Exception {
		fixture.write("a.txt", "a\nb").commit("Initial");
		fixture.write("a.txt", "a\nc").commit("Change last line");

		final DiffHunk hunk = engine.diff(repository).files().get(0).hunks().get(0);

		assertEquals(
			List.of(DiffLine.context("a", 1, 1), DiffLine.deletion("b", 2), DiffLine.addition("c", 2)),
			hunk.lines()
		);
	}

	@Test
	@DisplayName("shouldSplitDistantChangesIntoHunksWithSection")
	void shouldSplitDistantChangesIntoHunksWithSection() throws Exception {
		final StringBuilder original = new StringBuilder("public class Sample {\n");
		for (int i = 1; i <= 30; i++) {
			original.append("\tint field").append(i).append(";\n");
		}
		original.append("}\n");
		final String changed = original.toString()
			.replace("\tint field2;\n", "\tlong field2;\n")
			.replace("\tint field25;\n", "\tlong field25;\n");
		fixture.write("Sample.java", original.toString()).commit("Initial");
		fixture.write("Sample.java", changed).commit("Widen fields");

		final DiffFile file = engine.diff(repository).files().get(0);

		assertEquals(2, file.hunks().size());
		assertNull(file.hunks().get(0).section());
		assertEquals("public class Sample {", file.hunks().get(1).section());
		assertEquals(new DiffRange(23, 7, 23, 7), file.hunks().get(1).header());
		for (final DiffHunk hunk : file.hunks()) {
			assertEquals(1, hunk.additions());
			assertEquals(1, hunk.deletions());
			assertEquals(DiffLineKind.CONTEXT, hunk.lines().get(0).kind());
		}
	}

	@Test
	@DisplayName("shouldMergeChangesWithinContextIntoOneHunk")
	void shouldMergeChangesWithinContextIntoOneHunk() throws Exception {
		fixture.write("a.txt", numberedLines(20)).commit("Initial");
		fixture.write("a.txt", numberedLines(20).replace("line 5\n", "five\n").replace("line 10\n", "ten\n"))
			.commit("Two nearby changes");

		final DiffFile file = engine.diff(repository).files().get(0);
		assertEquals(1, file.hunks().size());
		assertEquals(new DiffRange(2, 12, 2, 12), file.hunks().get(0).header());

		final DiffEngine narrow = new DiffEngine(DiffOptions.defaults().withContextLines(1), mock(Log.class));
		assertEquals(2, narrow.diff(repository).files().get(0).hunks().size());
	}

	@Test
	@DisplayName("shouldReadWriteAndStageWorkingTreeFiles")
	void shouldReadWriteAndStageWorkingTreeFiles() throws Exception {
		fixture.write("a.txt", "before\n").commit("Initial");
		final Path file = repository.root().resolve("a.txt");

		assertEquals("before\n", repository.read(file));
		repository.write(file, "after é\n");
		assertEquals("after é\n", Files.readString(file, StandardCharsets.UTF_8));

		repository.stage("a.txt");
		assertEquals("after é\n", fixture.stagedContent("a.txt"));
	}

	@Test
	@DisplayName("shouldFailStagingPathWithoutIndexEntry")
	void shouldFailStagingPathWithoutIndexEntry() throws Exception {
		fixture.write("a.txt", "before\n").commit("Initial");
		repository.write(repository.root().resolve("a.txt"), "after\n");

		final IOException ex = assertThrows(IOException.class, () -> repository.stage("./a.txt"));

		assertTrue(ex.getMessage().contains("./a.txt"));
		assertEquals("before\n", fixture.stagedContent("a.txt"));
	}

	@Test
	@DisplayName("shouldFailReadingMissingOrNonUtf8Files")
	void shouldFailReadingMissingOrNonUtf8Files() throws Exception {
		fixture.write("latin1.txt", new byte[]{'c', 'a', 'f', (byte) 0xE9, '\n'});

		assertThrows(NoSuchFileException.class, () -> repository.read(repository.root().resolve("missing.txt")));
		final IOException ex = assertThrows(IOException.class, () -> repository.read(repository.root().resolve("latin1.txt")));
		assertFalse(ex instanceof NoSuchFileException);
	}

	@Test
	@DisplayName("shouldDiscoverRepositoryFromSubdirectory")
	void shouldDiscoverRepositoryFromSubdirectory() throws Exception {
		fixture.write("nested/deep/file.txt", "x\n").commit("Initial");

		try (GitRepository nested = GitRepository.open(fixture.root().resolve("nested/deep"))) {
			assertEquals(fixture.root(), nested.root());
			assertEquals(fixture.root().toString(), nested.info().root());
			assertNull(nested.info().defaultBranch());
		}
	}

	@Test
	@DisplayName("shouldRejectDirectoryOutsideRepository")
	void shouldRejectDirectoryOutsideRepository() throws Exception {
		final Path plain = Files.createTempDirectory("prism-plain-");
		try {
			final Optional<Path> enclosing = findEnclosingGitDir(plain);
			Assumptions.assumeTrue(enclosing.isEmpty(), "temporary directory is inside a git repository");
			assertThrows(IOException.class, () -> GitRepository.open(plain));
		} finally {
			GitTestRepository.deleteRecursively(plain);
		}
	}

	@Test
	@DisplayName("shouldRejectBareRepository")
	void shouldRejectBareRepository() throws Exception {
		final Path bare = Files.createTempDirectory("prism-bare-");
		try {
			Git.init().setDirectory(bare.toFile()).setBare(true).call().close();
			assertThrows(IOException.class, () -> GitRepository.open(bare));
		} finally {
			GitTestRepository.deleteRecursively(bare);
		}
	}

	@Test
	@DisplayName("shouldCarryRevisionMetadataForExplicitRange")
	void shouldCarryRevisionMetadataForExplicitRange() throws Exception {
		final String first = fixture.write("a.txt", "1\n").commit("First");
		final String second = fixture.write("a.txt", "2\n").commit("Second");

		final Revision resolved = repository.resolveRevision(second.substring(0, 10));
		assertEquals(second, resolved.oid());
		assertEquals("Second", resolved.summary());

		final Diff diff = engine.diffForRange(repository, new RevisionRange(Revision.of(first), Revision.of(second)));
		assertEquals(1, diff.files().size());
		assertEquals(first, diff.range().base().oid());
	}

	private static String numberedLines(int count) {
		final StringBuilder sb = new StringBuilder();
		for (int i = 1; i <= count; i++) {
			sb.append("line ").append(i).append('\n');
		}
		return sb.toString();
	}

	private static Optional<Path> findEnclosingGitDir(Path start) {
		Path current = start;
		while (current != null) {
			if (Files.exists(current.resolve(".git"))) {
				return Optional.of(current);
			}
			current = current.getParent();
		}
		return Optional.empty();
	}
}
