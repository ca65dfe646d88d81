package io.prism.diff;

import io.prism.model.Diff;
import io.prism.model.Revision;
import io.prism.model.RevisionRange;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@DisplayName("DiffEngine should drive the backend and assemble diffs")
public class DiffEngineTest {

	private static final RevisionRange RANGE = new RevisionRange(
		Revision.of("1111111111111111111111111111111111111111"),
		Revision.of("2222222222222222222222222222222222222222")
	);

	private ComparisonBackend backend;
	private Log log;
	private DiffEngine engine;

	@BeforeEach
	void setUp() {
		backend = mock(ComparisonBackend.class);
		log = mock(Log.class);
		engine = new DiffEngine(DiffOptions.defaults(), log);
	}

	@Test
	@DisplayName("shouldDiffResolvedRange")
	void shouldDiffResolvedRange() throws Exception {
		when(backend.resolveRevisionRange()).thenReturn(Optional.of(RANGE));
		when(backend.compare(RANGE, DiffOptions.defaults())).thenReturn(events(
			new ComparisonEvent.FileStarted(DeltaKind.ADDED, null, "a.txt", false, false),
			new ComparisonEvent.HunkStarted(0, 0, 1, 1, "@@ -0,0 +1 @@\n".getBytes(StandardCharsets.UTF_8)),
			new ComparisonEvent.Line(LineOrigin.ADDITION, "x\n".getBytes(StandardCharsets.UTF_8), null, 1)
		));

		final Diff diff = engine.diff(backend);

		assertSame(RANGE, diff.range());
		assertEquals(1, diff.files().size());
		assertEquals(1, diff.totalStats().additions());
		verify(log).info("Diff 1111111..2222222: 1 file(s), +1 -0");
	}

	@Test
	@DisplayName("shouldFailWithoutHeadRevision")
	void shouldFailWithoutHeadRevision() throws Exception {
		when(backend.resolveRevisionRange()).thenReturn(Optional.empty());

		final DiffException ex = assertThrows(DiffException.class, () -> engine.diff(backend));

		assertEquals(DiffException.Reason.NO_HEAD_REVISION, ex.getReason());
		verify(backend, never()).compare(any(), any());
	}

	@Test
	@DisplayName("shouldWrapResolutionFailure")
	void shouldWrapResolutionFailure() throws Exception {
		final IOException cause = new IOException("corrupt refs");
		when(backend.resolveRevisionRange()).thenThrow(cause);

		final DiffException ex = assertThrows(DiffException.class, () -> engine.diff(backend));

		assertEquals(DiffException.Reason.BACKEND, ex.getReason());
		assertSame(cause, ex.getCause());
	}

	@Test
	@DisplayName("shouldWrapCompareFailure")
	void shouldWrapCompareFailure() throws Exception {
		when(backend.compare(any(), any())).thenThrow(new IOException("missing tree"));

		final DiffException ex = assertThrows(DiffException.class, () -> engine.diffForRange(backend, RANGE));

		assertEquals(DiffException.Reason.BACKEND, ex.getReason());
		assertTrue(ex.getMessage().contains("missing tree"));
	}

	@Test
	@DisplayName("shouldWrapFailureDuringIteration")
	void shouldWrapFailureDuringIteration() throws Exception {
		final ComparisonStream failing = new ComparisonStream() {
			@Override
			public boolean hasNext() {
				throw new UncheckedIOException(new IOException("blob vanished"));
			}

			@Override
			public ComparisonEvent next() {
				throw new IllegalStateException();
			}

			@Override
			public void close() {
				// nothing held
			}
		};
		when(backend.compare(any(), any())).thenReturn(failing);

		final DiffException ex = assertThrows(DiffException.class, () -> engine.diffForRange(backend, RANGE));

		assertEquals(DiffException.Reason.BACKEND, ex.getReason());
		assertInstanceOf(IOException.class, ex.getCause());
	}

	@Test
	@DisplayName("shouldDescribeRootCommitRange")
	void shouldDescribeRootCommitRange() throws Exception {
		final RevisionRange root = new RevisionRange(null, Revision.of("abcdef0123"));
		when(backend.compare(any(), any())).thenReturn(events());
		when(log.isDebugEnabled()).thenReturn(true);

		final Diff diff = engine.diffForRange(backend, root);

		assertTrue(diff.files().isEmpty());
		verify(log).info(contains("<empty>..abcdef0"));
	}

	@Test
	@DisplayName("shouldLogEachFileAtDebug")
	void shouldLogEachFileAtDebug() throws Exception {
		when(log.isDebugEnabled()).thenReturn(true);
		when(backend.compare(any(), any())).thenReturn(events(
			new ComparisonEvent.FileStarted(DeltaKind.RENAMED, "a.txt", "b.txt", false, false)
		));

		engine.diffForRange(backend, RANGE);

		verify(log).debug("[RENAMED] b.txt (from a.txt) +0 -0");
	}

	@Test
	@DisplayName("shouldCloseStreamWhenFoldingFails")
	void shouldCloseStreamWhenFoldingFails() throws Exception {
		final ComparisonStream stream = mock(ComparisonStream.class);
		when(stream.hasNext()).thenReturn(true);
		when(stream.next()).thenThrow(new IllegalStateException("corrupt event"));
		when(backend.compare(any(), any())).thenReturn(stream);

		assertThrows(IllegalStateException.class, () -> engine.diffForRange(backend, RANGE));

		verify(stream).close();
	}

	@Test
	@DisplayName("shouldCloseStreamAfterSuccessfulDiff")
	void shouldCloseStreamAfterSuccessfulDiff() throws Exception {
		final ComparisonStream stream = mock(ComparisonStream.class);
		when(stream.hasNext()).thenReturn(false);
		when(backend.compare(any(), any())).thenReturn(stream);

		engine.diffForRange(backend, RANGE);

		verify(stream).close();
	}

	private static ComparisonStream events(ComparisonEvent... events) {
		final Iterator<ComparisonEvent> iterator = List.of(events).iterator();
		return new ComparisonStream() {
			@Override
			public boolean hasNext() {
				return iterator.hasNext();
			}

			@Override
			public ComparisonEvent next() {
				return iterator.next();
			}

			@Override
			public void close() {
				// nothing held
			}
		};
	}
}
