package co.fanki.codeintel.graph.application;

import co.fanki.codeintel.config.SqliteDatabases;
import co.fanki.codeintel.graph.domain.CodeBlock;
import co.fanki.codeintel.graph.domain.CodeBlockScanner;
import co.fanki.codeintel.graph.domain.FileStatus;
import co.fanki.codeintel.graph.domain.IndexStateRepository;
import co.fanki.codeintel.graph.domain.IndexingJobState;
import co.fanki.codeintel.graph.domain.ProjectGraphStore;
import co.fanki.codeintel.graph.domain.VectorIndex;
import co.fanki.codeintel.shared.DomainException;
import co.fanki.codeintel.shared.ProjectScope;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ProjectIndexingService} with mocked parser and vector
 * index and real SQLite stores.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectIndexingServiceTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private ProjectGraphStore graphStore;
    private IndexStateRepository indexStateRepository;
    private CodeBlockScanner scanner;
    private VectorIndex vectorIndex;

    @BeforeEach
    void setUp() throws Exception {
        final Jdbi jdbi = SqliteDatabases.open(tempDir.resolve("graph.db"),
                SqliteDatabases.GRAPH_MIGRATIONS);
        graphStore = new ProjectGraphStore(jdbi);
        indexStateRepository = new IndexStateRepository(jdbi);
        scanner = createMock(CodeBlockScanner.class);
        vectorIndex = createMock(VectorIndex.class);

        sourceDir = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(sourceDir.resolve("A.java"), "class A {}",
                StandardCharsets.UTF_8);
    }

    private ProjectIndexingService service() {
        return new ProjectIndexingService(graphStore, indexStateRepository,
                Optional.of(scanner), Optional.of(vectorIndex));
    }

    private static List<CodeBlock> blocks() {
        return List.of(
                new CodeBlock("A", "A", List.of("B"), "A.java", null),
                new CodeBlock("B", "B", List.of(), "A.java", null));
    }

    @Test
    void whenIndexing_givenParsedBlocks_shouldRebuildGraphAndRecordStatus() {
        expect(scanner.scan(sourceDir, true)).andReturn(blocks());
        vectorIndex.indexCodeBlocks(anyObject());
        expectLastCall();
        vectorIndex.indexFileSummaries(anyObject());
        expectLastCall();
        vectorIndex.persist();
        expectLastCall();
        replay(scanner, vectorIndex);

        final String overview = service().indexDirectory(sourceDir, "demo",
                true);

        verify(scanner, vectorIndex);
        assertTrue(overview.contains("Project: demo"));
        assertTrue(overview.contains("Methods indexed: 2"));
        assertTrue(graphStore.findNode(ProjectScope.of("demo"), "demo::A")
                .isPresent());

        final FileStatus status = indexStateRepository.findFileStatus(
                ProjectScope.of("demo"), "A.java").orElseThrow();
        assertEquals(ProjectIndexingService.FILE_INDEXED, status.status());
        assertEquals(64, status.fileHash().length());

        final IndexingJobState job = indexStateRepository.findIndexingJob(
                ProjectScope.of("demo")).orElseThrow();
        assertEquals(IndexingJobState.COMPLETED, job.status());
        assertEquals(1, job.filesTotal());
    }

    @Test
    void whenIndexing_givenScannerFailure_shouldMarkJobFailed() {
        expect(scanner.scan(eq(sourceDir), eq(true)))
                .andThrow(new IllegalStateException("parser crashed"));
        replay(scanner, vectorIndex);

        assertThrows(IllegalStateException.class,
                () -> service().indexDirectory(sourceDir, "demo", false));

        final IndexingJobState job = indexStateRepository.findIndexingJob(
                ProjectScope.of("demo")).orElseThrow();
        assertEquals(IndexingJobState.FAILED, job.status());
        assertEquals("parser crashed", job.message());
    }

    @Test
    void whenIndexing_givenNoScanner_shouldThrowDomainException() {
        final ProjectIndexingService service = new ProjectIndexingService(
                graphStore, indexStateRepository, Optional.empty(),
                Optional.empty());

        final DomainException ex = assertThrows(DomainException.class,
                () -> service.indexDirectory(sourceDir, "demo", false));

        assertEquals("INDEXING_UNAVAILABLE", ex.getErrorCode());
    }

    @Test
    void whenIndexing_givenNoVectorIndex_shouldStillRebuildGraph() {
        expect(scanner.scan(sourceDir, true)).andReturn(blocks());
        replay(scanner);

        final ProjectIndexingService service = new ProjectIndexingService(
                graphStore, indexStateRepository, Optional.of(scanner),
                Optional.empty());

        final String overview = service.indexDirectory(sourceDir, null, false);

        assertTrue(overview.startsWith("Project: (default)"));
        assertTrue(graphStore.findNode(ProjectScope.unscoped(), "A")
                .isPresent());
    }

    @Test
    void whenHashing_givenMissingFile_shouldReturnEmpty() {
        assertTrue(ProjectIndexingService.hashOf(sourceDir, "Missing.java")
                .isEmpty());
        assertTrue(ProjectIndexingService.hashOf(sourceDir, "A.java")
                .isPresent());
    }

}
