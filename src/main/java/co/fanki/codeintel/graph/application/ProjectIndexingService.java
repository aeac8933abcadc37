package co.fanki.codeintel.graph.application;

import co.fanki.codeintel.graph.domain.CodeBlock;
import co.fanki.codeintel.graph.domain.CodeBlockScanner;
import co.fanki.codeintel.graph.domain.GraphStats;
import co.fanki.codeintel.graph.domain.IndexStateRepository;
import co.fanki.codeintel.graph.domain.IndexingJobState;
import co.fanki.codeintel.graph.domain.ProjectGraphStore;
import co.fanki.codeintel.graph.domain.VectorIndex;
import co.fanki.codeintel.shared.DomainException;
import co.fanki.codeintel.shared.Preconditions;
import co.fanki.codeintel.shared.ProjectScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Application service running a full reindex of a project directory.
 *
 * <p>Flow: scan and parse (external scanner) -> vector indexing (external
 * index, optional) -> graph rebuild -> file status and indexing job
 * bookkeeping -> overview text.</p>
 *
 * <p>A full reindex touches the graph database and the vector index
 * together, so all reindexes of the process are serialized behind one
 * lock, whatever project they target.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProjectIndexingService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectIndexingService.class);

    /** Guards every full reindex in this process. */
    private static final ReentrantLock REINDEX_LOCK = new ReentrantLock();

    static final String FILE_INDEXED = "indexed";

    static final String FILE_MISSING = "missing";

    private final ProjectGraphStore graphStore;
    private final IndexStateRepository indexStateRepository;
    private final Optional<CodeBlockScanner> scanner;
    private final Optional<VectorIndex> vectorIndex;

    /**
     * Creates a new ProjectIndexingService.
     *
     * @param theGraphStore the project graph store
     * @param theIndexStateRepository the file and job bookkeeping
     * @param theScanner the source scanner, if one is deployed
     * @param theVectorIndex the vector index, if one is deployed
     */
    public ProjectIndexingService(
            final ProjectGraphStore theGraphStore,
            final IndexStateRepository theIndexStateRepository,
            final Optional<CodeBlockScanner> theScanner,
            final Optional<VectorIndex> theVectorIndex) {
        this.graphStore = theGraphStore;
        this.indexStateRepository = theIndexStateRepository;
        this.scanner = theScanner;
        this.vectorIndex = theVectorIndex;
    }

    /**
     * Reindexes a directory into a project scope.
     *
     * @param directory the directory to index
     * @param projectName the project name, null for the unscoped partition
     * @param includeFileSummaries whether per-file summaries are indexed
     * @return the project overview text after the rebuild
     * @throws DomainException if no scanner is configured or the
     *                         directory does not exist
     */
    public String indexDirectory(final Path directory,
            final String projectName, final boolean includeFileSummaries) {

        Preconditions.requireNonNull(directory, "Directory is required");

        if (!Files.isDirectory(directory)) {
            throw new DomainException("Not a directory: " + directory,
                    "INDEXING_INVALID_ROOT");
        }

        final CodeBlockScanner codeScanner = scanner.orElseThrow(() ->
                new DomainException("No source scanner is configured",
                        "INDEXING_UNAVAILABLE"));

        final ProjectScope scope = ProjectScope.ofNullable(projectName);

        REINDEX_LOCK.lock();
        try {
            return reindex(codeScanner, directory, scope, includeFileSummaries);
        } finally {
            REINDEX_LOCK.unlock();
        }
    }

    private String reindex(final CodeBlockScanner codeScanner,
            final Path directory, final ProjectScope scope,
            final boolean includeFileSummaries) {

        final Instant startedAt = Instant.now();
        LOG.info("Starting indexing job for {} (project={})", directory, scope);

        indexStateRepository.updateIndexingJob(new IndexingJobState(scope,
                IndexingJobState.RUNNING, "Scanning " + directory, 0, 0,
                startedAt, startedAt));

        try {
            final List<CodeBlock> blocks = codeScanner.scan(directory, true)
                    .stream()
                    .map(block -> scope.isUnscoped()
                            ? block : block.withProject(scope.storageKey()))
                    .toList();

            final Set<String> files = new LinkedHashSet<>();
            blocks.forEach(block -> {
                if (block.filePath() != null && !block.filePath().isBlank()) {
                    files.add(block.filePath());
                }
            });

            if (blocks.isEmpty()) {
                LOG.warn("No code blocks found in {}", directory);
                indexStateRepository.updateIndexingJob(new IndexingJobState(
                        scope, IndexingJobState.COMPLETED,
                        "No code blocks found", 0, 0, startedAt,
                        Instant.now()));
                return "No code blocks found.";
            }

            vectorIndex.ifPresent(index -> {
                LOG.info("Indexing {} blocks into the vector index",
                        blocks.size());
                index.indexCodeBlocks(blocks);
                if (includeFileSummaries) {
                    index.indexFileSummaries(blocks);
                }
                index.persist();
            });

            LOG.info("Rebuilding project graph for {}", scope);
            final GraphStats stats = graphStore.rebuild(scope, blocks);

            int indexed = 0;
            for (final String file : files) {
                final Optional<String> hash = hashOf(directory, file);
                indexStateRepository.updateFileStatus(scope, file,
                        hash.orElse(null),
                        hash.isPresent() ? FILE_INDEXED : FILE_MISSING);
                indexed++;
            }

            indexStateRepository.updateIndexingJob(new IndexingJobState(scope,
                    IndexingJobState.COMPLETED,
                    "Indexed " + stats.methods() + " methods",
                    files.size(), indexed, startedAt, Instant.now()));

            LOG.info("Indexing of {} completed in {} ms", scope,
                    Duration.between(startedAt, Instant.now()).toMillis());

            return graphStore.overviewText(scope, 25);

        } catch (final RuntimeException e) {
            LOG.error("Indexing of {} failed: {}", scope, e.getMessage(), e);
            indexStateRepository.updateIndexingJob(new IndexingJobState(scope,
                    IndexingJobState.FAILED, e.getMessage(), 0, 0, startedAt,
                    Instant.now()));
            throw e;
        }
    }

    /**
     * Computes the SHA-256 of a file's content.
     *
     * @param directory the indexed root, used for relative paths
     * @param file the file path reported by the parser
     * @return the hex digest, empty when the file cannot be read
     */
    static Optional<String> hashOf(final Path directory, final String file) {
        final Path path = directory.resolve(file);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Optional.of(HexFormat.of().formatHex(
                    digest.digest(Files.readAllBytes(path))));
        } catch (final IOException e) {
            LOG.warn("Cannot hash {}: {}", path, e.getMessage());
            return Optional.empty();
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

}
