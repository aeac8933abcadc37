package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.shared.Preconditions;
import co.fanki.codeintel.shared.ProjectScope;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Keyed bookkeeping stored next to the project graph.
 *
 * <p>Holds the per-file indexing status and the single indexing-job row
 * of each project. Both are plain last-write-wins upserts.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class IndexStateRepository {

    /** Find one file status. Uses: PK (project, file_path). */
    public static final String FIND_FILE_STATUS = """
            SELECT * FROM file_status
            WHERE project = :project AND file_path = :filePath
            """;

    public static final String UPSERT_FILE_STATUS = """
            INSERT INTO file_status (
                project, file_path, file_hash, status, updated_at
            ) VALUES (
                :project, :filePath, :fileHash, :status, :updatedAt
            )
            ON CONFLICT (project, file_path) DO UPDATE SET
                file_hash = excluded.file_hash,
                status = excluded.status,
                updated_at = excluded.updated_at
            """;

    /** Find the indexing job of a project. Uses: PK (project). */
    public static final String FIND_INDEXING_JOB =
            "SELECT * FROM indexing_jobs WHERE project = :project";

    public static final String UPSERT_INDEXING_JOB = """
            INSERT INTO indexing_jobs (
                project, status, message, files_total, files_indexed,
                started_at, updated_at
            ) VALUES (
                :project, :status, :message, :filesTotal, :filesIndexed,
                :startedAt, :updatedAt
            )
            ON CONFLICT (project) DO UPDATE SET
                status = excluded.status,
                message = excluded.message,
                files_total = excluded.files_total,
                files_indexed = excluded.files_indexed,
                started_at = excluded.started_at,
                updated_at = excluded.updated_at
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new IndexStateRepository.
     *
     * @param theJdbi the JDBI instance bound to the graph database
     */
    public IndexStateRepository(@Qualifier("graphJdbi") final Jdbi theJdbi) {
        this.jdbi = Preconditions.requireNonNull(theJdbi, "Jdbi is required");
    }

    /**
     * Finds the status of a file.
     *
     * @param scope the project scope
     * @param filePath the file path
     * @return the file status if recorded
     */
    public Optional<FileStatus> findFileStatus(final ProjectScope scope,
            final String filePath) {
        Preconditions.requireNonNull(scope, "Scope is required");
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_FILE_STATUS)
                .bind("project", scope.storageKey())
                .bind("filePath", filePath)
                .map(new FileStatusRowMapper())
                .findOne());
    }

    /**
     * Records the status of a file, replacing any previous row.
     *
     * @param scope the project scope
     * @param filePath the file path
     * @param fileHash the content hash
     * @param status the status
     */
    public void updateFileStatus(final ProjectScope scope,
            final String filePath, final String fileHash, final String status) {
        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonBlank(filePath, "File path is required");
        Preconditions.requireNonBlank(status, "Status is required");

        jdbi.useHandle(handle -> handle.createUpdate(UPSERT_FILE_STATUS)
                .bind("project", scope.storageKey())
                .bind("filePath", filePath)
                .bind("fileHash", fileHash)
                .bind("status", status)
                .bind("updatedAt", Instant.now().toEpochMilli())
                .execute());
    }

    /**
     * Finds the indexing job row of a project.
     *
     * @param scope the project scope
     * @return the indexing job state if recorded
     */
    public Optional<IndexingJobState> findIndexingJob(final ProjectScope scope) {
        Preconditions.requireNonNull(scope, "Scope is required");
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_INDEXING_JOB)
                .bind("project", scope.storageKey())
                .map(new IndexingJobRowMapper())
                .findOne());
    }

    /**
     * Writes the indexing job row of a project, replacing any previous one.
     *
     * @param state the state to store
     */
    public void updateIndexingJob(final IndexingJobState state) {
        Preconditions.requireNonNull(state, "Indexing job state is required");
        Preconditions.requireNonNull(state.scope(), "Scope is required");
        Preconditions.requireNonBlank(state.status(), "Status is required");

        final Instant startedAt = state.startedAt() != null
                ? state.startedAt() : Instant.now();
        final Instant updatedAt = state.updatedAt() != null
                ? state.updatedAt() : Instant.now();

        jdbi.useHandle(handle -> handle.createUpdate(UPSERT_INDEXING_JOB)
                .bind("project", state.scope().storageKey())
                .bind("status", state.status())
                .bind("message", state.message())
                .bind("filesTotal", state.filesTotal())
                .bind("filesIndexed", state.filesIndexed())
                .bind("startedAt", startedAt.toEpochMilli())
                .bind("updatedAt", updatedAt.toEpochMilli())
                .execute());
    }

    private static final class FileStatusRowMapper
            implements RowMapper<FileStatus> {

        @Override
        public FileStatus map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return new FileStatus(
                    ProjectScope.fromStorageKey(rs.getString("project")),
                    rs.getString("file_path"),
                    rs.getString("file_hash"),
                    rs.getString("status"),
                    Instant.ofEpochMilli(rs.getLong("updated_at")));
        }
    }

    private static final class IndexingJobRowMapper
            implements RowMapper<IndexingJobState> {

        @Override
        public IndexingJobState map(final ResultSet rs,
                final StatementContext ctx) throws SQLException {
            return new IndexingJobState(
                    ProjectScope.fromStorageKey(rs.getString("project")),
                    rs.getString("status"),
                    rs.getString("message"),
                    rs.getInt("files_total"),
                    rs.getInt("files_indexed"),
                    Instant.ofEpochMilli(rs.getLong("started_at")),
                    Instant.ofEpochMilli(rs.getLong("updated_at")));
        }
    }

}
