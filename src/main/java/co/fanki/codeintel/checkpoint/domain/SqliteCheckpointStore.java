package co.fanki.codeintel.checkpoint.domain;

import co.fanki.codeintel.shared.Preconditions;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * SQLite implementation of the {@link CheckpointStore}.
 *
 * <p>Three tables back the store: {@code checkpoints} holds the bodies
 * and metadata, {@code blobs} one immutable value per channel version,
 * and {@code writes} the pending writes of each checkpoint. Every call
 * opens its own handle, so concurrent callers interleave at statement
 * granularity and rely on SQLite's locking.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class SqliteCheckpointStore implements CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(
            SqliteCheckpointStore.class);

    /** Exact checkpoint lookup. Uses: PK. */
    static final String FIND_CHECKPOINT = """
            SELECT * FROM checkpoints
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
              AND checkpoint_id = :checkpointId
            """;

    /** Latest checkpoint of a scope. Uses: idx_checkpoints_latest. */
    static final String FIND_LATEST_CHECKPOINT = """
            SELECT * FROM checkpoints
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
            ORDER BY checkpoint_id DESC
            LIMIT 1
            """;

    static final String FIND_BLOB = """
            SELECT value_type, value_blob FROM blobs
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
              AND channel = :channel AND version = :version
            """;

    static final String FIND_WRITES = """
            SELECT task_id, channel, value_type, value_blob FROM writes
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
              AND checkpoint_id = :checkpointId
            ORDER BY task_id, write_idx
            """;

    /** Checkpoint ids of a scope, newest first. Uses: idx_checkpoints_latest. */
    static final String LIST_IDS = """
            SELECT checkpoint_id FROM checkpoints
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
              AND (:before IS NULL OR checkpoint_id < :before)
            ORDER BY checkpoint_id DESC
            LIMIT :limit
            """;

    static final String UPSERT_BLOB = """
            INSERT OR REPLACE INTO blobs (
                thread_id, checkpoint_ns, channel, version,
                value_type, value_blob
            ) VALUES (
                :threadId, :ns, :channel, :version, :valueType, :valueBlob
            )
            """;

    static final String UPSERT_CHECKPOINT = """
            INSERT OR REPLACE INTO checkpoints (
                thread_id, checkpoint_ns, checkpoint_id, parent_checkpoint_id,
                checkpoint_type, checkpoint_blob, metadata_type, metadata_blob
            ) VALUES (
                :threadId, :ns, :checkpointId, :parentId,
                :checkpointType, :checkpointBlob, :metadataType, :metadataBlob
            )
            """;

    /** Positional writes are kept on retry. */
    static final String INSERT_WRITE = """
            INSERT OR IGNORE INTO writes (
                thread_id, checkpoint_ns, checkpoint_id, task_id, write_idx,
                channel, value_type, value_blob, task_path
            ) VALUES (
                :threadId, :ns, :checkpointId, :taskId, :writeIdx,
                :channel, :valueType, :valueBlob, :taskPath
            )
            """;

    /** Reserved channel writes replace the previous value in place. */
    static final String UPSERT_WRITE = """
            INSERT INTO writes (
                thread_id, checkpoint_ns, checkpoint_id, task_id, write_idx,
                channel, value_type, value_blob, task_path
            ) VALUES (
                :threadId, :ns, :checkpointId, :taskId, :writeIdx,
                :channel, :valueType, :valueBlob, :taskPath
            )
            ON CONFLICT (thread_id, checkpoint_ns, checkpoint_id, task_id,
                write_idx)
            DO UPDATE SET channel = excluded.channel,
                value_type = excluded.value_type,
                value_blob = excluded.value_blob,
                task_path = excluded.task_path
            """;

    static final String DELETE_THREAD_WRITES =
            "DELETE FROM writes WHERE thread_id = :threadId";

    static final String DELETE_THREAD_BLOBS =
            "DELETE FROM blobs WHERE thread_id = :threadId";

    static final String DELETE_THREAD_CHECKPOINTS =
            "DELETE FROM checkpoints WHERE thread_id = :threadId";

    static final String DELETE_NS_WRITES = """
            DELETE FROM writes
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
            """;

    static final String DELETE_NS_BLOBS = """
            DELETE FROM blobs
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
            """;

    static final String DELETE_NS_CHECKPOINTS = """
            DELETE FROM checkpoints
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
            """;

    /** Uses: idx_checkpoints_ns. */
    static final String LIST_THREADS = """
            SELECT DISTINCT thread_id FROM checkpoints
            WHERE checkpoint_ns = :ns
            ORDER BY thread_id
            """;

    static final String DELETE_CHECKPOINTS_BY_ID = """
            DELETE FROM checkpoints
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
              AND checkpoint_id IN (<checkpointIds>)
            """;

    static final String DELETE_WRITES_BY_CHECKPOINT = """
            DELETE FROM writes
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
              AND checkpoint_id IN (<checkpointIds>)
            """;

    static final String FIND_CHECKPOINT_BODIES = """
            SELECT checkpoint_type, checkpoint_blob FROM checkpoints
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
            """;

    static final String FIND_BLOB_KEYS = """
            SELECT channel, version FROM blobs
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
            """;

    static final String DELETE_BLOB = """
            DELETE FROM blobs
            WHERE thread_id = :threadId AND checkpoint_ns = :ns
              AND channel = :channel AND version = :version
            """;

    private final Jdbi jdbi;
    private final CheckpointSerializer serializer;

    /**
     * Creates a new SqliteCheckpointStore.
     *
     * @param theJdbi the JDBI instance of the checkpoint database
     * @param theSerializer the value serializer
     */
    public SqliteCheckpointStore(
            @Qualifier("checkpointJdbi") final Jdbi theJdbi,
            final CheckpointSerializer theSerializer) {
        this.jdbi = Preconditions.requireNonNull(theJdbi, "Jdbi is required");
        this.serializer = Preconditions.requireNonNull(theSerializer,
                "Serializer is required");
    }

    @Override
    public Optional<CheckpointTuple> getTuple(final CheckpointConfig config) {
        if (config == null || config.hasNoThread()) {
            return Optional.empty();
        }

        return jdbi.withHandle(handle -> {
            final Optional<CheckpointRow> row = config.optionalCheckpointId()
                    .map(id -> handle.createQuery(FIND_CHECKPOINT)
                            .bind("threadId", config.threadId())
                            .bind("ns", config.checkpointNs())
                            .bind("checkpointId", id)
                            .map(new CheckpointRowMapper())
                            .findOne())
                    .orElseGet(() -> handle.createQuery(FIND_LATEST_CHECKPOINT)
                            .bind("threadId", config.threadId())
                            .bind("ns", config.checkpointNs())
                            .map(new CheckpointRowMapper())
                            .findOne());

            return row.map(r -> toTuple(handle, r));
        });
    }

    private CheckpointTuple toTuple(final Handle handle, final CheckpointRow row) {
        final Checkpoint body = serializer.loadsCheckpoint(row.checkpoint());

        final Map<String, Object> values = new LinkedHashMap<>();
        for (final Map.Entry<String, String> version
                : body.channelVersions().entrySet()) {
            handle.createQuery(FIND_BLOB)
                    .bind("threadId", row.threadId())
                    .bind("ns", row.checkpointNs())
                    .bind("channel", version.getKey())
                    .bind("version", version.getValue())
                    .map(new TypedValueMapper())
                    .findOne()
                    .filter(value -> !value.isEmpty())
                    .ifPresent(value -> values.put(version.getKey(),
                            serializer.loads(value)));
        }

        final List<PendingWrite> writes = handle.createQuery(FIND_WRITES)
                .bind("threadId", row.threadId())
                .bind("ns", row.checkpointNs())
                .bind("checkpointId", row.checkpointId())
                .map((rs, ctx) -> new PendingWrite(
                        rs.getString("task_id"),
                        rs.getString("channel"),
                        serializer.loads(new TypedValue(
                                rs.getString("value_type"),
                                rs.getBytes("value_blob")))))
                .list();

        final CheckpointConfig config = new CheckpointConfig(row.threadId(),
                row.checkpointNs(), row.checkpointId());
        final String parentId = row.parentCheckpointId();
        final CheckpointConfig parent = parentId == null || parentId.isBlank()
                ? null
                : config.withCheckpointId(parentId);

        return new CheckpointTuple(config,
                new Checkpoint(body.id(), body.ts(), values,
                        body.channelVersions(), body.versionsSeen()),
                serializer.loadsMetadata(row.metadata()), parent, writes);
    }

    @Override
    public Stream<CheckpointTuple> list(final CheckpointConfig config,
            final String before, final Integer limit) {
        if (config == null || config.hasNoThread()) {
            return Stream.empty();
        }
        if (limit != null) {
            Preconditions.requireNonNegative(limit, "Limit must not be negative");
        }

        // SQLite reads LIMIT -1 as "no limit".
        final List<String> ids = jdbi.withHandle(handle ->
                handle.createQuery(LIST_IDS)
                        .bind("threadId", config.threadId())
                        .bind("ns", config.checkpointNs())
                        .bind("before", before)
                        .bind("limit", limit == null ? -1 : limit)
                        .mapTo(String.class)
                        .list());

        return ids.stream()
                .map(id -> getTuple(config.withCheckpointId(id)))
                .flatMap(Optional::stream);
    }

    @Override
    public CheckpointConfig put(final CheckpointConfig config,
            final Checkpoint checkpoint, final Map<String, Object> metadata,
            final Map<String, String> newVersions) {

        requireThread(config);
        Preconditions.requireNonNull(checkpoint, "Checkpoint is required");

        final Map<String, String> versions = newVersions == null
                ? Map.of() : newVersions;
        final TypedValue body = serializer.dumpsCheckpoint(checkpoint);
        final TypedValue meta = serializer.dumpsMetadata(metadata);

        jdbi.useTransaction(handle -> {
            if (!versions.isEmpty()) {
                final PreparedBatch batch = handle.prepareBatch(UPSERT_BLOB);
                for (final Map.Entry<String, String> entry : versions.entrySet()) {
                    final String channel = entry.getKey();
                    final TypedValue value =
                            checkpoint.channelValues().containsKey(channel)
                                    ? serializer.dumps(
                                            checkpoint.channelValues().get(channel))
                                    : TypedValue.empty();
                    batch.bind("threadId", config.threadId())
                            .bind("ns", config.checkpointNs())
                            .bind("channel", channel)
                            .bind("version", entry.getValue())
                            .bind("valueType", value.type())
                            .bind("valueBlob", value.payload())
                            .add();
                }
                batch.execute();
            }

            handle.createUpdate(UPSERT_CHECKPOINT)
                    .bind("threadId", config.threadId())
                    .bind("ns", config.checkpointNs())
                    .bind("checkpointId", checkpoint.id())
                    .bind("parentId", config.checkpointId())
                    .bind("checkpointType", body.type())
                    .bind("checkpointBlob", body.payload())
                    .bind("metadataType", meta.type())
                    .bind("metadataBlob", meta.payload())
                    .execute();
        });

        LOG.debug("Stored checkpoint {} for thread {} (ns='{}', {} new blobs)",
                checkpoint.id(), config.threadId(), config.checkpointNs(),
                versions.size());

        return config.withCheckpointId(checkpoint.id());
    }

    @Override
    public void putWrites(final CheckpointConfig config,
            final List<ChannelWrite> writes, final String taskId,
            final String taskPath) {

        requireThread(config);
        Preconditions.requireNonBlank(config.checkpointId(),
                "Checkpoint id is required to store pending writes");
        Preconditions.requireNonBlank(taskId, "Task id is required");

        if (writes == null || writes.isEmpty()) {
            return;
        }

        jdbi.useTransaction(handle -> {
            for (int position = 0; position < writes.size(); position++) {
                final ChannelWrite write = writes.get(position);
                final TypedValue value = serializer.dumps(write.value());
                handle.createUpdate(write.isReserved()
                                ? UPSERT_WRITE : INSERT_WRITE)
                        .bind("threadId", config.threadId())
                        .bind("ns", config.checkpointNs())
                        .bind("checkpointId", config.checkpointId())
                        .bind("taskId", taskId)
                        .bind("writeIdx", write.writeIndex(position))
                        .bind("channel", write.channel())
                        .bind("valueType", value.type())
                        .bind("valueBlob", value.payload())
                        .bind("taskPath", taskPath == null ? "" : taskPath)
                        .execute();
            }
        });
    }

    @Override
    public void deleteThread(final String threadId) {
        Preconditions.requireNonBlank(threadId, "Thread id is required");

        jdbi.useTransaction(handle -> {
            handle.createUpdate(DELETE_THREAD_WRITES)
                    .bind("threadId", threadId).execute();
            handle.createUpdate(DELETE_THREAD_BLOBS)
                    .bind("threadId", threadId).execute();
            handle.createUpdate(DELETE_THREAD_CHECKPOINTS)
                    .bind("threadId", threadId).execute();
        });

        LOG.info("Deleted checkpoints of thread {}", threadId);
    }

    @Override
    public void deleteThreadNamespace(final String threadId,
            final String checkpointNs) {
        Preconditions.requireNonBlank(threadId, "Thread id is required");
        final String ns = checkpointNs == null ? "" : checkpointNs;

        jdbi.useTransaction(handle -> {
            for (final String sql : List.of(DELETE_NS_WRITES, DELETE_NS_BLOBS,
                    DELETE_NS_CHECKPOINTS)) {
                handle.createUpdate(sql)
                        .bind("threadId", threadId)
                        .bind("ns", ns)
                        .execute();
            }
        });

        LOG.info("Deleted checkpoints of thread {} in namespace '{}'",
                threadId, ns);
    }

    @Override
    public List<String> listThreadsNamespace(final String checkpointNs) {
        return jdbi.withHandle(handle ->
                handle.createQuery(LIST_THREADS)
                        .bind("ns", checkpointNs == null ? "" : checkpointNs)
                        .mapTo(String.class)
                        .list());
    }

    @Override
    public int prune(final String threadId, final String checkpointNs,
            final int keepLatest) {
        Preconditions.requireNonBlank(threadId, "Thread id is required");
        Preconditions.require(keepLatest >= 1, "At least one checkpoint"
                + " must be kept");
        final String ns = checkpointNs == null ? "" : checkpointNs;

        final int deleted = jdbi.inTransaction(handle -> {
            final List<String> ids = handle.createQuery(LIST_IDS)
                    .bind("threadId", threadId)
                    .bind("ns", ns)
                    .bind("before", (String) null)
                    .bind("limit", -1)
                    .mapTo(String.class)
                    .list();

            if (ids.size() <= keepLatest) {
                return 0;
            }
            final List<String> stale = ids.subList(keepLatest, ids.size());

            handle.createUpdate(DELETE_WRITES_BY_CHECKPOINT)
                    .bind("threadId", threadId)
                    .bind("ns", ns)
                    .bindList("checkpointIds", stale)
                    .execute();
            handle.createUpdate(DELETE_CHECKPOINTS_BY_ID)
                    .bind("threadId", threadId)
                    .bind("ns", ns)
                    .bindList("checkpointIds", stale)
                    .execute();

            deleteUnreferencedBlobs(handle, threadId, ns);
            return stale.size();
        });

        if (deleted > 0) {
            LOG.info("Pruned {} checkpoints of thread {} (ns='{}', kept {})",
                    deleted, threadId, ns, keepLatest);
        }
        return deleted;
    }

    private void deleteUnreferencedBlobs(final Handle handle,
            final String threadId, final String ns) {

        final Set<Map.Entry<String, String>> referenced = new HashSet<>();
        handle.createQuery(FIND_CHECKPOINT_BODIES)
                .bind("threadId", threadId)
                .bind("ns", ns)
                .map(new TypedValueMapper("checkpoint_type", "checkpoint_blob"))
                .forEach(body -> referenced.addAll(serializer
                        .loadsCheckpoint(body).channelVersions().entrySet()));

        final List<Map.Entry<String, String>> unreferenced = new ArrayList<>();
        handle.createQuery(FIND_BLOB_KEYS)
                .bind("threadId", threadId)
                .bind("ns", ns)
                .map((rs, ctx) -> Map.entry(rs.getString("channel"),
                        rs.getString("version")))
                .forEach(key -> {
                    if (!referenced.contains(key)) {
                        unreferenced.add(key);
                    }
                });

        if (unreferenced.isEmpty()) {
            return;
        }
        final PreparedBatch batch = handle.prepareBatch(DELETE_BLOB);
        for (final Map.Entry<String, String> key : unreferenced) {
            batch.bind("threadId", threadId)
                    .bind("ns", ns)
                    .bind("channel", key.getKey())
                    .bind("version", key.getValue())
                    .add();
        }
        batch.execute();
    }

    private static void requireThread(final CheckpointConfig config) {
        Preconditions.requireNonNull(config, "Config is required");
        Preconditions.require(!config.hasNoThread(),
                "Thread id is required to store checkpoints");
    }

    /** One row of the checkpoints table. */
    private record CheckpointRow(String threadId, String checkpointNs,
            String checkpointId, String parentCheckpointId,
            TypedValue checkpoint, TypedValue metadata) {
    }

    /** Maps a checkpoints row. */
    private static class CheckpointRowMapper implements RowMapper<CheckpointRow> {

        @Override
        public CheckpointRow map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return new CheckpointRow(
                    rs.getString("thread_id"),
                    rs.getString("checkpoint_ns"),
                    rs.getString("checkpoint_id"),
                    rs.getString("parent_checkpoint_id"),
                    new TypedValue(rs.getString("checkpoint_type"),
                            rs.getBytes("checkpoint_blob")),
                    new TypedValue(rs.getString("metadata_type"),
                            rs.getBytes("metadata_blob")));
        }
    }

    /** Maps a (type, blob) column pair. */
    private static class TypedValueMapper implements RowMapper<TypedValue> {

        private final String typeColumn;
        private final String blobColumn;

        TypedValueMapper() {
            this("value_type", "value_blob");
        }

        TypedValueMapper(final String theTypeColumn,
                final String theBlobColumn) {
            this.typeColumn = theTypeColumn;
            this.blobColumn = theBlobColumn;
        }

        @Override
        public TypedValue map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return new TypedValue(rs.getString(typeColumn),
                    rs.getBytes(blobColumn));
        }
    }

}
