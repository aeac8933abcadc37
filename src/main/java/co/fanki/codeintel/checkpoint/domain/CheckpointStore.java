package co.fanki.codeintel.checkpoint.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable, versioned persistence of conversation state.
 *
 * <p>State is keyed by {@code (threadId, checkpointNs)}. Reads never fail
 * for absence; writes reject configs without a thread id.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface CheckpointStore {

    /**
     * Fetches one checkpoint with its values and pending writes.
     *
     * @param config the scope, with an id for an exact lookup or without
     *               one for the latest checkpoint
     * @return the tuple, empty if nothing matches
     */
    Optional<CheckpointTuple> getTuple(CheckpointConfig config);

    /**
     * Lists the checkpoints of a scope, newest first.
     *
     * <p>The stream can be consumed once. Call this method again to
     * restart from the newest checkpoint; passing the last seen id as
     * {@code before} resumes a paged walk.</p>
     *
     * @param config the scope
     * @param before only ids strictly lower than this one, null for all
     * @param limit the maximum number of results, null for no limit
     * @return a lazy stream of tuples
     */
    Stream<CheckpointTuple> list(CheckpointConfig config, String before,
            Integer limit);

    /**
     * Stores a checkpoint and the channel versions it introduces.
     *
     * @param config the scope; its checkpoint id becomes the parent
     * @param checkpoint the checkpoint to store
     * @param metadata the metadata to store alongside
     * @param newVersions the channels whose values changed, by version
     * @return the config pointing at the stored checkpoint
     */
    CheckpointConfig put(CheckpointConfig config, Checkpoint checkpoint,
            Map<String, Object> metadata, Map<String, String> newVersions);

    /**
     * Appends the pending writes of one task to a checkpoint.
     *
     * @param config the exact checkpoint the writes belong to
     * @param writes the writes, in order
     * @param taskId the task id
     * @param taskPath the task path, may be null
     */
    void putWrites(CheckpointConfig config, List<ChannelWrite> writes,
            String taskId, String taskPath);

    /**
     * Deletes every checkpoint, blob and write of a thread.
     *
     * @param threadId the thread id
     */
    void deleteThread(String threadId);

    /**
     * Deletes every checkpoint, blob and write of a thread in one namespace.
     *
     * @param threadId the thread id
     * @param checkpointNs the namespace
     */
    void deleteThreadNamespace(String threadId, String checkpointNs);

    /**
     * Lists the thread ids that have checkpoints in a namespace.
     *
     * @param checkpointNs the namespace
     * @return sorted distinct thread ids
     */
    List<String> listThreadsNamespace(String checkpointNs);

    /**
     * Keeps only the newest checkpoints of a thread in one namespace.
     *
     * @param threadId the thread id
     * @param checkpointNs the namespace
     * @param keepLatest how many checkpoints to keep, at least one
     * @return the number of checkpoints deleted
     */
    int prune(String threadId, String checkpointNs, int keepLatest);

}
