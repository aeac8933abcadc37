package co.fanki.codeintel.checkpoint.domain;

import java.util.Optional;

/**
 * Addresses a checkpoint scope, and optionally one checkpoint in it.
 *
 * <p>The thread id is the conversation (session) id and the namespace is
 * the project scope. A null namespace is normalized to the empty
 * string, and a blank checkpoint id to null.</p>
 *
 * @param threadId the conversation thread id
 * @param checkpointNs the checkpoint namespace
 * @param checkpointId the checkpoint id, null for "latest"
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CheckpointConfig(String threadId, String checkpointNs,
        String checkpointId) {

    /** Normalizes the namespace and the checkpoint id. */
    public CheckpointConfig {
        checkpointNs = checkpointNs == null ? "" : checkpointNs;
        checkpointId = checkpointId == null || checkpointId.isBlank()
                ? null : checkpointId;
    }

    /**
     * Creates a config addressing the latest checkpoint of a scope.
     *
     * @param threadId the thread id
     * @param checkpointNs the namespace
     * @return the config
     */
    public static CheckpointConfig latest(final String threadId,
            final String checkpointNs) {
        return new CheckpointConfig(threadId, checkpointNs, null);
    }

    /**
     * Returns a copy of this config pointing at another checkpoint.
     *
     * @param theCheckpointId the checkpoint id
     * @return the new config
     */
    public CheckpointConfig withCheckpointId(final String theCheckpointId) {
        return new CheckpointConfig(threadId, checkpointNs, theCheckpointId);
    }

    /** Returns the checkpoint id, if this config addresses one. */
    public Optional<String> optionalCheckpointId() {
        return Optional.ofNullable(checkpointId);
    }

    /** Whether the thread id is missing. */
    public boolean hasNoThread() {
        return threadId == null || threadId.isBlank();
    }

}
