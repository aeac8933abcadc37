package co.fanki.codeintel.checkpoint.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A checkpoint restored from storage, with everything needed to resume.
 *
 * @param config the config addressing this exact checkpoint
 * @param checkpoint the checkpoint with its channel values resolved
 * @param metadata the metadata stored alongside
 * @param parentConfig the parent checkpoint config, null for a root
 * @param pendingWrites the pending writes ordered by task and index
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CheckpointTuple(CheckpointConfig config, Checkpoint checkpoint,
        Map<String, Object> metadata, CheckpointConfig parentConfig,
        List<PendingWrite> pendingWrites) {

    /** Freezes the collections. */
    public CheckpointTuple {
        metadata = metadata == null ? Map.of() : metadata;
        pendingWrites = pendingWrites == null ? List.of() : List.copyOf(pendingWrites);
    }

    /** Returns the parent config, if the checkpoint has a parent. */
    public Optional<CheckpointConfig> parent() {
        return Optional.ofNullable(parentConfig);
    }

}
