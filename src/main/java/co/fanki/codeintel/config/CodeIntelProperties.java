package co.fanki.codeintel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Externalized configuration of the code intelligence core.
 *
 * <p>Bound from the {@code codeintel.*} keys of {@code application.yml}.</p>
 *
 * @param storage database file locations
 * @param jobs background documentation job settings
 * @param checkpoints conversation checkpoint settings
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@ConfigurationProperties(prefix = "codeintel")
public record CodeIntelProperties(
        @DefaultValue Storage storage,
        @DefaultValue Jobs jobs,
        @DefaultValue Checkpoints checkpoints) {

    /**
     * Database file locations.
     *
     * @param graphDb the project graph database file
     * @param checkpointDb the conversation checkpoint database file
     */
    public record Storage(
            @DefaultValue("./data/graph.db") Path graphDb,
            @DefaultValue("./data/checkpoints.db") Path checkpointDb) {
    }

    /**
     * Background documentation job settings.
     *
     * @param logDir directory of the per-job audit logs
     * @param maxFinished terminal jobs kept in memory before eviction
     * @param minMeaningfulLines default body size below which members
     *                           are left undocumented
     */
    public record Jobs(
            @DefaultValue("./postimplementation_logs") Path logDir,
            @DefaultValue("50") int maxFinished,
            @DefaultValue("3") int minMeaningfulLines) {
    }

    /**
     * Conversation checkpoint settings.
     *
     * @param keepLatest checkpoints kept per thread when a session is
     *                   compacted, 0 keeps everything
     */
    public record Checkpoints(@DefaultValue("0") int keepLatest) {
    }

}
