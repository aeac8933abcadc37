package co.fanki.codeintel.checkpoint.application;

import co.fanki.codeintel.checkpoint.domain.CheckpointConfig;
import co.fanki.codeintel.checkpoint.domain.CheckpointStore;
import co.fanki.codeintel.config.CodeIntelProperties;
import co.fanki.codeintel.shared.Preconditions;
import co.fanki.codeintel.shared.ProjectScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Manages the conversation sessions of a project.
 *
 * <p>A session is a checkpoint thread; the project scope is the checkpoint
 * namespace, with the unscoped partition mapped to the empty
 * namespace.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ConversationSessionService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ConversationSessionService.class);

    /** Channel holding the message history of a conversation. */
    public static final String MESSAGES_CHANNEL = "messages";

    private final CheckpointStore checkpointStore;
    private final int keepLatest;

    /**
     * Creates a new ConversationSessionService.
     *
     * @param theCheckpointStore the checkpoint store
     * @param properties the application properties
     */
    public ConversationSessionService(final CheckpointStore theCheckpointStore,
            final CodeIntelProperties properties) {
        this.checkpointStore = Preconditions.requireNonNull(theCheckpointStore,
                "Checkpoint store is required");
        this.keepLatest = properties.checkpoints().keepLatest();
    }

    /**
     * Generates a new session id.
     *
     * @return a random UUID string
     */
    public String newSessionId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Lists the sessions of a project.
     *
     * @param project the project name, null for the unscoped partition
     * @return sorted session ids
     */
    public List<String> listSessions(final String project) {
        return checkpointStore.listThreadsNamespace(namespaceOf(project));
    }

    /**
     * Returns the message history of a session.
     *
     * @param project the project name, null for the unscoped partition
     * @param sessionId the session id
     * @return the messages of the latest checkpoint, empty if none
     */
    public List<Object> history(final String project, final String sessionId) {
        final Object messages = checkpointStore.getTuple(
                CheckpointConfig.latest(sessionId, namespaceOf(project)))
                .map(tuple -> tuple.checkpoint().channelValues()
                        .get(MESSAGES_CHANNEL))
                .orElse(null);
        if (!(messages instanceof List)) {
            return List.of();
        }
        return Collections.unmodifiableList(
                new ArrayList<Object>((List<?>) messages));
    }

    /**
     * Deletes one session of a project.
     *
     * @param project the project name, null for the unscoped partition
     * @param sessionId the session id
     */
    public void deleteSession(final String project, final String sessionId) {
        Preconditions.requireNonBlank(sessionId, "Session id is required");
        checkpointStore.deleteThreadNamespace(sessionId, namespaceOf(project));
    }

    /**
     * Deletes every session of a project.
     *
     * @param project the project name, null for the unscoped partition
     * @return the number of sessions deleted
     */
    public int deleteProjectSessions(final String project) {
        final String ns = namespaceOf(project);
        final List<String> sessions = checkpointStore.listThreadsNamespace(ns);
        sessions.forEach(session ->
                checkpointStore.deleteThreadNamespace(session, ns));
        LOG.info("Deleted {} sessions of project '{}'", sessions.size(), ns);
        return sessions.size();
    }

    /**
     * Drops old checkpoints of a session, keeping the configured number.
     *
     * @param project the project name, null for the unscoped partition
     * @param sessionId the session id
     * @return the number of checkpoints deleted, 0 when retention is off
     */
    public int compact(final String project, final String sessionId) {
        Preconditions.requireNonBlank(sessionId, "Session id is required");
        if (keepLatest <= 0) {
            return 0;
        }
        return checkpointStore.prune(sessionId, namespaceOf(project),
                keepLatest);
    }

    private static String namespaceOf(final String project) {
        return ProjectScope.ofNullable(project).storageKey();
    }

}
