package co.fanki.codeintel.checkpoint.application;

import co.fanki.codeintel.checkpoint.domain.Checkpoint;
import co.fanki.codeintel.checkpoint.domain.CheckpointConfig;
import co.fanki.codeintel.checkpoint.domain.CheckpointStore;
import co.fanki.codeintel.checkpoint.domain.CheckpointTuple;
import co.fanki.codeintel.config.CodeIntelProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ConversationSessionService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ConversationSessionServiceTest {

    private CheckpointStore store;

    @BeforeEach
    void setUp() {
        store = createMock(CheckpointStore.class);
    }

    private ConversationSessionService service(final int keepLatest) {
        return new ConversationSessionService(store, new CodeIntelProperties(
                null, null, new CodeIntelProperties.Checkpoints(keepLatest)));
    }

    @Test
    void whenListingSessions_givenProject_shouldUseProjectNamespace() {
        expect(store.listThreadsNamespace("demo"))
                .andReturn(List.of("s1", "s2"));
        replay(store);

        assertEquals(List.of("s1", "s2"), service(0).listSessions("demo"));
        verify(store);
    }

    @Test
    void whenListingSessions_givenNoProject_shouldUseEmptyNamespace() {
        expect(store.listThreadsNamespace("")).andReturn(List.of());
        replay(store);

        assertTrue(service(0).listSessions(null).isEmpty());
        verify(store);
    }

    @Test
    void whenDeletingProjectSessions_givenTwoSessions_shouldDeleteEach() {
        expect(store.listThreadsNamespace("demo"))
                .andReturn(List.of("s1", "s2"));
        store.deleteThreadNamespace("s1", "demo");
        expectLastCall();
        store.deleteThreadNamespace("s2", "demo");
        expectLastCall();
        replay(store);

        assertEquals(2, service(0).deleteProjectSessions("demo"));
        verify(store);
    }

    @Test
    void whenDeletingSession_givenBlankId_shouldThrowException() {
        replay(store);

        assertThrows(IllegalArgumentException.class,
                () -> service(0).deleteSession("demo", " "));
    }

    @Test
    void whenCompacting_givenRetentionDisabled_shouldNotTouchStore() {
        replay(store);

        assertEquals(0, service(0).compact("demo", "s1"));
        verify(store);
    }

    @Test
    void whenCompacting_givenRetention_shouldPruneSession() {
        expect(store.prune("s1", "demo", 5)).andReturn(3);
        replay(store);

        assertEquals(3, service(5).compact("demo", "s1"));
        verify(store);
    }

    @Test
    void whenReadingHistory_givenMessagesChannel_shouldReturnMessages() {
        final CheckpointConfig config = new CheckpointConfig("s1", "demo", "01");
        final Checkpoint checkpoint = Checkpoint.create(
                Map.of(ConversationSessionService.MESSAGES_CHANNEL,
                        List.of("hi", "hello")),
                Map.of(ConversationSessionService.MESSAGES_CHANNEL, "1"));
        expect(store.getTuple(CheckpointConfig.latest("s1", "demo")))
                .andReturn(Optional.of(new CheckpointTuple(config, checkpoint,
                        Map.of(), null, List.of())));
        replay(store);

        assertEquals(List.of("hi", "hello"), service(0).history("demo", "s1"));
        verify(store);
    }

    @Test
    void whenReadingHistory_givenUnknownSession_shouldReturnEmpty() {
        expect(store.getTuple(CheckpointConfig.latest("nope", "demo")))
                .andReturn(Optional.empty());
        replay(store);

        assertTrue(service(0).history("demo", "nope").isEmpty());
    }

    @Test
    void whenCreatingSessionIds_givenTwoCalls_shouldDiffer() {
        final ConversationSessionService service = service(0);

        assertNotEquals(service.newSessionId(), service.newSessionId());
    }

}
