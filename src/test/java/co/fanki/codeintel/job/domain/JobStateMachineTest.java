package co.fanki.codeintel.job.domain;

import co.fanki.codeintel.shared.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link JobStateMachine}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class JobStateMachineTest {

    @Test
    void whenTransitioning_givenRunningToCompleted_shouldReturnCompleted() {
        assertEquals(JobStatus.COMPLETED, JobStateMachine.transition(
                JobStatus.RUNNING, JobStatus.COMPLETED));
    }

    @Test
    void whenTransitioning_givenRunningToStopped_shouldReturnStopped() {
        assertEquals(JobStatus.STOPPED, JobStateMachine.transition(
                JobStatus.RUNNING, JobStatus.STOPPED));
    }

    @Test
    void whenTransitioning_givenRunningToFailed_shouldReturnFailed() {
        assertEquals(JobStatus.FAILED, JobStateMachine.transition(
                JobStatus.RUNNING, JobStatus.FAILED));
    }

    @Test
    void whenTransitioning_givenTerminalStatus_shouldThrowDomainException() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> JobStateMachine.transition(JobStatus.STOPPED,
                        JobStatus.COMPLETED));

        assertEquals(DomainException.JOB_INVALID_TRANSITION, ex.getErrorCode());
    }

    @Test
    void whenTransitioning_givenNullStatus_shouldThrowNullPointerException() {
        assertThrows(NullPointerException.class,
                () -> JobStateMachine.transition(null, JobStatus.FAILED));
    }

}
