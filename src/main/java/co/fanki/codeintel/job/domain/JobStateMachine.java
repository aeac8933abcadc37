package co.fanki.codeintel.job.domain;

import co.fanki.codeintel.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes the valid job status transitions.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   RUNNING → COMPLETED, FAILED, STOPPED
 * </pre>
 *
 * <p>Terminal statuses have no outgoing transition, so a job is finished
 * exactly once.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JobStateMachine {

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(JobStatus.class);
        TRANSITIONS.put(JobStatus.RUNNING, EnumSet.of(JobStatus.COMPLETED,
                JobStatus.FAILED, JobStatus.STOPPED));
    }

    private JobStateMachine() {
    }

    /**
     * Validates a status transition.
     *
     * @param from the current status
     * @param to the target status
     * @return {@code to} when the transition is valid
     * @throws DomainException with code {@code JOB_INVALID_TRANSITION} when
     *                         the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static JobStatus transition(final JobStatus from,
            final JobStatus to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        final Set<JobStatus> allowed = TRANSITIONS.getOrDefault(from,
                EnumSet.noneOf(JobStatus.class));
        if (!allowed.contains(to)) {
            throw new DomainException("Invalid job transition: " + from
                    + " -> " + to, DomainException.JOB_INVALID_TRANSITION);
        }
        return to;
    }

}
