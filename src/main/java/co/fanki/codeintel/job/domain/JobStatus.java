package co.fanki.codeintel.job.domain;

/**
 * Lifecycle status of a documentation job.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum JobStatus {

    /** The worker is processing the directory. */
    RUNNING,

    /** The worker went through every file. */
    COMPLETED,

    /** The worker stopped on an error. */
    FAILED,

    /** The worker observed a stop request and returned early. */
    STOPPED;

    /**
     * Whether the job can no longer change status.
     *
     * @return true for every status except {@link #RUNNING}
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }

}
