package co.fanki.codeintel.job.domain;

import co.fanki.codeintel.shared.Preconditions;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A background documentation run over one directory.
 *
 * <p>The coordinator reads the job while its worker updates it, so every
 * accessor and mutator is synchronized.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Job {

    private final String jobId;
    private final Path rootDir;
    private final Instant createdAt;
    private final Path logFile;
    private JobStatus status;
    private Instant startedAt;
    private Instant finishedAt;
    private boolean stopRequested;
    private GenerationSummary summary;
    private String error;

    private Job(final String theJobId, final Path theRootDir,
            final Path theLogFile, final Instant theCreatedAt) {
        this.jobId = Preconditions.requireNonBlank(theJobId, "Job id is required");
        this.rootDir = Preconditions.requireNonNull(theRootDir,
                "Root directory is required");
        this.logFile = theLogFile;
        this.createdAt = theCreatedAt;
        this.status = JobStatus.RUNNING;
    }

    /**
     * Generates a new job id.
     *
     * @return 32 lowercase hexadecimal characters
     */
    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Creates a running job.
     *
     * @param jobId the job id
     * @param rootDir the normalized root directory
     * @param logFile the audit log file
     * @return the new job, already started
     */
    public static Job start(final String jobId, final Path rootDir,
            final Path logFile) {
        final Instant now = Instant.now();
        final Job job = new Job(jobId, rootDir, logFile, now);
        job.startedAt = now;
        return job;
    }

    /** Records a stop request. No effect once the job is terminal. */
    public synchronized void requestStop() {
        if (!status.isTerminal()) {
            stopRequested = true;
        }
    }

    /**
     * Finishes the job after its worker returned.
     *
     * @param theSummary the run summary
     * @param cancelled whether the worker observed a cancellation
     */
    public synchronized void finish(final GenerationSummary theSummary,
            final boolean cancelled) {
        status = JobStateMachine.transition(status,
                stopRequested || cancelled
                        ? JobStatus.STOPPED : JobStatus.COMPLETED);
        summary = theSummary;
        finishedAt = Instant.now();
    }

    /**
     * Finishes the job after its worker failed.
     *
     * @param theError the error message
     */
    public synchronized void fail(final String theError) {
        status = JobStateMachine.transition(status, JobStatus.FAILED);
        error = theError;
        finishedAt = Instant.now();
    }

    public String jobId() {
        return jobId;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Optional<Path> logFile() {
        return Optional.ofNullable(logFile);
    }

    public synchronized JobStatus status() {
        return status;
    }

    public synchronized boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Optional<Instant> finishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public synchronized boolean stopRequested() {
        return stopRequested;
    }

    public synchronized Optional<GenerationSummary> summary() {
        return Optional.ofNullable(summary);
    }

    public synchronized Optional<String> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public synchronized String toString() {
        return "Job{id=" + jobId + ", root=" + rootDir + ", status=" + status
                + "}";
    }

}
