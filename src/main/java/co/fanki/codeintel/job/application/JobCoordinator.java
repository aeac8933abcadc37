package co.fanki.codeintel.job.application;

import co.fanki.codeintel.config.CodeIntelProperties;
import co.fanki.codeintel.job.domain.CancellationToken;
import co.fanki.codeintel.job.domain.DocumentationGenerator;
import co.fanki.codeintel.job.domain.GenerationSummary;
import co.fanki.codeintel.job.domain.JavadocWriter;
import co.fanki.codeintel.job.domain.Job;
import co.fanki.codeintel.job.domain.JobAuditLog;
import co.fanki.codeintel.job.domain.JobLog;
import co.fanki.codeintel.job.domain.JobOptions;
import co.fanki.codeintel.shared.DomainException;
import co.fanki.codeintel.shared.Preconditions;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Runs documentation jobs in the background, one worker per job.
 *
 * <p>Owns the registry of jobs. Two running jobs never share files: a job
 * is rejected when its root equals, contains, or is contained by the
 * root of a job still running. Workers are cancelled cooperatively
 * through their {@link CancellationToken}.</p>
 *
 * <p>Finished jobs are kept for polling up to a configured number; the
 * oldest are evicted when a new job starts.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class JobCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(
            JobCoordinator.class);

    private final Object lock = new Object();

    /** Guarded by {@link #lock}; insertion order is start order. */
    private final Map<String, Job> jobs = new LinkedHashMap<>();

    /** Guarded by {@link #lock}. */
    private final Map<String, CancellationToken> tokens = new HashMap<>();

    private final DocumentationGenerator generator;
    private final Optional<JavadocWriter> defaultWriter;
    private final Path logDir;
    private final int maxFinished;
    private final int defaultMinMeaningfulLines;
    private final ExecutorService executor;

    /**
     * Creates a new JobCoordinator.
     *
     * @param theGenerator the work each job runs
     * @param theDefaultWriter the configured writer, if any
     * @param properties the application properties
     */
    @Autowired
    public JobCoordinator(final DocumentationGenerator theGenerator,
            final Optional<JavadocWriter> theDefaultWriter,
            final CodeIntelProperties properties) {
        this(theGenerator, theDefaultWriter, properties.jobs().logDir(),
                properties.jobs().maxFinished(),
                properties.jobs().minMeaningfulLines());
    }

    /**
     * Creates a new JobCoordinator.
     *
     * @param theGenerator the work each job runs
     * @param theDefaultWriter the configured writer, if any
     * @param theLogDir the audit log directory
     * @param theMaxFinished the number of finished jobs kept
     * @param theDefaultMinMeaningfulLines the body size threshold used when
     *                                     the caller gives no options
     */
    public JobCoordinator(final DocumentationGenerator theGenerator,
            final Optional<JavadocWriter> theDefaultWriter,
            final Path theLogDir, final int theMaxFinished,
            final int theDefaultMinMeaningfulLines) {
        this.generator = Preconditions.requireNonNull(theGenerator,
                "Generator is required");
        this.defaultWriter = theDefaultWriter == null
                ? Optional.empty() : theDefaultWriter;
        this.logDir = Preconditions.requireNonNull(theLogDir,
                "Log directory is required");
        this.maxFinished = Preconditions.requireNonNegative(theMaxFinished,
                "Max finished jobs must not be negative");
        this.defaultMinMeaningfulLines = Preconditions.requireNonNegative(
                theDefaultMinMeaningfulLines,
                "Minimum meaningful lines must not be negative");
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    /**
     * Starts a job over a directory with the configured options.
     *
     * @param rootDir the directory to document
     * @return the running job
     * @see #start(Path, JobOptions)
     */
    public Job start(final Path rootDir) {
        return start(rootDir, JobOptions.of(defaultMinMeaningfulLines));
    }

    /**
     * Starts a job over a directory.
     *
     * <p>Fails the job right away when the worker pool no longer accepts
     * work, so its root is not held.</p>
     *
     * @param rootDir the directory to document
     * @param options the job options
     * @return the running job
     * @throws DomainException with code {@code JOB_INVALID_ROOT} when the
     *                         root is not a directory, or
     *                         {@code JOB_ROOT_OVERLAP} when it overlaps the
     *                         root of a running job, or
     *                         {@code JOB_LOG_UNAVAILABLE} when the audit
     *                         log cannot be created
     */
    public Job start(final Path rootDir, final JobOptions options) {
        Preconditions.requireNonNull(rootDir, "Root directory is required");
        Preconditions.requireNonNull(options, "Options are required");

        final Path root = normalize(rootDir);
        final Optional<JavadocWriter> writer = options.writerOverride()
                .or(() -> defaultWriter);

        final Job job;
        final CancellationToken token = new CancellationToken();

        synchronized (lock) {
            for (final Job existing : jobs.values()) {
                if (existing.isRunning() && overlaps(root, existing.rootDir())) {
                    throw new DomainException("A documentation job is already"
                            + " running for '" + existing.rootDir()
                            + "' (requested: '" + root + "')",
                            DomainException.JOB_ROOT_OVERLAP);
                }
            }

            final String jobId = Job.newId();
            final JobAuditLog auditLog = createAuditLog(jobId, root);

            job = Job.start(jobId, root, auditLog.path());
            evictFinished();
            jobs.put(jobId, job);
            tokens.put(jobId, token);

            try {
                executor.execute(() -> runJob(job, auditLog, options, writer,
                        token));
            } catch (final RejectedExecutionException e) {
                LOG.warn("Job {} rejected, the coordinator is shut down",
                        jobId);
                tokens.remove(jobId);
                job.fail("Job coordinator is shut down");
                return job;
            }
        }

        LOG.info("Started documentation job {} for {}", job.jobId(), root);
        return job;
    }

    /**
     * Lists the known jobs.
     *
     * @return the jobs, newest first
     */
    public List<Job> list() {
        synchronized (lock) {
            final List<Job> result = new ArrayList<>(jobs.values());
            Collections.reverse(result);
            return result;
        }
    }

    /**
     * Finds a job.
     *
     * @param jobId the job id
     * @return the job, if known
     */
    public Optional<Job> find(final String jobId) {
        synchronized (lock) {
            return Optional.ofNullable(jobs.get(jobId));
        }
    }

    /**
     * Requests a running job to stop.
     *
     * <p>Returns immediately; the job becomes {@code STOPPED} once its
     * worker observes the request. Stopping a finished job does
     * nothing.</p>
     *
     * @param jobId the job id
     * @return the job
     * @throws DomainException with code {@code JOB_NOT_FOUND} for an
     *                         unknown id
     */
    public Job stop(final String jobId) {
        synchronized (lock) {
            final Job job = jobs.get(jobId);
            if (job == null) {
                throw new DomainException("Unknown job: " + jobId,
                        DomainException.JOB_NOT_FOUND);
            }
            if (job.isRunning()) {
                job.requestStop();
                final CancellationToken token = tokens.get(jobId);
                if (token != null) {
                    token.cancel();
                }
                LOG.info("Stop requested for job {}", jobId);
            }
            return job;
        }
    }

    /**
     * Reads the audit log of a job.
     *
     * <p>Falls back to a file of the log directory named after the job id,
     * so logs of jobs evicted from memory, or run by an earlier process,
     * stay readable.</p>
     *
     * @param jobId the job id
     * @return the log
     * @throws DomainException with code {@code JOB_NOT_FOUND} when no log
     *                         exists for the id
     */
    public JobLog readLog(final String jobId) {
        Preconditions.requireNonBlank(jobId, "Job id is required");

        final Optional<Path> file = find(jobId)
                .flatMap(Job::logFile)
                .filter(Files::isRegularFile)
                .or(() -> findLogFile(jobId));

        final Path path = file.orElseThrow(() -> new DomainException(
                "No log for job: " + jobId, DomainException.JOB_NOT_FOUND));
        return load(path);
    }

    /**
     * Reads one audit log by file name.
     *
     * @param fileName the plain file name, no path separators
     * @return the log
     * @throws DomainException with code {@code JOB_NOT_FOUND} when the
     *                         name is unsafe or the file does not exist
     */
    public JobLog readLogFile(final String fileName) {
        if (!JobAuditLog.isSafeFileName(fileName)) {
            throw new DomainException("Invalid log file name: " + fileName,
                    DomainException.JOB_NOT_FOUND);
        }
        final Path path = logDir.resolve(fileName);
        if (!Files.isRegularFile(path)) {
            throw new DomainException("No such log file: " + fileName,
                    DomainException.JOB_NOT_FOUND);
        }
        return load(path);
    }

    /**
     * Lists the audit log files of the log directory.
     *
     * @return the file names, newest first
     */
    public List<String> listLogs() {
        if (!Files.isDirectory(logDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(logDir)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.startsWith(JobAuditLog.FILE_PREFIX)
                            && name.endsWith(JobAuditLog.FILE_SUFFIX))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot list " + logDir, e);
        }
    }

    /** Cancels every running job and stops the worker pool. */
    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            tokens.values().forEach(CancellationToken::cancel);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Documentation workers did not stop in time");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runJob(final Job job, final JobAuditLog auditLog,
            final JobOptions options, final Optional<JavadocWriter> writer,
            final CancellationToken token) {
        try {
            final JavadocWriter jobWriter = writer.orElseThrow(() ->
                    new DomainException("No JavaDoc writer is configured"));
            final GenerationSummary summary = generator.generate(
                    job.rootDir(), auditLog, options, jobWriter, token);
            job.finish(summary, token.isCancellationRequested());
            LOG.info("Documentation job {} finished as {}: {} members in {}"
                    + " files", job.jobId(), job.status(),
                    summary.membersDocumented(), summary.filesModified());
        } catch (final Exception e) {
            LOG.error("Documentation job {} failed: {}", job.jobId(),
                    e.getMessage(), e);
            job.fail(e.getMessage() == null
                    ? e.getClass().getName() : e.getMessage());
        } finally {
            synchronized (lock) {
                tokens.remove(job.jobId());
            }
        }
    }

    private JobAuditLog createAuditLog(final String jobId, final Path root) {
        try {
            final JobAuditLog auditLog = JobAuditLog.create(logDir, jobId);
            auditLog.writeHeader(root, jobId);
            return auditLog;
        } catch (final UncheckedIOException e) {
            throw new DomainException("Cannot create the audit log in "
                    + logDir, DomainException.JOB_LOG_UNAVAILABLE, e);
        }
    }

    /** Drops the oldest finished jobs beyond the retention limit. */
    private void evictFinished() {
        final List<Job> finished = jobs.values().stream()
                .filter(job -> !job.isRunning())
                .toList();
        final int excess = finished.size() - maxFinished;
        for (int i = 0; i < excess; i++) {
            jobs.remove(finished.get(i).jobId());
            LOG.debug("Evicted finished job {}", finished.get(i).jobId());
        }
    }

    private Optional<Path> findLogFile(final String jobId) {
        if (!JobAuditLog.isSafeFileName(jobId) || !Files.isDirectory(logDir)) {
            return Optional.empty();
        }
        final String suffix = "_" + jobId + JobAuditLog.FILE_SUFFIX;
        try (Stream<Path> files = Files.list(logDir)) {
            return files
                    .filter(path -> path.getFileName().toString()
                            .endsWith(suffix))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.reverseOrder())
                    .findFirst();
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot list " + logDir, e);
        }
    }

    private static JobLog load(final Path path) {
        try {
            return new JobLog(path.getFileName().toString(),
                    Files.readString(path, StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    /**
     * Resolves a root to its real path.
     *
     * @throws DomainException with code {@code JOB_INVALID_ROOT} when the
     *                         path is not an existing directory
     */
    static Path normalize(final Path rootDir) {
        final Path expanded = expandHome(rootDir);
        if (!Files.isDirectory(expanded)) {
            throw new DomainException("Not a directory: " + rootDir,
                    DomainException.JOB_INVALID_ROOT);
        }
        try {
            return expanded.toRealPath();
        } catch (final IOException e) {
            throw new DomainException("Cannot resolve directory: " + rootDir,
                    DomainException.JOB_INVALID_ROOT, e);
        }
    }

    private static Path expandHome(final Path path) {
        final String text = path.toString();
        if (text.equals("~") || text.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"))
                    .resolve(text.substring(1).replaceFirst("^/", ""));
        }
        return path;
    }

    /**
     * Whether two normalized roots share files: equal, ancestor or
     * descendant, compared by path components.
     */
    static boolean overlaps(final Path a, final Path b) {
        return a.startsWith(b) || b.startsWith(a);
    }

    /** Names worker threads after the coordinator. */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(final Runnable runnable) {
            final Thread thread = new Thread(runnable,
                    "docgen-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

}
