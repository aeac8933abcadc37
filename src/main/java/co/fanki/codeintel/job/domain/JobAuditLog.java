package co.fanki.codeintel.job.domain;

import co.fanki.codeintel.shared.Preconditions;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Append-only, line oriented audit trail of one documentation job.
 *
 * <p>The file starts with {@code #} header lines followed by one
 * tab-separated line per inserted block:</p>
 * <pre>
 * 2025-01-01T10:00:00Z  UPDATED_JAVADOC  file=..  type=..  signature=..  reason=..
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JobAuditLog {

    /** Prefix of every audit log file name. */
    public static final String FILE_PREFIX = "docgen_";

    /** Suffix of every audit log file name. */
    public static final String FILE_SUFFIX = ".log";

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyyMMdd_HHmmss_SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private final Path path;

    private JobAuditLog(final Path thePath) {
        this.path = thePath;
    }

    /**
     * Creates a new, empty audit log file for a job.
     *
     * @param directory the log directory, created if missing
     * @param jobId the job id, used as the file name suffix
     * @return the log
     * @throws UncheckedIOException if the file cannot be created
     */
    public static JobAuditLog create(final Path directory, final String jobId) {
        Preconditions.requireNonNull(directory, "Log directory is required");
        Preconditions.requireNonBlank(jobId, "Job id is required");

        final String fileName = FILE_PREFIX
                + FILE_TIMESTAMP.format(Instant.now()) + "_" + jobId
                + FILE_SUFFIX;
        try {
            Files.createDirectories(directory);
            final Path file = directory.resolve(fileName);
            if (!Files.exists(file)) {
                Files.createFile(file);
            }
            return new JobAuditLog(file);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot create audit log in "
                    + directory, e);
        }
    }

    /**
     * Opens an existing audit log for appending.
     *
     * @param file the log file
     * @return the log
     */
    public static JobAuditLog open(final Path file) {
        return new JobAuditLog(Preconditions.requireNonNull(file,
                "Log file is required"));
    }

    /**
     * Whether a user supplied log file name is a plain file name.
     *
     * @param name the candidate name
     * @return false for blank names, dot entries and anything with a path
     *         separator
     */
    public static boolean isSafeFileName(final String name) {
        if (name == null || name.isBlank()
                || name.equals(".") || name.equals("..")) {
            return false;
        }
        return name.indexOf('/') < 0 && name.indexOf('\\') < 0;
    }

    /**
     * Writes the header lines.
     *
     * @param rootDir the processed directory
     * @param sessionId the job id, may be null
     */
    public void writeHeader(final Path rootDir, final String sessionId) {
        appendLine("# documentation generation log");
        appendLine("# created_utc=" + Instant.now());
        appendLine("# root_dir=" + rootDir);
        if (sessionId != null && !sessionId.isBlank()) {
            appendLine("# session_id=" + sessionId);
        }
    }

    /**
     * Records one inserted block.
     *
     * @param file the modified file
     * @param memberType the documented declaration kind
     * @param signature the documented declaration signature
     * @param reason why the block was added
     */
    public void appendChange(final Path file, final String memberType,
            final String signature, final String reason) {
        appendLine(Instant.now() + "\tUPDATED_JAVADOC"
                + "\tfile=" + file
                + "\ttype=" + memberType
                + "\tsignature=" + signature
                + "\treason=" + reason);
    }

    /**
     * Appends one line, trailing line breaks removed.
     *
     * @param line the line
     * @throws UncheckedIOException if the file cannot be written
     */
    public synchronized void appendLine(final String line) {
        final String text = line.replaceAll("[\\r\\n]+$", "")
                + System.lineSeparator();
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot write audit log " + path, e);
        }
    }

    /** Returns the log file. */
    public Path path() {
        return path;
    }

}
