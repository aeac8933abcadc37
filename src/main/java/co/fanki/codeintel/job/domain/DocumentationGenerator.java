package co.fanki.codeintel.job.domain;

import java.nio.file.Path;

/**
 * The work a documentation job runs over its directory.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DocumentationGenerator {

    /**
     * Documents the undocumented declarations under a directory.
     *
     * <p>Implementations poll {@code token} before every file and every
     * member and return what they did so far once it is cancelled.</p>
     *
     * @param rootDir the directory to process
     * @param auditLog the log receiving one line per change
     * @param options the job options
     * @param writer the writer producing the blocks
     * @param token the cancellation token of the job
     * @return the run summary
     */
    GenerationSummary generate(Path rootDir, JobAuditLog auditLog,
            JobOptions options, JavadocWriter writer, CancellationToken token);

}
