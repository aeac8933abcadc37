package co.fanki.codeintel.job.domain;

import java.nio.file.Path;

/**
 * Outcome of a documentation run over a directory.
 *
 * @param rootDir the processed directory
 * @param filesScanned the source files found
 * @param filesModified the files that received at least one block
 * @param membersDocumented the blocks inserted
 * @param logFile the audit log of the run
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GenerationSummary(Path rootDir, int filesScanned,
        int filesModified, int membersDocumented, Path logFile) {
}
