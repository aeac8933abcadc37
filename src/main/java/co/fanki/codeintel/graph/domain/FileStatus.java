package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.shared.ProjectScope;

import java.time.Instant;

/**
 * Indexing status of one source file.
 *
 * @param scope the project partition
 * @param filePath the file path
 * @param fileHash the content hash recorded at indexing time
 * @param status the free-form status, e.g. {@code indexed}
 * @param updatedAt when the row was last written
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileStatus(
        ProjectScope scope,
        String filePath,
        String fileHash,
        String status,
        Instant updatedAt) {
}
