package co.fanki.codeintel.graph.domain;

import co.fanki.codeintel.shared.ProjectScope;

import java.time.Instant;

/**
 * Progress of the latest indexing run of a project.
 *
 * <p>There is one row per project; every run overwrites it.</p>
 *
 * @param scope the project partition
 * @param status the run status ({@code running}, {@code completed},
 *               {@code failed})
 * @param message a human-readable detail, may be null
 * @param filesTotal the number of files found by the scan
 * @param filesIndexed the number of files indexed so far
 * @param startedAt when the run started
 * @param updatedAt when the row was last written
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record IndexingJobState(
        ProjectScope scope,
        String status,
        String message,
        int filesTotal,
        int filesIndexed,
        Instant startedAt,
        Instant updatedAt) {

    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

}
