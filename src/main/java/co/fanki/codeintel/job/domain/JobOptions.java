package co.fanki.codeintel.job.domain;

import co.fanki.codeintel.shared.Preconditions;

import java.util.Optional;

/**
 * Per-job settings of a documentation run.
 *
 * @param minMeaningfulLines members with fewer meaningful body lines are
 *                           left undocumented
 * @param writer the writer to use instead of the configured one, may be
 *               null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record JobOptions(int minMeaningfulLines, JavadocWriter writer) {

    /** Validates the line threshold. */
    public JobOptions {
        Preconditions.requireNonNegative(minMeaningfulLines,
                "Minimum meaningful lines must not be negative");
    }

    /**
     * Creates options that use the configured writer.
     *
     * @param minMeaningfulLines the line threshold
     * @return the options
     */
    public static JobOptions of(final int minMeaningfulLines) {
        return new JobOptions(minMeaningfulLines, null);
    }

    /** Returns the writer override, if any. */
    public Optional<JavadocWriter> writerOverride() {
        return Optional.ofNullable(writer);
    }

}
