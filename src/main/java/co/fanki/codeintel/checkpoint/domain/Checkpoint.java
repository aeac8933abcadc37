package co.fanki.codeintel.checkpoint.domain;

import co.fanki.codeintel.shared.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One snapshot of a conversation's channel state.
 *
 * <p>Channel values live in their own versioned blobs; the persisted
 * checkpoint body only carries the version pointers. Checkpoint ids are
 * fixed-width hexadecimal strings derived from a strictly increasing
 * microsecond clock, so comparing two ids as strings compares their
 * creation order.</p>
 *
 * @param id the checkpoint id
 * @param ts the creation timestamp
 * @param channelValues the in-memory channel values
 * @param channelVersions the current version of each channel
 * @param versionsSeen the versions each node has observed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Checkpoint(String id, Instant ts,
        Map<String, Object> channelValues,
        Map<String, String> channelVersions,
        Map<String, Map<String, String>> versionsSeen) {

    private static final AtomicLong LAST_MICROS = new AtomicLong();

    /** Validates and freezes the maps. Channel values may hold nulls. */
    public Checkpoint {
        Preconditions.requireNonBlank(id, "Checkpoint id is required");
        Preconditions.requireNonNull(ts, "Checkpoint timestamp is required");
        channelValues = channelValues == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(channelValues));
        channelVersions = channelVersions == null
                ? Map.of() : Map.copyOf(channelVersions);
        versionsSeen = versionsSeen == null
                ? Map.of() : Map.copyOf(versionsSeen);
    }

    /**
     * Creates a checkpoint with a fresh id and the current time.
     *
     * @param channelValues the channel values
     * @param channelVersions the channel versions
     * @return the new checkpoint
     */
    public static Checkpoint create(final Map<String, Object> channelValues,
            final Map<String, String> channelVersions) {
        return new Checkpoint(newId(), Instant.now(), channelValues,
                channelVersions, Map.of());
    }

    /**
     * Generates a new time-ordered checkpoint id.
     *
     * @return a 16 character lowercase hexadecimal id
     */
    public static String newId() {
        final Instant now = Instant.now();
        final long micros = now.getEpochSecond() * 1_000_000L
                + now.getNano() / 1_000L;
        final long next = LAST_MICROS.updateAndGet(
                last -> Math.max(last + 1, micros));
        return String.format("%016x", next);
    }

}
