package co.fanki.codeintel.checkpoint.domain;

import co.fanki.codeintel.shared.Preconditions;

import java.util.Map;

/**
 * One write passed to {@link CheckpointStore#putWrites}.
 *
 * <p>Some channel names are reserved for control signals. Writes to them
 * are stored at a fixed negative index, so repeating one replaces the
 * previous value in place, and they never collide with the positional
 * indices of ordinary writes.</p>
 *
 * @param channel the channel name
 * @param value the value, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ChannelWrite(String channel, Object value) {

    /** Channel carrying a task error. */
    public static final String ERROR = "__error__";

    /** Channel carrying scheduled task ids. */
    public static final String SCHEDULED = "__scheduled__";

    /** Channel carrying an interrupt request. */
    public static final String INTERRUPT = "__interrupt__";

    /** Channel carrying a resume value. */
    public static final String RESUME = "__resume__";

    private static final Map<String, Integer> RESERVED_INDEX = Map.of(
            ERROR, -1,
            SCHEDULED, -2,
            INTERRUPT, -3,
            RESUME, -4);

    /** Validates the channel name. */
    public ChannelWrite {
        Preconditions.requireNonBlank(channel, "Channel is required");
    }

    /** Whether this write targets a reserved channel. */
    public boolean isReserved() {
        return RESERVED_INDEX.containsKey(channel);
    }

    /**
     * Resolves the storage index of this write.
     *
     * @param position the position of the write within its call
     * @return the fixed index for reserved channels, else the position
     */
    public int writeIndex(final int position) {
        return RESERVED_INDEX.getOrDefault(channel, position);
    }

}
