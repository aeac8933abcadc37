package co.fanki.codeintel.checkpoint.domain;

import co.fanki.codeintel.shared.Preconditions;

import java.util.Arrays;

/**
 * A serialized value with the tag that tells how to read it back.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TypedValue {

    /** JSON encoded value. */
    public static final String JSON = "json";

    /** Raw bytes, stored as is. */
    public static final String BYTES = "bytes";

    /** An explicit null value. */
    public static final String NULL = "null";

    /** Sentinel for a channel version with no value. */
    public static final String EMPTY = "empty";

    private static final byte[] NO_BYTES = new byte[0];

    private final String type;

    private final byte[] payload;

    /**
     * Creates a new TypedValue.
     *
     * @param theType the type tag, never blank
     * @param thePayload the payload, null is stored as no bytes
     */
    public TypedValue(final String theType, final byte[] thePayload) {
        this.type = Preconditions.requireNonBlank(theType, "Type is required");
        this.payload = thePayload == null ? NO_BYTES : thePayload.clone();
    }

    /** Returns the empty sentinel. */
    public static TypedValue empty() {
        return new TypedValue(EMPTY, NO_BYTES);
    }

    /** Returns the type tag. */
    public String type() {
        return type;
    }

    /** Returns a copy of the payload. */
    public byte[] payload() {
        return payload.clone();
    }

    /** Whether this is the empty sentinel. */
    public boolean isEmpty() {
        return EMPTY.equals(type);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypedValue)) {
            return false;
        }
        final TypedValue other = (TypedValue) o;
        return type.equals(other.type) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "TypedValue{type=" + type + ", bytes=" + payload.length + "}";
    }

}
