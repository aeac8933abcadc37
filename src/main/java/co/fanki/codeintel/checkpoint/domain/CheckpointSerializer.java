package co.fanki.codeintel.checkpoint.domain;

import co.fanki.codeintel.shared.DomainException;
import co.fanki.codeintel.shared.Preconditions;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Converts checkpoint values to tagged byte payloads and back.
 *
 * <p>Byte arrays are kept raw, nulls get their own tag and everything
 * else is written as JSON. The checkpoint body is written without its
 * channel values, which are persisted as separate blobs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class CheckpointSerializer {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE =
            new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    /**
     * Creates a new CheckpointSerializer.
     *
     * @param theObjectMapper the Jackson mapper, never null
     */
    public CheckpointSerializer(final ObjectMapper theObjectMapper) {
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "ObjectMapper is required");
    }

    /**
     * Serializes one value.
     *
     * @param value the value, may be null
     * @return the tagged payload
     * @throws DomainException if the value cannot be written as JSON
     */
    public TypedValue dumps(final Object value) {
        if (value == null) {
            return new TypedValue(TypedValue.NULL, null);
        }
        if (value instanceof byte[]) {
            return new TypedValue(TypedValue.BYTES, (byte[]) value);
        }
        try {
            return new TypedValue(TypedValue.JSON,
                    objectMapper.writeValueAsBytes(value));
        } catch (final JsonProcessingException e) {
            throw new DomainException("Cannot serialize value of type "
                    + value.getClass().getName(),
                    DomainException.CHECKPOINT_SERIALIZATION, e);
        }
    }

    /**
     * Reads one value back.
     *
     * @param value the tagged payload
     * @return the value, null for the null and empty tags
     * @throws DomainException if the payload is unreadable or the tag unknown
     */
    public Object loads(final TypedValue value) {
        switch (value.type()) {
            case TypedValue.NULL:
            case TypedValue.EMPTY:
                return null;
            case TypedValue.BYTES:
                return value.payload();
            case TypedValue.JSON:
                try {
                    return objectMapper.readValue(value.payload(), Object.class);
                } catch (final IOException e) {
                    throw new DomainException("Corrupted JSON payload",
                            DomainException.CHECKPOINT_SERIALIZATION, e);
                }
            default:
                throw new DomainException("Unknown value type: " + value.type(),
                        DomainException.CHECKPOINT_SERIALIZATION);
        }
    }

    /**
     * Serializes a checkpoint body, channel values excluded.
     *
     * @param checkpoint the checkpoint
     * @return the tagged payload
     */
    public TypedValue dumpsCheckpoint(final Checkpoint checkpoint) {
        return dumps(new CheckpointBody(checkpoint.id(),
                checkpoint.ts().toString(), checkpoint.channelVersions(),
                checkpoint.versionsSeen()));
    }

    /**
     * Reads a checkpoint body back, channel values left empty.
     *
     * @param value the tagged payload
     * @return the checkpoint without values
     */
    public Checkpoint loadsCheckpoint(final TypedValue value) {
        try {
            final CheckpointBody body = objectMapper.readValue(
                    value.payload(), CheckpointBody.class);
            return new Checkpoint(body.id(), Instant.parse(body.ts()),
                    Map.of(), body.channelVersions(), body.versionsSeen());
        } catch (final IOException e) {
            throw new DomainException("Corrupted checkpoint body",
                    DomainException.CHECKPOINT_SERIALIZATION, e);
        }
    }

    /**
     * Serializes checkpoint metadata.
     *
     * @param metadata the metadata, null is written as an empty map
     * @return the tagged payload
     */
    public TypedValue dumpsMetadata(final Map<String, Object> metadata) {
        return dumps(metadata == null ? Map.of() : metadata);
    }

    /**
     * Reads checkpoint metadata back.
     *
     * @param value the tagged payload
     * @return the metadata, never null
     */
    public Map<String, Object> loadsMetadata(final TypedValue value) {
        if (!TypedValue.JSON.equals(value.type())) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(value.payload(), METADATA_TYPE);
        } catch (final IOException e) {
            throw new DomainException("Corrupted checkpoint metadata",
                    DomainException.CHECKPOINT_SERIALIZATION, e);
        }
    }

    /** Persisted shape of a checkpoint body. */
    record CheckpointBody(
            @JsonProperty("id") String id,
            @JsonProperty("ts") String ts,
            @JsonProperty("channel_versions") Map<String, String> channelVersions,
            @JsonProperty("versions_seen")
            Map<String, Map<String, String>> versionsSeen) {
    }

}
