package io.fullerstack.perf.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.perf.core.model.FpsHistory;
import io.fullerstack.perf.core.model.PerfSnapshot;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * JSON rendering of snapshots and history for devtools consumers.
 * <p>
 * Field names are the record component names ({@code uiFps}, {@code jsHeapUsedBytes},
 * {@code uiFpsSamples}, ...). Instances are thread-safe.
 */
public class SnapshotJsonCodec {

    private final ObjectMapper objectMapper;

    public SnapshotJsonCodec() {
        this(new ObjectMapper());
    }

    public SnapshotJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public String toJson(PerfSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        return write(snapshot);
    }

    public String toJson(FpsHistory history) {
        Objects.requireNonNull(history, "history cannot be null");
        return write(history);
    }

    /**
     * @throws UncheckedIOException if {@code json} is not a snapshot document
     */
    public PerfSnapshot readSnapshot(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return objectMapper.readValue(json, PerfSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse snapshot JSON", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
