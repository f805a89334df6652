package io.fullerstack.perf.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.perf.core.model.FpsHistory;
import io.fullerstack.perf.core.model.PerfSnapshot;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SnapshotJsonCodecTest {

    private final SnapshotJsonCodec codec = new SnapshotJsonCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    private static PerfSnapshot sampleSnapshot() {
        return new PerfSnapshot(58, 41, 150_000_000L, 20_000_000L, 40_000_000L,
            12, 3, 1_700_000_000_000L, 4, 310, 2, 180.5, 97, 3.25);
    }

    @Test
    void snapshotFieldsUseComponentNames() throws Exception {
        JsonNode json = mapper.readTree(codec.toJson(sampleSnapshot()));

        assertThat(json.get("uiFps").asInt()).isEqualTo(58);
        assertThat(json.get("jsFps").asInt()).isEqualTo(41);
        assertThat(json.get("residentMemoryBytes").asLong()).isEqualTo(150_000_000L);
        assertThat(json.get("jsHeapUsedBytes").asLong()).isEqualTo(20_000_000L);
        assertThat(json.get("droppedFrames").asLong()).isEqualTo(12);
        assertThat(json.get("stutterCount").asLong()).isEqualTo(3);
        assertThat(json.get("timestampMs").asLong()).isEqualTo(1_700_000_000_000L);
        assertThat(json.get("longTaskTotalMs").asLong()).isEqualTo(310);
        assertThat(json.get("maxEventDurationMs").asDouble()).isEqualTo(180.5);
        assertThat(json.get("lastRenderDurationMs").asDouble()).isEqualTo(3.25);
        assertThat(json.size()).isEqualTo(14);
    }

    @Test
    void historySamplesAreOrderedArrays() throws Exception {
        FpsHistory history = new FpsHistory(List.of(60, 55, 58), List.of(30), 55, 60, 30, 30);

        JsonNode json = mapper.readTree(codec.toJson(history));

        assertThat(json.get("uiFpsSamples").toString()).isEqualTo("[60,55,58]");
        assertThat(json.get("jsFpsSamples").toString()).isEqualTo("[30]");
        assertThat(json.get("uiFpsMin").asInt()).isEqualTo(55);
        assertThat(json.get("jsFpsMax").asInt()).isEqualTo(30);
    }

    @Test
    void readsBackSnapshot() {
        PerfSnapshot snapshot = sampleSnapshot();

        assertThat(codec.readSnapshot(codec.toJson(snapshot))).isEqualTo(snapshot);
    }

    @Test
    void malformedJsonIsReported() {
        assertThatThrownBy(() -> codec.readSnapshot("{not json"))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("snapshot");
    }
}
