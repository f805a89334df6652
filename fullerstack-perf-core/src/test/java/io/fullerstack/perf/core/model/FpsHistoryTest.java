package io.fullerstack.perf.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FpsHistoryTest {

    @Test
    void samplesAreDefensivelyCopied() {
        List<Integer> ui = new ArrayList<>(List.of(60, 59));
        FpsHistory history = new FpsHistory(ui, List.of(), 59, 60, 0, 0);

        ui.add(10);

        assertThat(history.uiFpsSamples()).containsExactly(60, 59);
        assertThatThrownBy(() -> history.uiFpsSamples().add(1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsNullSamples() {
        assertThatThrownBy(() -> new FpsHistory(null, List.of(), 0, 0, 0, 0))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("uiFpsSamples");
    }
}
