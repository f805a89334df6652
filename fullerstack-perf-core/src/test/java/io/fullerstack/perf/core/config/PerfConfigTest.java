package io.fullerstack.perf.core.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PerfConfigTest {

    @Test
    void defaultsMatchMonitorDefaults() {
        assertThat(PerfConfig.defaults()).isEqualTo(new PerfConfig(500, 60, 60));
    }

    @Test
    void fromConfigReadsProfileValues() {
        PerfConfig config = PerfConfig.fromConfig(HierarchicalConfig.forProfile("lowlat"));

        assertThat(config).isEqualTo(new PerfConfig(100, 120, 60));
    }

    @Test
    void withersReplaceOneField() {
        PerfConfig config = PerfConfig.defaults()
            .withUpdateIntervalMs(250)
            .withTargetFps(120);

        assertThat(config).isEqualTo(new PerfConfig(250, 60, 120));
        assertThat(config.withMaxHistorySamples(0).maxHistorySamples()).isZero();
    }
}
