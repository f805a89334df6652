package io.fullerstack.perf.platform;

import io.fullerstack.perf.core.config.HierarchicalConfig;
import io.fullerstack.perf.core.spi.PlatformMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleConsumer;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class PlatformMetricsFactoryTest {

    private PlatformMetrics platform;

    @AfterEach
    void tearDown() {
        if (platform != null) {
            platform.stopUiFpsTracking();
            platform.stopJsFpsTracking();
        }
        System.clearProperty(PlatformMetricsFactory.VARIANT_KEY);
    }

    @Test
    void headlessNeverTicksAndReportsNoMemory() {
        platform = PlatformMetricsFactory.create(PlatformVariant.HEADLESS);
        DoubleConsumer listener = mock(DoubleConsumer.class);

        platform.startUiFpsTracking(listener);
        platform.startJsFpsTracking(listener);

        verifyNoInteractions(listener);
        assertThat(platform.residentMemoryBytes()).isZero();
    }

    @Test
    void jvmVariantTicksUiAndReportsMemory() throws Exception {
        platform = PlatformMetricsFactory.create(PlatformVariant.JVM, 120);
        CountDownLatch ticks = new CountDownLatch(5);

        platform.startUiFpsTracking(timestamp -> ticks.countDown());

        assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(platform.residentMemoryBytes()).isPositive();
    }

    @Test
    void jsSourceIsIdleOnEveryVariant() {
        for (PlatformVariant variant : PlatformVariant.values()) {
            PlatformMetrics metrics = PlatformMetricsFactory.create(variant);
            DoubleConsumer listener = mock(DoubleConsumer.class);

            metrics.startJsFpsTracking(listener);
            metrics.stopJsFpsTracking();

            verifyNoInteractions(listener);
        }
    }

    @Test
    void variantComesFromProfile() {
        platform = PlatformMetricsFactory.create(HierarchicalConfig.forProfile("headless"));

        assertThat(platform.toString())
            .contains("ui=FrameTickSource.idle")
            .doesNotContain("ScheduledFrameTickSource");
    }

    @Test
    void systemPropertyOverridesVariant() {
        System.setProperty(PlatformMetricsFactory.VARIANT_KEY, "linux");

        platform = PlatformMetricsFactory.create(HierarchicalConfig.forProfile("headless"));

        assertThat(platform.toString()).contains("ProcStatusMemoryReader");
    }

    @Test
    void globalConfigSelectsJvmVariant() {
        platform = PlatformMetricsFactory.create(HierarchicalConfig.global());

        assertThat(platform.toString()).contains("JvmMemoryReader", "ScheduledFrameTickSource");
    }
}
