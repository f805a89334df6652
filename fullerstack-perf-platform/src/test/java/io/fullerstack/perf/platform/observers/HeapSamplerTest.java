package io.fullerstack.perf.platform.observers;

import io.fullerstack.perf.core.config.HierarchicalConfig;
import io.fullerstack.perf.core.monitor.PerfMonitor;
import io.fullerstack.perf.core.spi.PlatformMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class HeapSamplerTest {

    private PerfMonitor monitor;
    private HeapSampler sampler;

    @BeforeEach
    void setUp() {
        monitor = new PerfMonitor(PlatformMetrics.idle());
    }

    @AfterEach
    void tearDown() {
        if (sampler != null) {
            sampler.close();
        }
        monitor.close();
    }

    @Test
    void sampleReportsUsedAndCommittedHeap() {
        MemoryMXBean bean = mock(MemoryMXBean.class);
        when(bean.getHeapMemoryUsage()).thenReturn(new MemoryUsage(0, 3_000, 8_000, 16_000));
        sampler = new HeapSampler(monitor, bean, 1_000);

        assertThat(sampler.sample()).isTrue();

        assertThat(monitor.getMetrics().jsHeapUsedBytes()).isEqualTo(3_000);
        assertThat(monitor.getMetrics().jsHeapTotalBytes()).isEqualTo(8_000);
    }

    @Test
    void emptyReadingKeepsLastValue() {
        MemoryMXBean bean = mock(MemoryMXBean.class);
        when(bean.getHeapMemoryUsage())
            .thenReturn(new MemoryUsage(0, 3_000, 8_000, 16_000))
            .thenReturn(new MemoryUsage(0, 0, 0, -1));
        sampler = new HeapSampler(monitor, bean, 1_000);

        sampler.sample();
        assertThat(sampler.sample()).isFalse();

        assertThat(monitor.getMetrics().jsHeapUsedBytes()).isEqualTo(3_000);
    }

    @Test
    void startSamplesImmediately() throws Exception {
        sampler = new HeapSampler(monitor, ManagementFactory.getMemoryMXBean(), 60_000);

        sampler.start();

        long deadline = System.currentTimeMillis() + 5_000;
        while (monitor.getMetrics().jsHeapTotalBytes() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(monitor.getMetrics().jsHeapTotalBytes()).isPositive();
        assertThat(sampler.isStarted()).isTrue();
    }

    @Test
    void closeIsIdempotent() {
        sampler = new HeapSampler(monitor);
        sampler.start();
        sampler.start();

        sampler.close();
        sampler.close();

        assertThat(sampler.isStarted()).isFalse();
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new HeapSampler(monitor, mock(MemoryMXBean.class), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void samplingFailureDoesNotStopSchedule() throws Exception {
        MemoryMXBean bean = mock(MemoryMXBean.class);
        when(bean.getHeapMemoryUsage())
            .thenThrow(new IllegalStateException("bean unavailable"))
            .thenReturn(new MemoryUsage(0, 1_000, 2_000, -1));
        sampler = new HeapSampler(monitor, bean, 10);

        sampler.start();

        long deadline = System.currentTimeMillis() + 5_000;
        while (monitor.getMetrics().jsHeapTotalBytes() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(monitor.getMetrics().jsHeapTotalBytes()).isEqualTo(2_000);
    }

    @Test
    void fromConfigUsesProfileInterval() {
        sampler = HeapSampler.fromConfig(monitor, HierarchicalConfig.forProfile("headless"));

        assertThat(sampler).isNotNull();
        assertThat(sampler.isStarted()).isFalse();
    }
}
