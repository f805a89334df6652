package io.fullerstack.perf.core.benchmark;

import io.fullerstack.perf.core.model.PerfSnapshot;
import io.fullerstack.perf.core.monitor.PerfMonitor;
import io.fullerstack.perf.core.spi.PlatformMetrics;
import io.fullerstack.perf.core.tracker.WindowedRateTracker;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Tick ingestion and read-side cost of the rate tracker and monitor.
 *
 * Ticks advance a synthetic clock by one 60 Hz frame so windows close at the
 * normal cadence.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 2)
@Fork(1)
@State(Scope.Benchmark)
public class WindowedRateTrackerBenchmark {

    private static final double FRAME_SECONDS = 1.0 / 60.0;
    private static final double FRAME_MILLIS = 1000.0 / 60.0;

    private WindowedRateTracker tracker;
    private PerfMonitor monitor;
    private double clockSeconds;
    private double clockMillis;

    @Setup
    public void setup() {
        tracker = new WindowedRateTracker(WindowedRateTracker.DEFAULT_CAPACITY);
        monitor = new PerfMonitor(PlatformMetrics.idle());
        clockSeconds = 0.0;
        clockMillis = 0.0;
        // Fill the ring so eviction is on the measured path
        for (int i = 0; i < 60 * 70; i++) {
            tracker.onTick(clockSeconds += FRAME_SECONDS);
        }
    }

    @TearDown
    public void tearDown() {
        monitor.close();
    }

    // ========== INGESTION ==========

    @Benchmark
    public void benchmark01_tracker_onTick() {
        tracker.onTick(clockSeconds += FRAME_SECONDS);
    }

    @Benchmark
    public void benchmark02_monitor_reportJsFrameTick() {
        monitor.reportJsFrameTick(clockMillis += FRAME_MILLIS);
    }

    @Benchmark
    public void benchmark03_monitor_reportSlowEvent() {
        monitor.reportSlowEvent(120.0);
    }

    // ========== READS ==========

    @Benchmark
    public int benchmark04_tracker_getCurrentFps() {
        return tracker.getCurrentFps();
    }

    @Benchmark
    public List<Integer> benchmark05_tracker_getSamples() {
        return tracker.getSamples();
    }

    @Benchmark
    public PerfSnapshot benchmark06_monitor_getMetrics() {
        return monitor.getMetrics();
    }

    @Benchmark
    @Threads(4)
    public void benchmark07_tracker_contendedTickAndRead(Blackhole bh) {
        double now;
        synchronized (this) {
            now = clockSeconds += FRAME_SECONDS;
        }
        tracker.onTick(now);
        bh.consume(tracker.getMinFps());
    }
}
