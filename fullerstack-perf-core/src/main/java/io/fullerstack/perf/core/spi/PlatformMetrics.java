package io.fullerstack.perf.core.spi;

import java.util.Objects;
import java.util.function.DoubleConsumer;

/**
 * Platform capabilities the monitor consumes: two frame-tick sources and a
 * resident memory reader.
 * <p>
 * One variant is selected per deployment target when the monitor is built
 * (see {@link #of(FrameTickSource, FrameTickSource, MemoryReader)}); the
 * monitor never inspects which one it got.
 */
public interface PlatformMetrics {

    /** Starts rendering frame ticks, in seconds. */
    void startUiFpsTracking(DoubleConsumer onTick);

    void stopUiFpsTracking();

    /**
     * Starts scripting frame ticks, in seconds. Platforms without a native
     * scripting frame signal leave this idle and rely on ticks pushed through
     * {@code PerfMonitor.reportJsFrameTick}.
     */
    void startJsFpsTracking(DoubleConsumer onTick);

    void stopJsFpsTracking();

    /**
     * @return process resident memory in bytes, 0 if unavailable
     */
    long residentMemoryBytes();

    /**
     * Composes platform capabilities from independent collaborators.
     *
     * @param ui     rendering frame source
     * @param js     scripting frame source
     * @param memory resident memory reader
     * @return composed platform metrics
     */
    static PlatformMetrics of(FrameTickSource ui, FrameTickSource js, MemoryReader memory) {
        Objects.requireNonNull(ui, "ui cannot be null");
        Objects.requireNonNull(js, "js cannot be null");
        Objects.requireNonNull(memory, "memory cannot be null");
        return new PlatformMetrics() {
            @Override
            public void startUiFpsTracking(DoubleConsumer onTick) {
                ui.startTracking(onTick);
            }

            @Override
            public void stopUiFpsTracking() {
                ui.stopTracking();
            }

            @Override
            public void startJsFpsTracking(DoubleConsumer onTick) {
                js.startTracking(onTick);
            }

            @Override
            public void stopJsFpsTracking() {
                js.stopTracking();
            }

            @Override
            public long residentMemoryBytes() {
                return memory.residentBytes();
            }

            @Override
            public String toString() {
                return "PlatformMetrics[ui=" + ui + ", js=" + js + ", memory=" + memory + "]";
            }
        };
    }

    /**
     * @return platform metrics with no frame sources and no memory reading
     */
    static PlatformMetrics idle() {
        return of(FrameTickSource.idle(), FrameTickSource.idle(), MemoryReader.unavailable());
    }
}
