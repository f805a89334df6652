package io.fullerstack.perf.core.monitor;

import io.fullerstack.perf.core.util.FrameTimes;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Externally reported counters merged into every snapshot.
 * <p>
 * Each counter is an independent atomic cell; there is no lock and no
 * consistency between counters. Cumulative counters only grow between resets.
 * Heap values hold the last observation. Double-valued cells store raw
 * {@code double} bits in an {@link AtomicLong}.
 */
class AuxiliaryCounters {

    private final AtomicLong longTaskCount = new AtomicLong();
    private final AtomicLong longTaskTotalMs = new AtomicLong();
    private final AtomicLong slowEventCount = new AtomicLong();
    private final AtomicLong maxEventDurationBits = new AtomicLong(Double.doubleToRawLongBits(0.0));
    private final AtomicLong renderCount = new AtomicLong();
    private final AtomicLong lastRenderDurationBits = new AtomicLong(Double.doubleToRawLongBits(0.0));
    private final AtomicLong jsHeapUsedBytes = new AtomicLong();
    private final AtomicLong jsHeapTotalBytes = new AtomicLong();

    /**
     * Counts a long task and adds its whole milliseconds to the running total.
     *
     * @return false if the duration was rejected (negative or not finite)
     */
    boolean recordLongTask(double durationMs) {
        if (!FrameTimes.isValidDuration(durationMs)) {
            return false;
        }
        longTaskCount.incrementAndGet();
        longTaskTotalMs.addAndGet((long) durationMs);
        return true;
    }

    /**
     * Counts a slow event and raises the maximum duration if this one is longer.
     *
     * @return false if the duration was rejected (negative or not finite)
     */
    boolean recordSlowEvent(double durationMs) {
        if (!FrameTimes.isValidDuration(durationMs)) {
            return false;
        }
        slowEventCount.incrementAndGet();
        long currentBits = maxEventDurationBits.get();
        while (durationMs > Double.longBitsToDouble(currentBits)) {
            if (maxEventDurationBits.compareAndSet(currentBits, Double.doubleToRawLongBits(durationMs))) {
                break;
            }
            currentBits = maxEventDurationBits.get();
        }
        return true;
    }

    /**
     * @return false if the duration was rejected (negative or not finite)
     */
    boolean recordRender(double durationMs) {
        if (!FrameTimes.isValidDuration(durationMs)) {
            return false;
        }
        renderCount.incrementAndGet();
        lastRenderDurationBits.set(Double.doubleToRawLongBits(durationMs));
        return true;
    }

    /**
     * Overwrites the last known heap values.
     *
     * @return false if either value was negative
     */
    boolean recordHeap(long usedBytes, long totalBytes) {
        if (usedBytes < 0 || totalBytes < 0) {
            return false;
        }
        jsHeapUsedBytes.set(usedBytes);
        jsHeapTotalBytes.set(totalBytes);
        return true;
    }

    long longTaskCount() {
        return longTaskCount.get();
    }

    long longTaskTotalMs() {
        return longTaskTotalMs.get();
    }

    long slowEventCount() {
        return slowEventCount.get();
    }

    double maxEventDurationMs() {
        return Double.longBitsToDouble(maxEventDurationBits.get());
    }

    long renderCount() {
        return renderCount.get();
    }

    double lastRenderDurationMs() {
        return Double.longBitsToDouble(lastRenderDurationBits.get());
    }

    long jsHeapUsedBytes() {
        return jsHeapUsedBytes.get();
    }

    long jsHeapTotalBytes() {
        return jsHeapTotalBytes.get();
    }

    void reset() {
        jsHeapUsedBytes.set(0);
        jsHeapTotalBytes.set(0);
        longTaskCount.set(0);
        longTaskTotalMs.set(0);
        slowEventCount.set(0);
        maxEventDurationBits.set(Double.doubleToRawLongBits(0.0));
        renderCount.set(0);
        lastRenderDurationBits.set(Double.doubleToRawLongBits(0.0));
    }
}
