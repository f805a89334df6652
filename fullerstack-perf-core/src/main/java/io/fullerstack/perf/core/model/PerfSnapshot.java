package io.fullerstack.perf.core.model;

/**
 * Point-in-time view of all tracked metrics, delivered to subscribers and
 * returned by {@code PerfMonitor.getMetrics()}.
 * <p>
 * Each field is read independently; the snapshot as a whole is not atomic
 * with respect to concurrent reporters.
 *
 * @param uiFps                rendering frame rate (last closed window)
 * @param jsFps                scripting frame rate (last closed window)
 * @param residentMemoryBytes  process resident memory in bytes (0 if unavailable)
 * @param jsHeapUsedBytes      last reported scripting heap usage in bytes
 * @param jsHeapTotalBytes     last reported scripting heap size in bytes
 * @param droppedFrames        estimated dropped frames, both trackers summed
 * @param stutterCount         stutter windows, both trackers summed
 * @param timestampMs          wall-clock time the snapshot was built (epoch milliseconds)
 * @param longTaskCount        long tasks reported since reset
 * @param longTaskTotalMs      cumulative long task duration in whole milliseconds
 * @param slowEventCount       slow events reported since reset
 * @param maxEventDurationMs   longest slow event reported since reset
 * @param renderCount          renders reported since reset
 * @param lastRenderDurationMs duration of the most recently reported render
 */
public record PerfSnapshot(
    int uiFps,
    int jsFps,
    long residentMemoryBytes,
    long jsHeapUsedBytes,
    long jsHeapTotalBytes,
    long droppedFrames,
    long stutterCount,
    long timestampMs,
    long longTaskCount,
    long longTaskTotalMs,
    long slowEventCount,
    double maxEventDurationMs,
    long renderCount,
    double lastRenderDurationMs
) {

    /**
     * @return heap utilization (0.0-1.0), or 0.0 if no heap size has been reported
     */
    public double jsHeapUtilization() {
        return jsHeapTotalBytes > 0 ? (double) jsHeapUsedBytes / jsHeapTotalBytes : 0.0;
    }
}
