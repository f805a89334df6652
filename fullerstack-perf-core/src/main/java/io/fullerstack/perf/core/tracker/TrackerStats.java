package io.fullerstack.perf.core.tracker;

/**
 * Point-in-time aggregates of a single {@link WindowedRateTracker}.
 *
 * @param currentFps    most recent sample (0 if none)
 * @param minFps        lowest sample since reset (0 if none)
 * @param maxFps        highest sample since reset (0 if none)
 * @param droppedFrames cumulative estimated dropped frames since reset
 * @param stutterCount  cumulative closed windows that dropped 4 or more frames
 * @param sampleCount   samples currently retained
 * @param capacity      maximum samples retained
 * @param targetFps     target rate used for drop estimation
 */
public record TrackerStats(
    int currentFps,
    int minFps,
    int maxFps,
    long droppedFrames,
    long stutterCount,
    int sampleCount,
    int capacity,
    int targetFps
) {

    /**
     * @return true once at least one window has closed
     */
    public boolean hasSamples() {
        return sampleCount > 0;
    }

    /**
     * @return true when the retained history is at capacity and further samples evict the oldest
     */
    public boolean isSaturated() {
        return sampleCount >= capacity;
    }
}
