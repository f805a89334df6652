package io.fullerstack.perf.core.tracker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a stream of frame-completion timestamps into a bounded history of
 * frames-per-second samples plus running aggregates.
 * <p>
 * Ticks are counted in windows of at least one second. When a tick arrives at
 * or beyond one second after the window start, the window closes and a sample
 * of {@code round(frameCount / elapsed)} is recorded, where {@code elapsed} is
 * the actual time between the window start and the closing tick. The next
 * window opens at the closing tick with a frame count of zero.
 * <p>
 * The tracker is tick-driven: if ticks stop arriving the open window never
 * closes and no further samples are produced.
 *
 * <p><b>Thread safety:</b> one producer thread may call {@link #onTick(double)}
 * while any number of reader threads query the tracker. All mutable state is
 * guarded by a private lock, except the current rate which is mirrored into a
 * lock-free cell so that {@link #getCurrentFps()} never contends with tick
 * processing.
 *
 * <p>Timestamps for a single tracker must be delivered in non-decreasing order.
 */
public class WindowedRateTracker {

    /** History capacity used when none is configured. */
    public static final int DEFAULT_CAPACITY = 60;

    /** Target rate used for dropped-frame estimation when none is configured. */
    public static final int DEFAULT_TARGET_FPS = 60;

    /** Closed windows that dropped at least this many frames count as a stutter. */
    public static final int STUTTER_DROP_THRESHOLD = 4;

    private static final double WINDOW_SECONDS = 1.0;

    private final Object lock = new Object();
    private final int capacity;
    private final int[] samples;
    private final AtomicInteger currentFps = new AtomicInteger();

    // Guarded by lock
    private int writeIndex;
    private int sampleCount;
    private boolean windowOpen;
    private double windowStart;
    private int frameCount;
    private int minFps = Integer.MAX_VALUE;
    private int maxFps;
    private long droppedFrames;
    private long stutterCount;
    private int targetFps;

    /**
     * Creates a tracker with the given history capacity and the default target rate.
     *
     * @param capacity maximum number of samples retained
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public WindowedRateTracker(int capacity) {
        this(capacity, DEFAULT_TARGET_FPS);
    }

    /**
     * Creates a tracker with the given history capacity and target rate.
     *
     * @param capacity  maximum number of samples retained
     * @param targetFps expected frames per second, used for dropped-frame estimation
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public WindowedRateTracker(int capacity, int targetFps) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.samples = new int[capacity];
        this.targetFps = targetFps;
    }

    /**
     * Records a completed frame. Non-finite timestamps are dropped.
     *
     * @param timestampSeconds monotonic frame timestamp in seconds
     * @return false if the timestamp was dropped
     */
    public boolean onTick(double timestampSeconds) {
        if (!Double.isFinite(timestampSeconds)) {
            return false;
        }
        synchronized (lock) {
            if (!windowOpen) {
                windowStart = timestampSeconds;
                frameCount = 1;
                windowOpen = true;
                return true;
            }

            frameCount++;
            double elapsed = timestampSeconds - windowStart;
            if (elapsed >= WINDOW_SECONDS) {
                recordSample((int) Math.round(frameCount / elapsed));
                windowStart = timestampSeconds;
                frameCount = 0;
            }
            return true;
        }
    }

    // Caller holds lock
    private void recordSample(int fps) {
        samples[writeIndex] = fps;
        writeIndex = (writeIndex + 1) % capacity;
        if (sampleCount < capacity) {
            sampleCount++;
        }

        currentFps.set(fps);

        if (fps < minFps) {
            minFps = fps;
        }
        if (fps > maxFps) {
            maxFps = fps;
        }

        int dropped = Math.max(0, targetFps - fps);
        droppedFrames += dropped;
        if (dropped >= STUTTER_DROP_THRESHOLD) {
            stutterCount++;
        }
    }

    /**
     * @return the most recent sample, or 0 if none has been recorded
     */
    public int getCurrentFps() {
        return currentFps.get();
    }

    /**
     * Returns the retained samples ordered oldest to newest.
     *
     * @return a new mutable list holding at most {@link #capacity()} samples
     */
    public List<Integer> getSamples() {
        synchronized (lock) {
            List<Integer> result = new ArrayList<>(sampleCount);
            int start = sampleCount < capacity ? 0 : writeIndex;
            for (int i = 0; i < sampleCount; i++) {
                result.add(samples[(start + i) % capacity]);
            }
            return result;
        }
    }

    /**
     * @return lowest sample since construction or the last reset, 0 if there is none
     */
    public int getMinFps() {
        synchronized (lock) {
            return sampleCount > 0 ? minFps : 0;
        }
    }

    /**
     * @return highest sample since construction or the last reset, 0 if there is none
     */
    public int getMaxFps() {
        synchronized (lock) {
            return maxFps;
        }
    }

    public long getDroppedFrames() {
        synchronized (lock) {
            return droppedFrames;
        }
    }

    public long getStutterCount() {
        synchronized (lock) {
            return stutterCount;
        }
    }

    public int getSampleCount() {
        synchronized (lock) {
            return sampleCount;
        }
    }

    public int getTargetFps() {
        synchronized (lock) {
            return targetFps;
        }
    }

    /**
     * Changes the target rate. Samples already recorded keep the drop estimate
     * computed when their window closed.
     *
     * @param target expected frames per second
     */
    public void setTargetFps(int target) {
        synchronized (lock) {
            targetFps = target;
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Reads every aggregate under a single lock acquisition.
     *
     * @return consistent view of this tracker's statistics
     */
    public TrackerStats stats() {
        synchronized (lock) {
            return new TrackerStats(
                currentFps.get(),
                sampleCount > 0 ? minFps : 0,
                maxFps,
                droppedFrames,
                stutterCount,
                sampleCount,
                capacity,
                targetFps
            );
        }
    }

    /**
     * Clears history, aggregates and the open window. The target rate is kept.
     */
    public void reset() {
        synchronized (lock) {
            Arrays.fill(samples, 0);
            writeIndex = 0;
            sampleCount = 0;
            windowOpen = false;
            windowStart = 0.0;
            frameCount = 0;
            currentFps.set(0);
            minFps = Integer.MAX_VALUE;
            maxFps = 0;
            droppedFrames = 0;
            stutterCount = 0;
        }
    }
}
