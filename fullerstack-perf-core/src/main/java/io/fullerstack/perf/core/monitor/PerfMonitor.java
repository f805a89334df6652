package io.fullerstack.perf.core.monitor;

import io.fullerstack.perf.core.config.HierarchicalConfig;
import io.fullerstack.perf.core.config.PerfConfig;
import io.fullerstack.perf.core.model.FpsHistory;
import io.fullerstack.perf.core.model.FrameSource;
import io.fullerstack.perf.core.model.PerfSnapshot;
import io.fullerstack.perf.core.spi.PlatformMetrics;
import io.fullerstack.perf.core.tracker.TrackerStats;
import io.fullerstack.perf.core.tracker.WindowedRateTracker;
import io.fullerstack.perf.core.util.FrameTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Aggregates rendering and scripting frame rates with reported runtime counters
 * and pushes periodic {@link PerfSnapshot}s to subscribers.
 * <p>
 * Responsibilities:
 * - Own one {@link WindowedRateTracker} per frame source
 * - Register with the platform frame sources on {@link #start()}, forwarding each tick
 * - Run a background notifier that builds a snapshot every update interval
 * - Accept counters pushed from the scripting side (long tasks, slow events, renders, heap)
 * - Apply configuration changes without stopping
 * <p>
 * Usage:
 * <pre>
 * PerfMonitor monitor = new PerfMonitor(platformMetrics);
 * long id = monitor.subscribe(snapshot -> dashboard.update(snapshot));
 * monitor.start();
 *
 * // scripting side
 * monitor.reportJsFrameTick(frameTimeMs);
 * monitor.reportLongTask(72.0);
 *
 * // ... later ...
 * monitor.unsubscribe(id);
 * monitor.close();
 * </pre>
 * <p>
 * <b>Threading:</b> tick delivery, reporters and getters never wait on the
 * notifier. {@link #stop()} blocks until the notifier thread has exited, so it
 * must not be called from a subscriber callback.
 */
public class PerfMonitor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PerfMonitor.class);

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5_000;

    static final String NOTIFIER_THREAD_NAME = "perf-snapshot-notifier";
    private static final String SHUTDOWN_TIMEOUT_KEY = "perf.notifier.shutdown-timeout-ms";

    private final PlatformMetrics platform;
    private final SubscriberRegistry<PerfSnapshot> subscribers = new SubscriberRegistry<>();
    private final AuxiliaryCounters counters = new AuxiliaryCounters();
    private final SnapshotNotifier notifier;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final Object configLock = new Object();
    private final AtomicLong updateIntervalMs;

    // Replaced as a pair under configLock; readers take one volatile read
    private volatile Trackers trackers;
    private volatile int targetFps;

    /**
     * Creates a monitor with {@link PerfConfig#defaults()}.
     *
     * @param platform platform frame sources and memory reader
     */
    public PerfMonitor(PlatformMetrics platform) {
        this(platform, PerfConfig.defaults());
    }

    public PerfMonitor(PlatformMetrics platform, PerfConfig config) {
        this(platform, config, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    /**
     * Creates a monitor. Trackers start at the default capacity and target rate;
     * {@code config} is then applied with the same field-by-field rules as
     * {@link #configure(PerfConfig)}.
     *
     * @param platform          platform frame sources and memory reader
     * @param config            initial configuration
     * @param shutdownTimeoutMs how long each wait in {@link #stop()} lasts before logging and waiting again
     */
    public PerfMonitor(PlatformMetrics platform, PerfConfig config, long shutdownTimeoutMs) {
        this.platform = Objects.requireNonNull(platform, "platform cannot be null");
        Objects.requireNonNull(config, "config cannot be null");

        this.targetFps = WindowedRateTracker.DEFAULT_TARGET_FPS;
        this.trackers = Trackers.create(WindowedRateTracker.DEFAULT_CAPACITY, targetFps);
        this.updateIntervalMs = new AtomicLong(PerfConfig.DEFAULT_UPDATE_INTERVAL_MS);
        this.notifier = new SnapshotNotifier(
            NOTIFIER_THREAD_NAME,
            updateIntervalMs::get,
            this::notifySubscribers,
            shutdownTimeoutMs
        );
        applyConfig(config);
    }

    /**
     * Creates a monitor from properties (see {@link PerfConfig#fromConfig(HierarchicalConfig)}).
     */
    public static PerfMonitor fromConfig(PlatformMetrics platform, HierarchicalConfig config) {
        return new PerfMonitor(
            platform,
            PerfConfig.fromConfig(config),
            config.getLong(SHUTDOWN_TIMEOUT_KEY, DEFAULT_SHUTDOWN_TIMEOUT_MS)
        );
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Registers with both platform frame sources and starts the notifier.
     * No effect if already running.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running.getAndSet(true)) {
                return;
            }

            logger.info("Starting perf monitor (interval={}ms, capacity={}, targetFps={})",
                updateIntervalMs.get(), trackers.ui().capacity(), targetFps);

            try {
                platform.startUiFpsTracking(timestamp -> trackers.ui().onTick(timestamp));
            } catch (RuntimeException e) {
                logger.warn("UI frame source failed to start; UI FPS will stay idle", e);
            }
            try {
                platform.startJsFpsTracking(timestamp -> trackers.js().onTick(timestamp));
            } catch (RuntimeException e) {
                logger.warn("JS frame source failed to start; JS FPS relies on reported ticks", e);
            }

            notifier.start();
        }
    }

    /**
     * Unregisters from the frame sources, stops the notifier and waits for it
     * to exit. No notification is delivered after this returns. No effect if
     * not running.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.getAndSet(false)) {
                return;
            }

            logger.info("Stopping perf monitor");

            try {
                platform.stopUiFpsTracking();
            } catch (RuntimeException e) {
                logger.warn("UI frame source failed to stop cleanly", e);
            }
            try {
                platform.stopJsFpsTracking();
            } catch (RuntimeException e) {
                logger.warn("JS frame source failed to stop cleanly", e);
            }

            notifier.stop();
            logger.info("Perf monitor stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Same as {@link #stop()}.
     */
    @Override
    public void close() {
        stop();
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * Builds a snapshot from the trackers' current rates, the memory reader and
     * the reported counters. Does not wait for the notifier.
     *
     * @return current snapshot
     */
    public PerfSnapshot getMetrics() {
        Trackers current = trackers;
        return new PerfSnapshot(
            current.ui().getCurrentFps(),
            current.js().getCurrentFps(),
            readResidentMemory(),
            counters.jsHeapUsedBytes(),
            counters.jsHeapTotalBytes(),
            current.ui().getDroppedFrames() + current.js().getDroppedFrames(),
            current.ui().getStutterCount() + current.js().getStutterCount(),
            System.currentTimeMillis(),
            counters.longTaskCount(),
            counters.longTaskTotalMs(),
            counters.slowEventCount(),
            counters.maxEventDurationMs(),
            counters.renderCount(),
            counters.lastRenderDurationMs()
        );
    }

    private long readResidentMemory() {
        try {
            return Math.max(0L, platform.residentMemoryBytes());
        } catch (RuntimeException e) {
            logger.warn("Resident memory read failed; reporting 0", e);
            return 0L;
        }
    }

    /**
     * @return both trackers' retained samples (oldest first) with their min/max
     */
    public FpsHistory getHistory() {
        Trackers current = trackers;
        return new FpsHistory(
            current.ui().getSamples(),
            current.js().getSamples(),
            current.ui().getMinFps(),
            current.ui().getMaxFps(),
            current.js().getMinFps(),
            current.js().getMaxFps()
        );
    }

    /**
     * Per-tracker aggregates; the snapshot only carries the summed drop and stutter counts.
     */
    public TrackerStats getTrackerStats(FrameSource source) {
        Objects.requireNonNull(source, "source cannot be null");
        Trackers current = trackers;
        return switch (source) {
            case UI -> current.ui().stats();
            case JS -> current.js().stats();
        };
    }

    /**
     * @return effective configuration (interval, current tracker capacity, target rate)
     */
    public PerfConfig getConfig() {
        return new PerfConfig(updateIntervalMs.get(), trackers.ui().capacity(), targetFps);
    }

    // =========================================================================
    // Subscribers
    // =========================================================================

    /**
     * @param callback invoked on the notifier thread with each periodic snapshot
     * @return subscriber id, never reused
     */
    public long subscribe(Consumer<? super PerfSnapshot> callback) {
        long id = subscribers.register(callback);
        logger.debug("Subscriber {} registered", id);
        return id;
    }

    /**
     * Removes a subscriber. Unknown ids are ignored. If a notification is in
     * progress this waits for it, after which the callback is never invoked again.
     */
    public void unsubscribe(long id) {
        if (subscribers.remove(id)) {
            logger.debug("Subscriber {} removed", id);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void notifySubscribers() {
        if (subscribers.size() == 0) {
            return;
        }
        PerfSnapshot snapshot = getMetrics();
        int delivered = subscribers.notifyAll(snapshot);
        if (logger.isDebugEnabled()) {
            logger.debug("Delivered snapshot to {} subscribers: uiFps={}, jsFps={}",
                delivered, snapshot.uiFps(), snapshot.jsFps());
        }
    }

    // =========================================================================
    // Reporters
    // =========================================================================

    /**
     * Feeds a scripting frame tick for platforms with no native scripting frame source.
     *
     * @param timestampMs monotonic frame timestamp in milliseconds
     */
    public void reportJsFrameTick(double timestampMs) {
        if (!trackers.js().onTick(FrameTimes.millisToSeconds(timestampMs))) {
            logger.debug("Ignoring JS frame tick with invalid timestamp {}", timestampMs);
        }
    }

    public void reportLongTask(double durationMs) {
        if (!counters.recordLongTask(durationMs)) {
            logger.debug("Ignoring long task with invalid duration {}", durationMs);
        }
    }

    public void reportSlowEvent(double durationMs) {
        if (!counters.recordSlowEvent(durationMs)) {
            logger.debug("Ignoring slow event with invalid duration {}", durationMs);
        }
    }

    public void reportRender(double actualDurationMs) {
        if (!counters.recordRender(actualDurationMs)) {
            logger.debug("Ignoring render with invalid duration {}", actualDurationMs);
        }
    }

    /**
     * Overwrites the last known scripting heap values.
     */
    public void reportJsHeap(long usedBytes, long totalBytes) {
        if (!counters.recordHeap(usedBytes, totalBytes)) {
            logger.debug("Ignoring negative heap report used={} total={}", usedBytes, totalBytes);
        }
    }

    // =========================================================================
    // Configuration
    // =========================================================================

    /**
     * Applies a configuration while running or stopped.
     * <ul>
     *   <li>The update interval always applies, from the next notifier cycle.</li>
     *   <li>A positive capacity replaces both trackers, discarding history and stats.</li>
     *   <li>A positive target rate is applied to both trackers for future windows.</li>
     * </ul>
     * Non-positive capacity or target fields are ignored individually.
     */
    public void configure(PerfConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        applyConfig(config);
        logger.info("Perf monitor configured: {}", getConfig());
    }

    private void applyConfig(PerfConfig config) {
        synchronized (configLock) {
            updateIntervalMs.set(config.updateIntervalMs());

            if (config.maxHistorySamples() > 0) {
                trackers = Trackers.create(config.maxHistorySamples(), targetFps);
            }

            if (config.targetFps() > 0) {
                targetFps = config.targetFps();
                Trackers current = trackers;
                current.ui().setTargetFps(targetFps);
                current.js().setTargetFps(targetFps);
            }
        }
    }

    /**
     * Zeroes both trackers and every reported counter. Keeps running and keeps subscribers.
     */
    public void reset() {
        synchronized (configLock) {
            Trackers current = trackers;
            current.ui().reset();
            current.js().reset();
            counters.reset();
        }
        logger.info("Perf monitor reset");
    }

    private record Trackers(WindowedRateTracker ui, WindowedRateTracker js) {
        static Trackers create(int capacity, int targetFps) {
            return new Trackers(
                new WindowedRateTracker(capacity, targetFps),
                new WindowedRateTracker(capacity, targetFps)
            );
        }
    }
}
