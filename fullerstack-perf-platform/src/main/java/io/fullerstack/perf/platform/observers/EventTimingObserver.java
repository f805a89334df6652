package io.fullerstack.perf.platform.observers;

import io.fullerstack.perf.core.config.HierarchicalConfig;
import io.fullerstack.perf.core.monitor.PerfMonitor;

import java.util.Objects;

/**
 * Filters raw timing entries from instrumentation hooks before they reach the monitor.
 * <ul>
 *   <li>{@link #onEvent(double)}: input-event durations above the slow threshold (default 100 ms)
 *       become slow events</li>
 *   <li>{@link #onTask(double)}: task durations above the long-task threshold (default 50 ms)
 *       become long tasks</li>
 *   <li>{@link #onRender(double)}: every render commit is counted</li>
 * </ul>
 * Stateless apart from the thresholds; safe to call from any thread.
 */
public class EventTimingObserver {

    public static final double DEFAULT_SLOW_EVENT_THRESHOLD_MS = 100.0;
    public static final double DEFAULT_LONG_TASK_THRESHOLD_MS = 50.0;

    public static final String SLOW_EVENT_THRESHOLD_KEY = "perf.events.slow-threshold-ms";
    public static final String LONG_TASK_THRESHOLD_KEY = "perf.events.long-task-threshold-ms";

    private final PerfMonitor monitor;
    private final double slowEventThresholdMs;
    private final double longTaskThresholdMs;

    public EventTimingObserver(PerfMonitor monitor) {
        this(monitor, DEFAULT_SLOW_EVENT_THRESHOLD_MS, DEFAULT_LONG_TASK_THRESHOLD_MS);
    }

    public EventTimingObserver(PerfMonitor monitor, double slowEventThresholdMs, double longTaskThresholdMs) {
        this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
        if (!(slowEventThresholdMs >= 0) || !(longTaskThresholdMs >= 0)) {
            throw new IllegalArgumentException(
                "thresholds must be non-negative, got slow=" + slowEventThresholdMs
                    + " longTask=" + longTaskThresholdMs);
        }
        this.slowEventThresholdMs = slowEventThresholdMs;
        this.longTaskThresholdMs = longTaskThresholdMs;
    }

    public static EventTimingObserver fromConfig(PerfMonitor monitor, HierarchicalConfig config) {
        return new EventTimingObserver(
            monitor,
            config.getDouble(SLOW_EVENT_THRESHOLD_KEY, DEFAULT_SLOW_EVENT_THRESHOLD_MS),
            config.getDouble(LONG_TASK_THRESHOLD_KEY, DEFAULT_LONG_TASK_THRESHOLD_MS)
        );
    }

    /**
     * @return true if the event was reported as slow
     */
    public boolean onEvent(double durationMs) {
        if (durationMs > slowEventThresholdMs) {
            monitor.reportSlowEvent(durationMs);
            return true;
        }
        return false;
    }

    /**
     * @return true if the task was reported as long
     */
    public boolean onTask(double durationMs) {
        if (durationMs > longTaskThresholdMs) {
            monitor.reportLongTask(durationMs);
            return true;
        }
        return false;
    }

    public void onRender(double actualDurationMs) {
        monitor.reportRender(actualDurationMs);
    }

    public double slowEventThresholdMs() {
        return slowEventThresholdMs;
    }

    public double longTaskThresholdMs() {
        return longTaskThresholdMs;
    }
}
