package io.fullerstack.perf.core.runtime;

import io.fullerstack.perf.core.monitor.PerfMonitor;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder for the one {@link PerfMonitor} an application shares
 * between its instrumentation points.
 * <p>
 * The holder is explicit: nothing is created lazily. The host installs a
 * monitor during startup and calls {@link #shutdown()} during teardown.
 *
 * <pre>
 * PerfRuntime.install(new PerfMonitor(PlatformMetricsFactory.create(config)));
 * PerfRuntime.monitor().start();
 * ...
 * PerfRuntime.shutdown();
 * </pre>
 */
@UtilityClass
public class PerfRuntime {

    private static final Logger logger = LoggerFactory.getLogger(PerfRuntime.class);

    private static final AtomicReference<PerfMonitor> INSTALLED = new AtomicReference<>();

    /**
     * @param monitor monitor to share
     * @return the installed monitor
     * @throws IllegalStateException if a monitor is already installed
     */
    public static PerfMonitor install(PerfMonitor monitor) {
        Objects.requireNonNull(monitor, "monitor cannot be null");
        if (!INSTALLED.compareAndSet(null, monitor)) {
            throw new IllegalStateException("PerfMonitor already installed; call shutdown() first");
        }
        logger.info("PerfMonitor installed");
        return monitor;
    }

    /**
     * @throws IllegalStateException if no monitor is installed
     */
    public static PerfMonitor monitor() {
        PerfMonitor monitor = INSTALLED.get();
        if (monitor == null) {
            throw new IllegalStateException("No PerfMonitor installed");
        }
        return monitor;
    }

    public static boolean isInstalled() {
        return INSTALLED.get() != null;
    }

    /**
     * Stops and clears the installed monitor. No effect if none is installed.
     */
    public static void shutdown() {
        PerfMonitor monitor = INSTALLED.getAndSet(null);
        if (monitor == null) {
            return;
        }
        monitor.close();
        logger.info("PerfMonitor shut down");
    }
}
