package io.fullerstack.perf.platform.observers;

import io.fullerstack.perf.core.config.HierarchicalConfig;
import io.fullerstack.perf.core.monitor.PerfMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls heap usage on an interval and reports it through
 * {@link PerfMonitor#reportJsHeap(long, long)}.
 * <p>
 * Reports used and committed heap. A sample where both are 0 is skipped so an
 * unavailable reading never overwrites the last good one.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>{@link #start()} - first sample immediately, then every interval</li>
 *   <li>{@link #close()} - stops polling (5 second shutdown timeout)</li>
 * </ol>
 */
public class HeapSampler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HeapSampler.class);

    public static final long DEFAULT_INTERVAL_MS = 2_000;
    public static final String INTERVAL_KEY = "perf.heap.sample-interval-ms";

    private final PerfMonitor monitor;
    private final MemoryMXBean memoryBean;
    private final long intervalMs;
    private final Object lock = new Object();

    private ScheduledExecutorService scheduler;

    public HeapSampler(PerfMonitor monitor) {
        this(monitor, ManagementFactory.getMemoryMXBean(), DEFAULT_INTERVAL_MS);
    }

    public HeapSampler(PerfMonitor monitor, MemoryMXBean memoryBean, long intervalMs) {
        this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
        this.memoryBean = Objects.requireNonNull(memoryBean, "memoryBean cannot be null");
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, got " + intervalMs);
        }
        this.intervalMs = intervalMs;
    }

    public static HeapSampler fromConfig(PerfMonitor monitor, HierarchicalConfig config) {
        return new HeapSampler(
            monitor,
            ManagementFactory.getMemoryMXBean(),
            config.getLong(INTERVAL_KEY, DEFAULT_INTERVAL_MS)
        );
    }

    /**
     * Starts polling. Logs a warning and returns if already started.
     */
    public void start() {
        synchronized (lock) {
            if (scheduler != null) {
                logger.warn("HeapSampler already started");
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "perf-heap-sampler");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleAtFixedRate(this::sampleSafely, 0, intervalMs, TimeUnit.MILLISECONDS);
            logger.info("Heap sampler started with {}ms interval", intervalMs);
        }
    }

    public boolean isStarted() {
        synchronized (lock) {
            return scheduler != null;
        }
    }

    /**
     * Takes one reading and reports it.
     *
     * @return true if a reading was reported
     */
    public boolean sample() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long used = Math.max(0L, heap.getUsed());
        long committed = Math.max(0L, heap.getCommitted());
        if (used == 0 && committed == 0) {
            return false;
        }
        monitor.reportJsHeap(used, committed);
        return true;
    }

    private void sampleSafely() {
        try {
            sample();
        } catch (RuntimeException e) {
            logger.error("Heap sample failed", e);
        }
    }

    /**
     * Stops polling. Safe to call multiple times.
     */
    @Override
    public void close() {
        ScheduledExecutorService stopping;
        synchronized (lock) {
            stopping = scheduler;
            scheduler = null;
        }
        if (stopping == null) {
            logger.debug("HeapSampler not started, nothing to close");
            return;
        }

        stopping.shutdown();
        try {
            if (!stopping.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Heap sampler did not terminate in 5 seconds, forcing shutdown");
                stopping.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for heap sampler shutdown");
            stopping.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Heap sampler stopped");
    }
}
