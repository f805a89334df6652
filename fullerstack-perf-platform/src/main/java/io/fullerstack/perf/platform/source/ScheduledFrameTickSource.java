package io.fullerstack.perf.platform.source;

import io.fullerstack.perf.core.spi.FrameTickSource;
import io.fullerstack.perf.core.util.FrameTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleConsumer;
import java.util.function.LongSupplier;

/**
 * Frame source that ticks at a fixed rate on a daemon scheduler thread.
 * <p>
 * Stands in for a display-sync callback on a plain JVM: every tick carries the
 * monotonic {@link System#nanoTime()} clock converted to seconds. A tick that
 * runs late is delivered late, so a stalled scheduler shows up as a lower rate.
 *
 * <pre>
 * FrameTickSource ui = new ScheduledFrameTickSource(60);
 * PlatformMetrics platform = PlatformMetrics.of(ui, FrameTickSource.idle(), new JvmMemoryReader());
 * </pre>
 */
public class ScheduledFrameTickSource implements FrameTickSource {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledFrameTickSource.class);

    public static final int DEFAULT_TICK_RATE_HZ = 60;

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final String threadName;
    private final long periodNanos;
    private final LongSupplier nanoClock;
    private final Object lock = new Object();

    private volatile DoubleConsumer listener;
    private ScheduledExecutorService scheduler;

    public ScheduledFrameTickSource() {
        this(DEFAULT_TICK_RATE_HZ);
    }

    public ScheduledFrameTickSource(int tickRateHz) {
        this("perf-frame-ticks", tickRateHz, System::nanoTime);
    }

    /**
     * @param threadName name of the scheduler thread
     * @param tickRateHz ticks per second, positive
     * @param nanoClock  monotonic nanosecond clock
     */
    public ScheduledFrameTickSource(String threadName, int tickRateHz, LongSupplier nanoClock) {
        this.threadName = Objects.requireNonNull(threadName, "threadName cannot be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock cannot be null");
        if (tickRateHz <= 0) {
            throw new IllegalArgumentException("tickRateHz must be positive, got " + tickRateHz);
        }
        this.periodNanos = NANOS_PER_SECOND / tickRateHz;
    }

    @Override
    public void startTracking(DoubleConsumer onTick) {
        Objects.requireNonNull(onTick, "onTick cannot be null");
        synchronized (lock) {
            listener = onTick;
            if (scheduler != null) {
                logger.debug("Frame tick source {} already ticking, listener replaced", threadName);
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, threadName);
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleAtFixedRate(this::tick, 0, periodNanos, TimeUnit.NANOSECONDS);
            logger.info("Frame tick source {} started ({} ns period)", threadName, periodNanos);
        }
    }

    @Override
    public void stopTracking() {
        ScheduledExecutorService stopping;
        synchronized (lock) {
            stopping = scheduler;
            scheduler = null;
            listener = null;
        }
        if (stopping == null) {
            return;
        }

        stopping.shutdown();
        try {
            if (!stopping.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Frame tick source {} did not terminate in 5 seconds, forcing shutdown", threadName);
                stopping.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for frame tick source {} shutdown", threadName);
            stopping.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Frame tick source {} stopped", threadName);
    }

    public boolean isTracking() {
        synchronized (lock) {
            return scheduler != null;
        }
    }

    private void tick() {
        DoubleConsumer current = listener;
        if (current == null) {
            return;
        }
        try {
            current.accept(FrameTimes.nanosToSeconds(nanoClock.getAsLong()));
        } catch (RuntimeException e) {
            // A throwing listener would otherwise cancel the periodic task
            logger.error("Frame tick listener failed on {}", threadName, e);
        }
    }

    @Override
    public String toString() {
        return "ScheduledFrameTickSource[" + threadName + ", periodNanos=" + periodNanos + "]";
    }
}
