package io.fullerstack.perf.core.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Runs a task repeatedly on a dedicated background thread, sleeping for the
 * current interval before each run.
 * <p>
 * The interval is re-read before every cycle, so changes take effect after the
 * wait already in progress. Each {@link #start()} creates a fresh single-thread
 * executor; {@link #stop()} shuts it down and blocks until the worker has
 * exited. A run already in progress completes first; pending waits are
 * cancelled. Once {@code stop()} returns the task does not run again.
 * <p>
 * {@code stop()} must not be called from inside the task. If it is, the
 * executor is shut down without waiting and a warning is logged.
 * <p>
 * If the thread calling {@code stop()} is interrupted while waiting, the
 * executor is shut down with {@code shutdownNow()} and {@code stop()} returns
 * at once with the interrupt flag restored. A task that ignores interruption
 * may still be finishing its current run at that point.
 */
public class SnapshotNotifier {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotNotifier.class);

    static final long MIN_INTERVAL_MS = 1;

    private final String threadName;
    private final LongSupplier intervalMs;
    private final Runnable task;
    private final long shutdownTimeoutMs;

    private final Object lifecycleLock = new Object();
    private ScheduledThreadPoolExecutor executor;  // guarded by lifecycleLock
    private volatile Thread worker;

    /**
     * @param threadName        name of the worker thread
     * @param intervalMs        supplies the delay before each run, in milliseconds
     * @param task              work performed each cycle
     * @param shutdownTimeoutMs how long each wait in {@link #stop()} lasts before logging and waiting again
     */
    public SnapshotNotifier(String threadName, LongSupplier intervalMs, Runnable task, long shutdownTimeoutMs) {
        this.threadName = Objects.requireNonNull(threadName, "threadName cannot be null");
        this.intervalMs = Objects.requireNonNull(intervalMs, "intervalMs cannot be null");
        this.task = Objects.requireNonNull(task, "task cannot be null");
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException("shutdownTimeoutMs must be > 0");
        }
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    /**
     * Starts the periodic loop. No effect if already started.
     *
     * @return true if this call started the loop
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (executor != null) {
                return false;
            }
            ScheduledThreadPoolExecutor created = new ScheduledThreadPoolExecutor(1, r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                worker = t;
                return t;
            });
            created.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            created.setRemoveOnCancelPolicy(true);
            executor = created;
            scheduleNext(created);
            logger.debug("Notifier {} started", threadName);
            return true;
        }
    }

    private void scheduleNext(ScheduledThreadPoolExecutor target) {
        if (target.isShutdown()) {
            return;
        }
        long delay = Math.max(MIN_INTERVAL_MS, intervalMs.getAsLong());
        try {
            target.schedule(() -> runCycle(target), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // Lost the race with stop(); nothing left to schedule
            logger.debug("Notifier {} stopped while rescheduling", threadName);
        }
    }

    private void runCycle(ScheduledThreadPoolExecutor target) {
        if (target.isShutdown()) {
            return;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.error("Notifier {} task failed; continuing", threadName, e);
        } finally {
            scheduleNext(target);
        }
    }

    /**
     * Stops the loop and waits for the worker thread to exit. No effect if not started.
     *
     * @return true if this call stopped the loop
     */
    public boolean stop() {
        ScheduledThreadPoolExecutor stopping;
        synchronized (lifecycleLock) {
            stopping = executor;
            if (stopping == null) {
                return false;
            }
            executor = null;
        }

        stopping.shutdown();

        if (Thread.currentThread() == worker) {
            logger.warn("Notifier {} stopped from its own task; not waiting for it to exit", threadName);
            return true;
        }

        try {
            while (!stopping.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Notifier {} still finishing a notification after {}ms, waiting", threadName, shutdownTimeoutMs);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for notifier {} to exit", threadName);
            stopping.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.debug("Notifier {} stopped", threadName);
        return true;
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return executor != null;
        }
    }
}
