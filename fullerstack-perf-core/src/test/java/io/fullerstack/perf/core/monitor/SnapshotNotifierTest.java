package io.fullerstack.perf.core.monitor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class SnapshotNotifierTest {

    private SnapshotNotifier notifier;

    @AfterEach
    void tearDown() {
        if (notifier != null) {
            notifier.stop();
        }
    }

    @Test
    void rejectsNonPositiveShutdownTimeout() {
        assertThatThrownBy(() -> new SnapshotNotifier("n", () -> 10, () -> { }, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void runsTaskRepeatedly() throws Exception {
        CountDownLatch runs = new CountDownLatch(3);
        notifier = new SnapshotNotifier("test-notifier", () -> 5, runs::countDown, 1_000);

        assertThat(notifier.start()).isTrue();

        assertThat(runs.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void startAndStopAreIdempotent() {
        notifier = new SnapshotNotifier("test-notifier", () -> 5, () -> { }, 1_000);

        assertThat(notifier.start()).isTrue();
        assertThat(notifier.start()).isFalse();
        assertThat(notifier.isRunning()).isTrue();

        assertThat(notifier.stop()).isTrue();
        assertThat(notifier.stop()).isFalse();
        assertThat(notifier.isRunning()).isFalse();
    }

    @Test
    void nothingRunsAfterStopReturns() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch firstRun = new CountDownLatch(1);
        notifier = new SnapshotNotifier("test-notifier", () -> 1, () -> {
            runs.incrementAndGet();
            firstRun.countDown();
        }, 1_000);
        notifier.start();
        assertThat(firstRun.await(5, TimeUnit.SECONDS)).isTrue();

        notifier.stop();
        int afterStop = runs.get();
        Thread.sleep(50);

        assertThat(runs.get()).isEqualTo(afterStop);
    }

    @Test
    void stopWaitsForInProgressRun() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        notifier = new SnapshotNotifier("test-notifier", () -> 1, () -> {
            entered.countDown();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            completed.incrementAndGet();
        }, 1_000);
        notifier.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        notifier.stop();

        assertThat(completed.get()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void interruptedStopInterruptsRunAndReturnsWithoutWaiting() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch taskInterrupted = new CountDownLatch(1);
        notifier = new SnapshotNotifier("test-notifier", () -> 1, () -> {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                taskInterrupted.countDown();
                Thread.currentThread().interrupt();
            }
        }, 60_000);
        notifier.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        Thread.currentThread().interrupt();
        boolean stopped = notifier.stop();
        boolean interruptRestored = Thread.interrupted();

        assertThat(stopped).isTrue();
        assertThat(interruptRestored).isTrue();
        assertThat(notifier.isRunning()).isFalse();
        assertThat(taskInterrupted.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
    }

    @Test
    void failingTaskKeepsLoopAlive() throws Exception {
        CountDownLatch runs = new CountDownLatch(3);
        notifier = new SnapshotNotifier("test-notifier", () -> 1, () -> {
            runs.countDown();
            throw new IllegalStateException("boom");
        }, 1_000);

        notifier.start();

        assertThat(runs.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void intervalIsReadEachCycle() throws Exception {
        AtomicLong interval = new AtomicLong(60_000);
        CountDownLatch ran = new CountDownLatch(1);
        notifier = new SnapshotNotifier("test-notifier", interval::get, ran::countDown, 1_000);

        interval.set(60_000);
        notifier.start();
        assertThat(ran.await(200, TimeUnit.MILLISECONDS)).isFalse();
        notifier.stop();

        interval.set(5);
        notifier.start();
        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void canRestartAfterStop() throws Exception {
        AtomicReference<CountDownLatch> latch = new AtomicReference<>(new CountDownLatch(1));
        notifier = new SnapshotNotifier("test-notifier", () -> 2, () -> latch.get().countDown(), 1_000);

        notifier.start();
        assertThat(latch.get().await(5, TimeUnit.SECONDS)).isTrue();
        notifier.stop();

        latch.set(new CountDownLatch(1));
        notifier.start();
        assertThat(latch.get().await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void stopFromOwnTaskDoesNotDeadlock() throws Exception {
        CountDownLatch stopped = new CountDownLatch(1);
        AtomicReference<SnapshotNotifier> self = new AtomicReference<>();
        notifier = new SnapshotNotifier("test-notifier", () -> 1, () -> {
            self.get().stop();
            stopped.countDown();
        }, 1_000);
        self.set(notifier);

        notifier.start();

        assertThat(stopped.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(notifier.isRunning()).isFalse();
    }
}
