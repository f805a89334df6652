package io.fullerstack.perf.core.spi;

import java.util.function.DoubleConsumer;

/**
 * Notifies a listener each time a frame completes.
 * <p>
 * Implementations deliver timestamps in seconds, non-decreasing, from a single
 * thread at a time. A source that cannot track frames on the current platform
 * stays idle instead of failing.
 */
public interface FrameTickSource {

    /**
     * Begins delivering frame timestamps (seconds) to {@code onTick}.
     * Calling it again replaces the listener.
     */
    void startTracking(DoubleConsumer onTick);

    /**
     * Stops delivering ticks. Safe to call when not tracking.
     */
    void stopTracking();

    /**
     * @return a source that never ticks
     */
    static FrameTickSource idle() {
        return IdleFrameTickSource.INSTANCE;
    }
}
