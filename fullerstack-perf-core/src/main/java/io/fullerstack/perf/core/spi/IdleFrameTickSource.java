package io.fullerstack.perf.core.spi;

import java.util.function.DoubleConsumer;

enum IdleFrameTickSource implements FrameTickSource {
    INSTANCE;

    @Override
    public void startTracking(DoubleConsumer onTick) {
        // never ticks
    }

    @Override
    public void stopTracking() {
    }

    @Override
    public String toString() {
        return "FrameTickSource.idle";
    }
}
