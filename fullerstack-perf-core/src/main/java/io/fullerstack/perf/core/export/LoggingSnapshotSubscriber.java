package io.fullerstack.perf.core.export;

import io.fullerstack.perf.core.model.PerfSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Subscriber that writes each snapshot as one JSON line at INFO.
 * <p>
 * Uses the {@code io.fullerstack.perf.snapshots} logger by default so the
 * stream can be routed to its own appender.
 */
public class LoggingSnapshotSubscriber implements Consumer<PerfSnapshot> {

    public static final String DEFAULT_LOGGER_NAME = "io.fullerstack.perf.snapshots";

    private final Logger logger;
    private final SnapshotJsonCodec codec;

    public LoggingSnapshotSubscriber() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), new SnapshotJsonCodec());
    }

    public LoggingSnapshotSubscriber(Logger logger, SnapshotJsonCodec codec) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    @Override
    public void accept(PerfSnapshot snapshot) {
        if (logger.isInfoEnabled()) {
            logger.info("{}", codec.toJson(snapshot));
        }
    }
}
