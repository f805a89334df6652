package io.fullerstack.perf.platform;

import io.fullerstack.perf.core.config.HierarchicalConfig;
import io.fullerstack.perf.core.spi.FrameTickSource;
import io.fullerstack.perf.core.spi.MemoryReader;
import io.fullerstack.perf.core.spi.PlatformMetrics;
import io.fullerstack.perf.platform.memory.JvmMemoryReader;
import io.fullerstack.perf.platform.memory.ProcStatusMemoryReader;
import io.fullerstack.perf.platform.source.ScheduledFrameTickSource;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the {@link PlatformMetrics} for one deployment variant.
 * <p>
 * Properties:
 * <ul>
 *   <li>{@code perf.platform.variant}: {@code linux}, {@code jvm} or {@code headless} (default {@code jvm})</li>
 *   <li>{@code perf.platform.tick-rate-hz}: rendering tick rate (default 60)</li>
 * </ul>
 */
@UtilityClass
public class PlatformMetricsFactory {
    private static final Logger logger = LoggerFactory.getLogger(PlatformMetricsFactory.class);

    public static final String VARIANT_KEY = "perf.platform.variant";
    public static final String TICK_RATE_KEY = "perf.platform.tick-rate-hz";

    public static final PlatformVariant DEFAULT_VARIANT = PlatformVariant.JVM;

    private static final String UI_TICK_THREAD = "perf-ui-frame-ticks";

    public static PlatformMetrics create(HierarchicalConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        PlatformVariant variant = PlatformVariant.fromName(
            config.getString(VARIANT_KEY, DEFAULT_VARIANT.name()));
        int tickRateHz = config.getInt(TICK_RATE_KEY, ScheduledFrameTickSource.DEFAULT_TICK_RATE_HZ);
        return create(variant, tickRateHz);
    }

    public static PlatformMetrics create(PlatformVariant variant) {
        return create(variant, ScheduledFrameTickSource.DEFAULT_TICK_RATE_HZ);
    }

    /**
     * @param variant    deployment variant
     * @param tickRateHz rendering tick rate, ignored for {@code HEADLESS}
     * @return platform metrics for the variant
     */
    public static PlatformMetrics create(PlatformVariant variant, int tickRateHz) {
        Objects.requireNonNull(variant, "variant cannot be null");
        PlatformMetrics platform = switch (variant) {
            case LINUX -> PlatformMetrics.of(
                uiTicks(tickRateHz), FrameTickSource.idle(), new ProcStatusMemoryReader());
            case JVM -> PlatformMetrics.of(
                uiTicks(tickRateHz), FrameTickSource.idle(), new JvmMemoryReader());
            case HEADLESS -> PlatformMetrics.of(
                FrameTickSource.idle(), FrameTickSource.idle(), MemoryReader.unavailable());
        };
        logger.info("Platform metrics for variant {}: {}", variant, platform);
        return platform;
    }

    private static FrameTickSource uiTicks(int tickRateHz) {
        return new ScheduledFrameTickSource(UI_TICK_THREAD, tickRateHz, System::nanoTime);
    }
}
