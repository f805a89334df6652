package io.fullerstack.perf.core.config;

/**
 * Monitor settings.
 * <p>
 * Values are not validated here: {@code PerfMonitor.configure} applies the
 * interval unconditionally and ignores a non-positive capacity or target rate
 * field by field.
 *
 * @param updateIntervalMs  delay between subscriber notifications, in milliseconds
 * @param maxHistorySamples samples retained per tracker
 * @param targetFps         expected frame rate, used for dropped-frame estimation
 */
public record PerfConfig(
    long updateIntervalMs,
    int maxHistorySamples,
    int targetFps
) {

    public static final long DEFAULT_UPDATE_INTERVAL_MS = 500;
    public static final int DEFAULT_MAX_HISTORY_SAMPLES = 60;
    public static final int DEFAULT_TARGET_FPS = 60;

    static final String UPDATE_INTERVAL_KEY = "perf.update-interval-ms";
    static final String MAX_HISTORY_SAMPLES_KEY = "perf.max-history-samples";
    static final String TARGET_FPS_KEY = "perf.target-fps";

    /**
     * @return 500 ms interval, 60 samples, 60 fps
     */
    public static PerfConfig defaults() {
        return new PerfConfig(DEFAULT_UPDATE_INTERVAL_MS, DEFAULT_MAX_HISTORY_SAMPLES, DEFAULT_TARGET_FPS);
    }

    /**
     * Reads {@code perf.update-interval-ms}, {@code perf.max-history-samples} and
     * {@code perf.target-fps}, falling back to {@link #defaults()} for absent keys.
     *
     * @param config property source
     * @return config built from properties
     */
    public static PerfConfig fromConfig(HierarchicalConfig config) {
        return new PerfConfig(
            config.getLong(UPDATE_INTERVAL_KEY, DEFAULT_UPDATE_INTERVAL_MS),
            config.getInt(MAX_HISTORY_SAMPLES_KEY, DEFAULT_MAX_HISTORY_SAMPLES),
            config.getInt(TARGET_FPS_KEY, DEFAULT_TARGET_FPS)
        );
    }

    public PerfConfig withUpdateIntervalMs(long updateIntervalMs) {
        return new PerfConfig(updateIntervalMs, maxHistorySamples, targetFps);
    }

    public PerfConfig withMaxHistorySamples(int maxHistorySamples) {
        return new PerfConfig(updateIntervalMs, maxHistorySamples, targetFps);
    }

    public PerfConfig withTargetFps(int targetFps) {
        return new PerfConfig(updateIntervalMs, maxHistorySamples, targetFps);
    }
}
