package io.fullerstack.perf.platform;

import io.fullerstack.perf.core.config.ConfigurationException;

import java.util.Locale;

/**
 * Deployment targets with a fixed set of platform collaborators.
 * <ul>
 *   <li>{@code LINUX}: scheduled rendering ticks, resident memory from {@code /proc/self/status}</li>
 *   <li>{@code JVM}: scheduled rendering ticks, committed heap and non-heap as resident memory</li>
 *   <li>{@code HEADLESS}: no frame sources and no memory reading</li>
 * </ul>
 * The scripting frame source is idle on every variant; scripting ticks arrive
 * through {@code PerfMonitor.reportJsFrameTick}.
 */
public enum PlatformVariant {
    LINUX,
    JVM,
    HEADLESS;

    /**
     * Case-insensitive lookup.
     *
     * @throws ConfigurationException for an unknown name
     */
    public static PlatformVariant fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Platform variant cannot be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown platform variant: " + name, e);
        }
    }
}
