package io.fullerstack.perf.platform.memory;

import io.fullerstack.perf.core.spi.MemoryReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads process resident set size from the {@code VmRSS:} line of
 * {@code /proc/self/status} (Linux).
 * <p>
 * The kernel reports the value in kB; it is returned in bytes. Any failure
 * (file missing, line absent, unparsable number) yields 0. The first failure is
 * logged at WARN, later ones at DEBUG.
 */
public class ProcStatusMemoryReader implements MemoryReader {
    private static final Logger logger = LoggerFactory.getLogger(ProcStatusMemoryReader.class);

    public static final Path DEFAULT_STATUS_PATH = Paths.get("/proc/self/status");

    private static final String VM_RSS_PREFIX = "VmRSS:";
    private static final long BYTES_PER_KB = 1024L;

    private final Path statusPath;
    private final AtomicBoolean failureLogged = new AtomicBoolean(false);

    public ProcStatusMemoryReader() {
        this(DEFAULT_STATUS_PATH);
    }

    public ProcStatusMemoryReader(Path statusPath) {
        this.statusPath = Objects.requireNonNull(statusPath, "statusPath cannot be null");
    }

    @Override
    public long residentBytes() {
        try (BufferedReader reader = Files.newBufferedReader(statusPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(VM_RSS_PREFIX)) {
                    return parseKilobytes(line.substring(VM_RSS_PREFIX.length())) * BYTES_PER_KB;
                }
            }
            logFailure("No " + VM_RSS_PREFIX + " line in " + statusPath, null);
        } catch (IOException | NumberFormatException e) {
            logFailure("Failed to read resident memory from " + statusPath, e);
        }
        return 0L;
    }

    /**
     * Parses {@code "   123456 kB"}.
     */
    static long parseKilobytes(String value) {
        String trimmed = value.trim();
        int space = trimmed.indexOf(' ');
        String digits = space < 0 ? trimmed : trimmed.substring(0, space);
        return Long.parseLong(digits);
    }

    private void logFailure(String message, Exception cause) {
        if (failureLogged.compareAndSet(false, true)) {
            logger.warn("{}; reporting 0 bytes", message, cause);
        } else if (logger.isDebugEnabled()) {
            logger.debug("{}; reporting 0 bytes", message, cause);
        }
    }

    @Override
    public String toString() {
        return "ProcStatusMemoryReader[" + statusPath + "]";
    }
}
