package io.fullerstack.perf.core.spi;

/**
 * Reads the process resident memory size.
 */
@FunctionalInterface
public interface MemoryReader {

    /**
     * @return resident memory in bytes, or 0 if it cannot be determined
     */
    long residentBytes();

    static MemoryReader unavailable() {
        return () -> 0L;
    }
}
