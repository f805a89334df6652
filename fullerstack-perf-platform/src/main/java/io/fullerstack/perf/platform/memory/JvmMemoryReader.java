package io.fullerstack.perf.platform.memory;

import io.fullerstack.perf.core.spi.MemoryReader;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.Objects;

/**
 * Approximates resident memory as committed heap plus committed non-heap, for
 * platforms without {@code /proc}.
 */
public class JvmMemoryReader implements MemoryReader {

    private final MemoryMXBean memoryBean;

    public JvmMemoryReader() {
        this(ManagementFactory.getMemoryMXBean());
    }

    public JvmMemoryReader(MemoryMXBean memoryBean) {
        this.memoryBean = Objects.requireNonNull(memoryBean, "memoryBean cannot be null");
    }

    @Override
    public long residentBytes() {
        long heap = memoryBean.getHeapMemoryUsage().getCommitted();
        long nonHeap = memoryBean.getNonHeapMemoryUsage().getCommitted();
        return Math.max(0L, heap) + Math.max(0L, nonHeap);
    }

    @Override
    public String toString() {
        return "JvmMemoryReader";
    }
}
