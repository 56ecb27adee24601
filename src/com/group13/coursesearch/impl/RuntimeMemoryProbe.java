package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.MemoryProbe;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * Reads heap usage from the platform {@link MemoryMXBean}.
 * Returns 0 when the management facility is not available.
 */
public class RuntimeMemoryProbe implements MemoryProbe {

    private final MemoryMXBean memoryBean;

    public RuntimeMemoryProbe() {
        this(lookupBean());
    }

    RuntimeMemoryProbe(MemoryMXBean memoryBean) {
        this.memoryBean = memoryBean;
    }

    @Override
    public long usedBytes() {
        if (memoryBean == null) {
            return 0L;
        }
        try {
            return memoryBean.getHeapMemoryUsage().getUsed();
        } catch (RuntimeException e) {
            return 0L;
        }
    }

    private static MemoryMXBean lookupBean() {
        try {
            return ManagementFactory.getMemoryMXBean();
        } catch (RuntimeException | LinkageError e) {
            return null;
        }
    }
}
