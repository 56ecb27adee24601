package com.group13.coursesearch.core;

/**
 * Capability for reading the current memory usage of the process.
 * Implementations that cannot measure return 0 instead of failing.
 */
public interface MemoryProbe {
    long usedBytes();
}
