package com.group13.coursesearch.impl;

import com.group13.coursesearch.core.MemoryProbe;

/**
 * Probe for environments without memory measurement; always reads 0.
 */
public class NoOpMemoryProbe implements MemoryProbe {

    @Override
    public long usedBytes() {
        return 0L;
    }
}
