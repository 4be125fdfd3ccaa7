package com.example.flowscope.sampler;

/**
 * Reads resource usage of the current process. Implementations may throw or return
 * negative values when a reading is momentarily unavailable; the sampler handles both.
 */
public interface ProcessResourceProbe {

    /** Process CPU usage in percent, negative when unknown. */
    double cpuPercent();

    long residentMemoryBytes();

    /** Physical memory of the host, 0 when unknown. */
    long totalMemoryBytes();

    int threadCount();

    /** This process plus all of its descendants. */
    int processCount();
}
