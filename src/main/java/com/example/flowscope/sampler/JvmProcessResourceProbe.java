package com.example.flowscope.sampler;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;

/**
 * {@link ProcessResourceProbe} backed by the platform MXBeans.
 * Resident memory is approximated by heap plus non-heap usage.
 */
public class JvmProcessResourceProbe implements ProcessResourceProbe {

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final ThreadMXBean threadBean = ManagementFactory.getThreadMXBean();

    @Override
    public double cpuPercent() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean) {
            double load = ((com.sun.management.OperatingSystemMXBean) osBean).getProcessCpuLoad();
            return load < 0 ? -1.0 : load * 100.0;
        }
        return -1.0;
    }

    @Override
    public long residentMemoryBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed() + memoryBean.getNonHeapMemoryUsage().getUsed();
    }

    @Override
    public long totalMemoryBytes() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean) {
            return ((com.sun.management.OperatingSystemMXBean) osBean).getTotalMemorySize();
        }
        return 0L;
    }

    @Override
    public int threadCount() {
        return threadBean.getThreadCount();
    }

    @Override
    public int processCount() {
        return (int) ProcessHandle.current().descendants().count() + 1;
    }
}
