package com.example.flowscope.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"timestamp", "cpu_percent", "memory_mb", "memory_percent", "thread_count", "process_count"})
public class SystemMetrics {
    private final double timestamp;
    private final double cpuPercent;
    private final long memoryMb;
    private final double memoryPercent;
    private final int threadCount;
    private final int processCount;

    public SystemMetrics(double timestamp, double cpuPercent, long memoryMb, double memoryPercent,
                         int threadCount, int processCount) {
        this.timestamp = timestamp;
        this.cpuPercent = cpuPercent;
        this.memoryMb = memoryMb;
        this.memoryPercent = memoryPercent;
        this.threadCount = threadCount;
        this.processCount = processCount;
    }

    @JsonProperty("timestamp") public double getTimestamp() { return timestamp; }
    @JsonProperty("cpu_percent") public double getCpuPercent() { return cpuPercent; }
    @JsonProperty("memory_mb") public long getMemoryMb() { return memoryMb; }
    @JsonProperty("memory_percent") public double getMemoryPercent() { return memoryPercent; }
    @JsonProperty("thread_count") public int getThreadCount() { return threadCount; }
    @JsonProperty("process_count") public int getProcessCount() { return processCount; }
}
