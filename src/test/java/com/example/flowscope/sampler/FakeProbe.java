package com.example.flowscope.sampler;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Scriptable probe. CPU readings are consumed in order; {@code NaN} in the script means "throw".
 */
class FakeProbe implements ProcessResourceProbe {

    private final Deque<Double> cpuScript = new ArrayDeque<>();
    long rss = 256L * 1024 * 1024;
    long total = 1024L * 1024 * 1024;
    int threads = 12;
    int processes = 1;
    boolean failMemory;

    FakeProbe cpu(double... readings) {
        for (double r : readings) cpuScript.add(r);
        return this;
    }

    @Override
    public double cpuPercent() {
        Double next = cpuScript.poll();
        if (next == null) return 0.0;
        if (Double.isNaN(next)) throw new IllegalStateException("cpu probe unavailable");
        return next;
    }

    @Override
    public long residentMemoryBytes() {
        if (failMemory) throw new IllegalStateException("memory probe unavailable");
        return rss;
    }

    @Override
    public long totalMemoryBytes() {
        return total;
    }

    @Override
    public int threadCount() {
        return threads;
    }

    @Override
    public int processCount() {
        return processes;
    }
}
