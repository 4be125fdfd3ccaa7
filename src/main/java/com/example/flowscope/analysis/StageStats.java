package com.example.flowscope.analysis;

/**
 * Latency distribution of one stage across a set of traces, in seconds.
 */
public class StageStats {
    private final double mean;
    private final double p50;
    private final double p95;
    private final double p99;
    private final double min;
    private final double max;
    private final int count;

    public StageStats(double mean, double p50, double p95, double p99, double min, double max, int count) {
        this.mean = mean;
        this.p50 = p50;
        this.p95 = p95;
        this.p99 = p99;
        this.min = min;
        this.max = max;
        this.count = count;
    }

    public double getMean() { return mean; }
    public double getP50() { return p50; }
    public double getP95() { return p95; }
    public double getP99() { return p99; }
    public double getMin() { return min; }
    public double getMax() { return max; }
    public int getCount() { return count; }
}
