package com.example.flowscope.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public class StageComparison {
    private final double aLatency;
    private final double bLatency;
    private final double diff;
    private final double diffPct;   // relative to a; 0 when a is 0

    public StageComparison(double aLatency, double bLatency) {
        this.aLatency = aLatency;
        this.bLatency = bLatency;
        this.diff = bLatency - aLatency;
        this.diffPct = aLatency > 0 ? diff / aLatency * 100.0 : 0.0;
    }

    @JsonProperty("a_latency")
    public double getALatency() { return aLatency; }
    @JsonProperty("b_latency")
    public double getBLatency() { return bLatency; }
    @JsonProperty("diff")
    public double getDiff() { return diff; }
    @JsonProperty("diff_pct")
    public double getDiffPct() { return diffPct; }
}
