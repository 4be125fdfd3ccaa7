package com.example.flowscope.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view over a trace snapshot. Recomputed on every request, never stored.
 */
public class EventFlow {
    private final int totalEvents;
    private final int completedEvents;
    private final int lostEvents;
    private final double avgLatency;
    private final double p95Latency;
    private final double p99Latency;
    private final String bottleneckStage;
    private final Map<String, Double> stageLatencies;

    public EventFlow(int totalEvents, int completedEvents, double avgLatency,
                     double p95Latency, double p99Latency,
                     String bottleneckStage, Map<String, Double> stageLatencies) {
        this.totalEvents = totalEvents;
        this.completedEvents = completedEvents;
        this.lostEvents = totalEvents - completedEvents;
        this.avgLatency = avgLatency;
        this.p95Latency = p95Latency;
        this.p99Latency = p99Latency;
        this.bottleneckStage = bottleneckStage;
        this.stageLatencies = Collections.unmodifiableMap(new LinkedHashMap<>(stageLatencies));
    }

    public int getTotalEvents() { return totalEvents; }
    public int getCompletedEvents() { return completedEvents; }
    public int getLostEvents() { return lostEvents; }
    public double getAvgLatency() { return avgLatency; }
    public double getP95Latency() { return p95Latency; }
    public double getP99Latency() { return p99Latency; }
    public String getBottleneckStage() { return bottleneckStage; }
    public Map<String, Double> getStageLatencies() { return stageLatencies; }
}
