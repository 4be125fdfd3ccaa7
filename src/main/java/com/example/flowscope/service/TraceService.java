package com.example.flowscope.service;

import com.example.flowscope.analysis.LatencyAnalyzer;
import com.example.flowscope.analysis.StageComparison;
import com.example.flowscope.analysis.StageStats;
import com.example.flowscope.analysis.TraceAnomaly;
import com.example.flowscope.export.TimelineExporter;
import com.example.flowscope.model.CheckpointRequest;
import com.example.flowscope.model.EventFlow;
import com.example.flowscope.model.EventTrace;
import com.example.flowscope.model.StartTraceRequest;
import com.example.flowscope.store.TraceNotFoundException;
import com.example.flowscope.store.TraceStore;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

/**
 * Trace operations for out-of-process callers. Analysis and export always run
 * against a fresh store snapshot.
 */
@Service
public class TraceService {

    private final TraceStore store;
    private final TimelineExporter exporter;

    public TraceService(TraceStore store, TimelineExporter exporter) {
        this.store = store;
        this.exporter = exporter;
    }

    public EventTrace start(StartTraceRequest req) {
        if (req == null || req.getEventId() == null || req.getEventId().isBlank()) {
            throw new IllegalArgumentException("eventId is required");
        }
        String type = (req.getEventType() == null || req.getEventType().isBlank()) ? TraceStore.UNKNOWN_TYPE : req.getEventType();
        return store.startTrace(req.getEventId(), type, req.getMetadata());
    }

    public void checkpoint(String eventId, CheckpointRequest req) {
        if (req == null) throw new IllegalArgumentException("checkpoint body is required");
        store.checkpoint(eventId, req.getName(), req.getMetadata());
    }

    public EventTrace complete(String eventId) {
        return store.completeTrace(eventId);
    }

    public EventTrace get(String eventId) {
        return store.getTrace(eventId).orElseThrow(() -> new TraceNotFoundException(eventId));
    }

    public List<EventTrace> list() {
        return store.getAllTraces();
    }

    public List<EventTrace> lost(double timeoutSec) {
        return store.findLostEvents(timeoutSec);
    }

    public EventFlow flow() {
        return store.analyzeFlow();
    }

    public Map<String, StageStats> latencies() {
        return LatencyAnalyzer.analyzeLatencies(store.getAllTraces());
    }

    public String bottleneck() {
        return LatencyAnalyzer.findBottleneck(store.getAllTraces());
    }

    public List<TraceAnomaly> anomalies(double threshold) {
        return LatencyAnalyzer.detectAnomalies(store.getAllTraces(), threshold);
    }

    /**
     * Throughput keyed by window start rendered as epoch seconds with millisecond precision.
     */
    public Map<String, Double> throughput(double windowSec) {
        SortedMap<Double, Double> windows = LatencyAnalyzer.calculateThroughput(store.getAllTraces(), windowSec);
        Map<String, Double> keyed = new LinkedHashMap<>();
        for (Map.Entry<Double, Double> e : windows.entrySet()) {
            keyed.put(String.format(Locale.ROOT, "%.3f", e.getKey()), e.getValue());
        }
        return keyed;
    }

    public Map<String, StageComparison> compare(String a, String b) {
        return LatencyAnalyzer.compareTraces(get(a), get(b));
    }

    public String report() {
        return LatencyAnalyzer.generateLatencyReport(store.getAllTraces());
    }

    public Map<String, Object> statistics() {
        return store.getStatistics();
    }

    public ObjectNode chromeTrace() {
        return exporter.toChromeTrace(store.getAllTraces());
    }

    public String timelineHtml() {
        return exporter.exportTimelineHtml(store.getAllTraces());
    }

    public void clear() {
        store.clear();
    }
}
