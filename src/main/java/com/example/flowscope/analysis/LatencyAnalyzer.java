package com.example.flowscope.analysis;

import com.example.flowscope.model.EventFlow;
import com.example.flowscope.model.EventTrace;

import java.util.*;

/**
 * Stateless latency statistics over a trace snapshot.
 * <p>
 * A stage is the gap between two consecutive checkpoints, named {@code "a -> b"}.
 * Percentiles are nearest-rank: {@code sorted[floor(n * p)]}, clamped to the last sample.
 */
public final class LatencyAnalyzer {

    public static final String NO_STAGE = "N/A";
    public static final double DEFAULT_ANOMALY_THRESHOLD = 2.0;
    public static final int MAX_THROUGHPUT_WINDOWS = 100_000;
    private static final int REPORT_ANOMALY_LIMIT = 10;
    private static final String RULE = "=".repeat(60);
    private static final String THIN_RULE = "-".repeat(60);

    private LatencyAnalyzer() {}

    public static Map<String, StageStats> analyzeLatencies(List<EventTrace> traces) {
        Map<String, List<Double>> samples = collectStageSamples(traces);
        Map<String, StageStats> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> e : samples.entrySet()) {
            double[] sorted = sortedArray(e.getValue());
            int n = sorted.length;
            if (n == 0) continue;
            result.put(e.getKey(), new StageStats(
                    mean(sorted),
                    percentile(sorted, 0.50),
                    percentile(sorted, 0.95),
                    percentile(sorted, 0.99),
                    sorted[0],
                    sorted[n - 1],
                    n));
        }
        return result;
    }

    /**
     * @return the stage with the highest mean latency, or {@value #NO_STAGE}
     */
    public static String findBottleneck(List<EventTrace> traces) {
        return bottleneckOf(analyzeLatencies(traces));
    }

    public static List<TraceAnomaly> detectAnomalies(List<EventTrace> traces) {
        return detectAnomalies(traces, DEFAULT_ANOMALY_THRESHOLD);
    }

    /**
     * Flags each trace at most once, at its first stage slower than {@code threshold}
     * times that stage's population mean.
     */
    public static List<TraceAnomaly> detectAnomalies(List<EventTrace> traces, double threshold) {
        Map<String, StageStats> stats = analyzeLatencies(traces);
        List<TraceAnomaly> anomalies = new ArrayList<>();
        if (stats.isEmpty()) return anomalies;

        for (EventTrace trace : traces) {
            for (Map.Entry<String, Double> stage : trace.getStageLatencies().entrySet()) {
                StageStats s = stats.get(stage.getKey());
                if (s != null && stage.getValue() > s.getMean() * threshold) {
                    anomalies.add(new TraceAnomaly(trace.getEventId(), trace, stage.getKey()));
                    break;
                }
            }
        }
        return anomalies;
    }

    public static SortedMap<Double, Double> calculateThroughput(List<EventTrace> traces) {
        return calculateThroughput(traces, 1.0);
    }

    /**
     * Events per second for each fixed window tiling the creation-time range,
     * keyed by window start (epoch seconds).
     *
     * @throws IllegalArgumentException if the window is not positive or would need more than
     *                                  {@value #MAX_THROUGHPUT_WINDOWS} windows
     */
    public static SortedMap<Double, Double> calculateThroughput(List<EventTrace> traces, double windowSeconds) {
        if (!(windowSeconds > 0)) {
            throw new IllegalArgumentException("windowSeconds must be > 0, was " + windowSeconds);
        }
        SortedMap<Double, Double> windows = new TreeMap<>();
        if (traces.isEmpty()) return windows;

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (EventTrace t : traces) {
            min = Math.min(min, t.getCreatedAt());
            max = Math.max(max, t.getCreatedAt());
        }

        long span = (long) Math.floor((max - min) / windowSeconds);
        if (span >= MAX_THROUGHPUT_WINDOWS) {
            throw new IllegalArgumentException("windowSeconds " + windowSeconds + " splits the "
                    + (max - min) + "s range into more than " + MAX_THROUGHPUT_WINDOWS + " windows");
        }
        int windowCount = (int) span + 1;
        long[] counts = new long[windowCount];
        for (EventTrace t : traces) {
            int idx = (int) Math.floor((t.getCreatedAt() - min) / windowSeconds);
            counts[Math.min(idx, windowCount - 1)]++;
        }
        for (int i = 0; i < windowCount; i++) {
            windows.put(min + i * windowSeconds, counts[i] / windowSeconds);
        }
        return windows;
    }

    /**
     * Stage-by-stage comparison over the stages both traces share.
     */
    public static Map<String, StageComparison> compareTraces(EventTrace a, EventTrace b) {
        Map<String, Double> la = a.getStageLatencies();
        Map<String, Double> lb = b.getStageLatencies();
        Map<String, StageComparison> result = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : la.entrySet()) {
            Double other = lb.get(e.getKey());
            if (other != null) {
                result.put(e.getKey(), new StageComparison(e.getValue(), other));
            }
        }
        return result;
    }

    public static EventFlow analyzeFlow(List<EventTrace> traces) {
        if (traces.isEmpty()) {
            return new EventFlow(0, 0, 0.0, 0.0, 0.0, NO_STAGE, Collections.emptyMap());
        }

        int completed = 0;
        List<Double> latencies = new ArrayList<>();
        for (EventTrace t : traces) {
            if (t.isCompleted()) completed++;
            if (t.getTotalLatency() > 0) latencies.add(t.getTotalLatency());
        }

        double avg = 0.0, p95 = 0.0, p99 = 0.0;
        if (!latencies.isEmpty()) {
            double[] sorted = sortedArray(latencies);
            avg = mean(sorted);
            p95 = percentile(sorted, 0.95);
            p99 = percentile(sorted, 0.99);
        }

        Map<String, Double> stageMeans = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> e : collectStageSamples(traces).entrySet()) {
            stageMeans.put(e.getKey(), mean(sortedArray(e.getValue())));
        }
        String bottleneck = NO_STAGE;
        double worst = -Double.MAX_VALUE;
        for (Map.Entry<String, Double> e : stageMeans.entrySet()) {
            if (e.getValue() > worst) {
                worst = e.getValue();
                bottleneck = e.getKey();
            }
        }

        return new EventFlow(traces.size(), completed, avg, p95, p99, bottleneck, stageMeans);
    }

    public static String generateLatencyReport(List<EventTrace> traces) {
        if (traces.isEmpty()) {
            return "No traces to analyze.";
        }

        Map<String, StageStats> stats = analyzeLatencies(traces);
        List<TraceAnomaly> anomalies = detectAnomalies(traces);
        long completed = traces.stream().filter(EventTrace::isCompleted).count();

        StringBuilder sb = new StringBuilder();
        line(sb, RULE);
        line(sb, "LATENCY ANALYSIS REPORT");
        line(sb, RULE);
        line(sb, "");
        line(sb, "Total Events: " + traces.size());
        line(sb, "Completed Events: " + completed);
        line(sb, "Bottleneck Stage: " + bottleneckOf(stats));
        line(sb, "Anomalies Detected: " + anomalies.size());
        line(sb, "");
        line(sb, RULE);
        line(sb, "STAGE LATENCIES");
        line(sb, RULE);

        List<Map.Entry<String, StageStats>> sorted = new ArrayList<>(stats.entrySet());
        sorted.sort((x, y) -> Double.compare(y.getValue().getMean(), x.getValue().getMean()));
        for (Map.Entry<String, StageStats> e : sorted) {
            StageStats s = e.getValue();
            line(sb, "");
            line(sb, e.getKey());
            line(sb, THIN_RULE);
            line(sb, "  Count:  " + s.getCount());
            line(sb, "  Mean:   " + ms(s.getMean()));
            line(sb, "  P50:    " + ms(s.getP50()));
            line(sb, "  P95:    " + ms(s.getP95()));
            line(sb, "  P99:    " + ms(s.getP99()));
            line(sb, "  Min:    " + ms(s.getMin()));
            line(sb, "  Max:    " + ms(s.getMax()));
        }

        if (!anomalies.isEmpty()) {
            line(sb, "");
            line(sb, RULE);
            line(sb, "ANOMALIES");
            line(sb, RULE);
            line(sb, "");
            for (TraceAnomaly a : anomalies.subList(0, Math.min(REPORT_ANOMALY_LIMIT, anomalies.size()))) {
                double latency = a.getTrace().getStageLatencies().getOrDefault(a.getStage(), 0.0);
                double avg = stats.get(a.getStage()).getMean();
                double factor = avg > 0 ? latency / avg : 0.0;
                line(sb, "  " + a.getEventId() + ": " + a.getStage());
                line(sb, String.format(Locale.ROOT, "    Latency: %s (%.1fx average)", ms(latency), factor));
            }
            if (anomalies.size() > REPORT_ANOMALY_LIMIT) {
                line(sb, "  ... and " + (anomalies.size() - REPORT_ANOMALY_LIMIT) + " more");
            }
        }

        line(sb, "");
        sb.append(RULE);
        return sb.toString();
    }

    static double percentile(double[] sorted, double p) {
        int idx = (int) Math.floor(sorted.length * p);
        return sorted[Math.max(0, Math.min(idx, sorted.length - 1))];
    }

    private static Map<String, List<Double>> collectStageSamples(List<EventTrace> traces) {
        Map<String, List<Double>> samples = new LinkedHashMap<>();
        for (EventTrace trace : traces) {
            for (Map.Entry<String, Double> e : trace.getStageLatencies().entrySet()) {
                samples.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).add(e.getValue());
            }
        }
        return samples;
    }

    private static String bottleneckOf(Map<String, StageStats> stats) {
        String bottleneck = NO_STAGE;
        double worst = -Double.MAX_VALUE;
        for (Map.Entry<String, StageStats> e : stats.entrySet()) {
            if (e.getValue().getMean() > worst) {
                worst = e.getValue().getMean();
                bottleneck = e.getKey();
            }
        }
        return bottleneck;
    }

    private static double[] sortedArray(List<Double> values) {
        double[] arr = new double[values.size()];
        for (int i = 0; i < arr.length; i++) arr[i] = values.get(i);
        Arrays.sort(arr);
        return arr;
    }

    private static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private static String ms(double seconds) {
        return String.format(Locale.ROOT, "%.2fms", seconds * 1000.0);
    }

    private static void line(StringBuilder sb, String s) {
        sb.append(s).append('\n');
    }
}
