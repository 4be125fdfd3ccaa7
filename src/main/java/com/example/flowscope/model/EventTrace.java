package com.example.flowscope.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trace of a single event through the system.
 * <p>
 * Instances held by the trace store are mutated only under the store's lock.
 * Everything handed to callers is a {@link #copy()}.
 */
public class EventTrace {
    private final String eventId;
    private final String eventType;
    private final double createdAt;
    private final List<Checkpoint> checkpoints;
    private boolean completed;
    private double totalLatency;

    public EventTrace(String eventId, String eventType, double createdAt) {
        this(eventId, eventType, createdAt, new ArrayList<>(), false, 0.0);
    }

    private EventTrace(String eventId, String eventType, double createdAt,
                       List<Checkpoint> checkpoints, boolean completed, double totalLatency) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.createdAt = createdAt;
        this.checkpoints = checkpoints;
        this.completed = completed;
        this.totalLatency = totalLatency;
    }

    public String getEventId() { return eventId; }
    public String getEventType() { return eventType; }
    public double getCreatedAt() { return createdAt; }
    public List<Checkpoint> getCheckpoints() { return Collections.unmodifiableList(checkpoints); }
    public boolean isCompleted() { return completed; }
    public double getTotalLatency() { return totalLatency; }

    /**
     * Appends a checkpoint. Timestamps never go backwards within a trace: a reading
     * older than the last checkpoint is pinned to the last checkpoint's time.
     */
    public Checkpoint addCheckpoint(String name, double timestamp, Map<String, Object> metadata, long owner) {
        double ts = timestamp;
        if (!checkpoints.isEmpty()) {
            ts = Math.max(ts, checkpoints.get(checkpoints.size() - 1).getTimestamp());
        }
        Checkpoint checkpoint = new Checkpoint(name, ts, metadata, owner);
        checkpoints.add(checkpoint);
        if (checkpoints.size() > 1) {
            totalLatency = Math.max(0.0, ts - checkpoints.get(0).getTimestamp());
        }
        return checkpoint;
    }

    /**
     * Marks the trace completed and finalizes the total latency against {@code now}.
     * Completing twice keeps the first result.
     */
    public void complete(double now) {
        if (completed) return;
        completed = true;
        if (!checkpoints.isEmpty()) {
            totalLatency = Math.max(0.0, now - checkpoints.get(0).getTimestamp());
        }
    }

    /**
     * Latency between two named checkpoints, using the last occurrence of each name.
     *
     * @throws IllegalArgumentException if either checkpoint is missing or {@code to} does not follow {@code from}
     */
    public double getLatency(String from, String to) {
        int fromIdx = -1;
        int toIdx = -1;
        for (int i = 0; i < checkpoints.size(); i++) {
            String n = checkpoints.get(i).getName();
            if (n.equals(from)) fromIdx = i;
            if (n.equals(to)) toIdx = i;
        }
        if (fromIdx < 0) throw new IllegalArgumentException("checkpoint not found: " + from);
        if (toIdx < 0) throw new IllegalArgumentException("checkpoint not found: " + to);
        if (toIdx <= fromIdx) throw new IllegalArgumentException("'" + to + "' must come after '" + from + "'");
        return checkpoints.get(toIdx).getTimestamp() - checkpoints.get(fromIdx).getTimestamp();
    }

    /**
     * Gaps between consecutive checkpoints keyed as {@code "a -> b"}, in checkpoint order.
     * A stage that repeats within one trace keeps its last gap.
     */
    public Map<String, Double> getStageLatencies() {
        Map<String, Double> stages = new LinkedHashMap<>();
        for (int i = 0; i + 1 < checkpoints.size(); i++) {
            Checkpoint a = checkpoints.get(i);
            Checkpoint b = checkpoints.get(i + 1);
            stages.put(stageName(a.getName(), b.getName()), b.getTimestamp() - a.getTimestamp());
        }
        return stages;
    }

    public EventTrace copy() {
        return new EventTrace(eventId, eventType, createdAt, new ArrayList<>(checkpoints), completed, totalLatency);
    }

    public static String stageName(String from, String to) {
        return from + " -> " + to;
    }
}
