package com.example.flowscope.store;

import com.example.flowscope.analysis.LatencyAnalyzer;
import com.example.flowscope.model.EventFlow;
import com.example.flowscope.model.EventTrace;
import com.example.flowscope.util.EpochSeconds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Bounded, thread-safe registry of in-flight and completed event traces.
 * <p>
 * A single lock guards the map and every trace inside it. Callers only ever receive
 * copies, so analysis over a snapshot cannot race a concurrent checkpoint.
 * When full, the trace with the oldest {@code createdAt} is evicted before a new one is admitted.
 */
public class TraceStore {
    private static final Logger log = LoggerFactory.getLogger(TraceStore.class);

    public static final String START_CHECKPOINT = "trace_start";
    public static final String UNKNOWN_TYPE = "unknown";
    private static final int BYTES_PER_CHECKPOINT_ESTIMATE = 100;

    private final Object lock = new Object();
    private final Map<String, EventTrace> traces = new HashMap<>();
    private final int maxTraces;
    private final boolean autoCreateOnUnknownCheckpoint;
    private final boolean recordStartCheckpoint;
    private final Clock clock;
    private long evictedTraces;

    public TraceStore(int maxTraces, boolean autoCreateOnUnknownCheckpoint, boolean recordStartCheckpoint, Clock clock) {
        if (maxTraces < 1) {
            throw new IllegalArgumentException("maxTraces must be >= 1, was " + maxTraces);
        }
        this.maxTraces = maxTraces;
        this.autoCreateOnUnknownCheckpoint = autoCreateOnUnknownCheckpoint;
        this.recordStartCheckpoint = recordStartCheckpoint;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EventTrace startTrace(String eventId, String eventType) {
        return startTrace(eventId, eventType, null);
    }

    public EventTrace startTrace(String eventId, String eventType, Map<String, Object> metadata) {
        requireId(eventId);
        synchronized (lock) {
            return startLocked(eventId, eventType, metadata).copy();
        }
    }

    public void checkpoint(String eventId, String name) {
        checkpoint(eventId, name, null);
    }

    /**
     * Appends a checkpoint stamped with the current time. An unknown id either opens a
     * trace of type {@value #UNKNOWN_TYPE} or fails, depending on the auto-create policy.
     *
     * @throws TraceNotFoundException if the id is unknown and auto-creation is disabled
     */
    public void checkpoint(String eventId, String name, Map<String, Object> metadata) {
        requireId(eventId);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("checkpoint name is required");
        }
        synchronized (lock) {
            EventTrace trace = traces.get(eventId);
            if (trace == null) {
                if (!autoCreateOnUnknownCheckpoint) {
                    throw new TraceNotFoundException(eventId);
                }
                log.debug("checkpoint for unknown trace, auto-creating. eventId={} checkpoint={}", eventId, name);
                trace = startLocked(eventId, UNKNOWN_TYPE, null);
            }
            trace.addCheckpoint(name, EpochSeconds.now(clock), metadata, Thread.currentThread().getId());
        }
    }

    /**
     * @throws TraceNotFoundException if no live trace has this id
     */
    public EventTrace completeTrace(String eventId) {
        synchronized (lock) {
            EventTrace trace = traces.get(eventId);
            if (trace == null) {
                throw new TraceNotFoundException(eventId);
            }
            trace.complete(EpochSeconds.now(clock));
            return trace.copy();
        }
    }

    public Optional<EventTrace> getTrace(String eventId) {
        synchronized (lock) {
            EventTrace trace = traces.get(eventId);
            return trace == null ? Optional.empty() : Optional.of(trace.copy());
        }
    }

    public List<EventTrace> getAllTraces() {
        synchronized (lock) {
            List<EventTrace> copied = new ArrayList<>(traces.size());
            for (EventTrace t : traces.values()) {
                copied.add(t.copy());
            }
            copied.sort(Comparator.comparingDouble(EventTrace::getCreatedAt));
            return copied;
        }
    }

    /**
     * Traces still open after {@code timeoutSeconds}. Reporting only, nothing is removed.
     */
    public List<EventTrace> findLostEvents(double timeoutSeconds) {
        synchronized (lock) {
            double now = EpochSeconds.now(clock);
            List<EventTrace> lost = new ArrayList<>();
            for (EventTrace t : traces.values()) {
                if (!t.isCompleted() && now - t.getCreatedAt() > timeoutSeconds) {
                    lost.add(t.copy());
                }
            }
            lost.sort(Comparator.comparingDouble(EventTrace::getCreatedAt));
            return lost;
        }
    }

    public EventFlow analyzeFlow() {
        return LatencyAnalyzer.analyzeFlow(getAllTraces());
    }

    public int size() {
        synchronized (lock) {
            return traces.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            int n = traces.size();
            traces.clear();
            log.info("Trace store cleared. dropped={}", n);
        }
    }

    public Map<String, Object> getStatistics() {
        synchronized (lock) {
            long checkpoints = 0;
            for (EventTrace t : traces.values()) {
                checkpoints += t.getCheckpoints().size();
            }
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("total_traces", traces.size());
            stats.put("max_traces", maxTraces);
            stats.put("record_start_checkpoint", recordStartCheckpoint);
            stats.put("auto_create_on_unknown_checkpoint", autoCreateOnUnknownCheckpoint);
            stats.put("evicted_traces", evictedTraces);
            stats.put("memory_usage_bytes", checkpoints * BYTES_PER_CHECKPOINT_ESTIMATE);
            return stats;
        }
    }

    public int getMaxTraces() { return maxTraces; }

    private EventTrace startLocked(String eventId, String eventType, Map<String, Object> metadata) {
        if (!traces.containsKey(eventId) && traces.size() >= maxTraces) {
            evictOldestLocked();
        }
        double now = EpochSeconds.now(clock);
        EventTrace trace = new EventTrace(eventId, eventType == null ? UNKNOWN_TYPE : eventType, now);
        EventTrace replaced = traces.put(eventId, trace);
        if (replaced != null) {
            log.debug("trace restarted, previous trace replaced. eventId={}", eventId);
        }
        if (recordStartCheckpoint) {
            trace.addCheckpoint(START_CHECKPOINT, now, metadata, Thread.currentThread().getId());
        }
        return trace;
    }

    private void evictOldestLocked() {
        // linear scan; capacity is small enough that an ordered index is not worth its upkeep
        String oldestId = null;
        double oldest = Double.MAX_VALUE;
        for (EventTrace t : traces.values()) {
            if (t.getCreatedAt() < oldest) {
                oldest = t.getCreatedAt();
                oldestId = t.getEventId();
            }
        }
        if (oldestId != null) {
            traces.remove(oldestId);
            evictedTraces++;
            log.debug("trace store at capacity, evicted oldest. eventId={} capacity={}", oldestId, maxTraces);
        }
    }

    private static void requireId(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId is required");
        }
    }
}
