package com.example.flowscope.sampler;

import com.example.flowscope.model.ActionMetrics;
import com.example.flowscope.model.ActionRecord;
import com.example.flowscope.model.EventMetrics;
import com.example.flowscope.model.MetricsSnapshot;
import com.example.flowscope.model.SystemMetrics;
import com.example.flowscope.util.EpochSeconds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Samples process resources plus the action and event rolling windows into a
 * {@link MetricsSnapshot}, on demand and, once started, on a fixed interval.
 * <p>
 * Each periodic sample is published into a bounded hand-off queue that drops the
 * oldest entry when full. The action window and the event window have separate locks
 * so producers of one never wait on the other. A failed sample is logged and the
 * loop carries on at the next tick.
 */
public class MetricsSampler {
    private static final Logger log = LoggerFactory.getLogger(MetricsSampler.class);

    private static final double ACTION_RATE_WINDOW_SEC = 60.0;
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final ProcessResourceProbe probe;
    private final Clock clock;
    private final long intervalMs;
    private final int historySize;
    private final BlockingQueue<MetricsSnapshot> queue;
    private final AtomicLong droppedSnapshots = new AtomicLong();

    private final Object actionLock = new Object();
    private final Deque<ActionRecord> actionHistory = new ArrayDeque<>();
    private String currentAction;
    private int actionQueueDepth;

    private final Object eventLock = new Object();
    private final Deque<Double> eventDurations = new ArrayDeque<>();
    private long eventsQueued;
    private long eventsProcessed;
    private long eventsFailed;
    private int eventQueueDepth;

    private volatile double lastCpuPercent;
    private volatile MetricsSnapshot latestSnapshot;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> scheduledTask;
    private volatile CountDownLatch currentTaskLatch;

    public MetricsSampler(ProcessResourceProbe probe, Clock clock, long intervalMs, int historySize, int queueCapacity) {
        if (intervalMs < 1) throw new IllegalArgumentException("intervalMs must be >= 1, was " + intervalMs);
        if (historySize < 1) throw new IllegalArgumentException("historySize must be >= 1, was " + historySize);
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1, was " + queueCapacity);
        this.probe = Objects.requireNonNull(probe, "probe");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.intervalMs = intervalMs;
        this.historySize = historySize;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    public synchronized void start() {
        if (running.get()) {
            log.warn("MetricsSampler already running");
            return;
        }
        running.set(true);
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-sampler");
            t.setDaemon(true);
            return t;
        });
        scheduledTask = scheduler.scheduleAtFixedRate(this::sampleAndPublish, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Started MetricsSampler with interval: {}ms", intervalMs);
    }

    public synchronized void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }

        CountDownLatch latch = currentTaskLatch;
        if (latch != null) {
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for in-flight sample to finish");
            }
        }
        scheduler.shutdownNow();
        scheduler = null;
        scheduledTask = null;
        log.info("Stopped MetricsSampler");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Samples everything now. Never throws for an unavailable resource reading.
     */
    public MetricsSnapshot getLatestMetrics() {
        return new MetricsSnapshot(collectSystemMetrics(), collectActionMetrics(), collectEventMetrics());
    }

    /**
     * The snapshot produced by the most recent periodic sample, if any.
     */
    public Optional<MetricsSnapshot> getLastPublished() {
        return Optional.ofNullable(latestSnapshot);
    }

    public SystemMetrics collectSystemMetrics() {
        double cpu = lastCpuPercent;
        try {
            double reading = probe.cpuPercent();
            if (reading >= 0) {
                cpu = reading;
                lastCpuPercent = reading;
            }
        } catch (RuntimeException e) {
            log.debug("cpu reading unavailable, using last known value: {}", e.toString());
        }

        long memoryMb = 0L;
        double memoryPercent = 0.0;
        try {
            long rss = probe.residentMemoryBytes();
            long total = probe.totalMemoryBytes();
            memoryMb = rss / BYTES_PER_MB;
            memoryPercent = total > 0 ? rss * 100.0 / total : 0.0;
        } catch (RuntimeException e) {
            log.debug("memory reading unavailable: {}", e.toString());
        }

        int threads = 0;
        try {
            threads = probe.threadCount();
        } catch (RuntimeException e) {
            log.debug("thread count unavailable: {}", e.toString());
        }

        int processes = 1;
        try {
            processes = probe.processCount();
        } catch (RuntimeException e) {
            log.debug("process count unavailable: {}", e.toString());
        }

        return new SystemMetrics(EpochSeconds.now(clock), cpu, memoryMb, memoryPercent, threads, processes);
    }

    public ActionMetrics collectActionMetrics() {
        synchronized (actionLock) {
            double now = EpochSeconds.now(clock);
            double windowStart = now - ACTION_RATE_WINDOW_SEC;

            int recent = 0;
            int recentSuccesses = 0;
            double recentDuration = 0.0;
            int errors = 0;
            for (ActionRecord a : actionHistory) {
                if (!a.isSuccess()) errors++;
                if (a.getTimestamp() >= windowStart) {
                    recent++;
                    recentDuration += a.getDuration();
                    if (a.isSuccess()) recentSuccesses++;
                }
            }

            double avgDuration = recent > 0 ? recentDuration / recent : 0.0;
            double successRate = recent > 0 ? recentSuccesses * 100.0 / recent : 100.0;

            return new ActionMetrics(now, actionHistory.size(), recent, avgDuration,
                    currentAction, actionQueueDepth, successRate, errors);
        }
    }

    public EventMetrics collectEventMetrics() {
        synchronized (eventLock) {
            double avg = 0.0;
            if (!eventDurations.isEmpty()) {
                double sum = 0.0;
                for (double d : eventDurations) sum += d;
                avg = sum / eventDurations.size();
            }
            return new EventMetrics(EpochSeconds.now(clock), eventsQueued, eventsProcessed, eventsFailed,
                    avg, eventQueueDepth);
        }
    }

    public void recordAction(String name, double durationSec, boolean success) {
        synchronized (actionLock) {
            if (actionHistory.size() >= historySize) {
                actionHistory.pollFirst();
            }
            actionHistory.addLast(new ActionRecord(EpochSeconds.now(clock), name, durationSec, success));
        }
    }

    public void setCurrentAction(String name) {
        synchronized (actionLock) {
            currentAction = name;
        }
    }

    public void setActionQueueDepth(int depth) {
        synchronized (actionLock) {
            actionQueueDepth = depth;
        }
    }

    public void recordEvent(double processingTimeSec, boolean success) {
        synchronized (eventLock) {
            eventsQueued++;
            if (success) {
                eventsProcessed++;
                if (eventDurations.size() >= historySize) {
                    eventDurations.pollFirst();
                }
                eventDurations.addLast(processingTimeSec);
            } else {
                eventsFailed++;
            }
        }
    }

    public void setEventQueueDepth(int depth) {
        synchronized (eventLock) {
            eventQueueDepth = depth;
        }
    }

    /**
     * Takes the oldest queued snapshot, waiting up to {@code timeout}.
     */
    public Optional<MetricsSnapshot> pollMetrics(Duration timeout) {
        try {
            return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    public int queuedCount() {
        return queue.size();
    }

    public long getDroppedSnapshots() {
        return droppedSnapshots.get();
    }

    /**
     * Enqueues without blocking; a full queue gives up its oldest entry.
     */
    void publish(MetricsSnapshot snapshot) {
        while (!queue.offer(snapshot)) {
            if (queue.poll() != null) {
                droppedSnapshots.incrementAndGet();
            }
        }
    }

    private void sampleAndPublish() {
        if (!running.get()) {
            return;
        }
        CountDownLatch latch = new CountDownLatch(1);
        currentTaskLatch = latch;
        try {
            MetricsSnapshot snapshot = getLatestMetrics();
            latestSnapshot = snapshot;
            publish(snapshot);
            log.debug("Published metrics sample. queued={}", queue.size());
        } catch (Exception e) {
            if (running.get()) {
                log.error("Failed to collect metrics sample", e);
            }
        } finally {
            latch.countDown();
        }
    }
}
