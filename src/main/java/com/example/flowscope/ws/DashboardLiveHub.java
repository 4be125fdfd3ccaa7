package com.example.flowscope.ws;

import com.example.flowscope.config.FlowscopeProperties;
import com.example.flowscope.model.MetricsSnapshot;
import com.example.flowscope.sampler.MetricsSampler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of connected dashboard clients and the once-per-tick broadcast loop.
 * <p>
 * Every registered session is wrapped in a {@link ConcurrentWebSocketSessionDecorator},
 * which serializes sends from the broadcast thread and the handler threads and bounds
 * each client by a send time limit and buffer size. A client whose send fails is dropped
 * and the tick carries on with the rest.
 */
@Component
public class DashboardLiveHub {
    private static final Logger log = LoggerFactory.getLogger(DashboardLiveHub.class);

    private final Map<String, WebSocketSession> clients = new ConcurrentHashMap<>();
    private final MetricsSampler sampler;
    private final ObjectMapper om = new ObjectMapper();
    private final long broadcastIntervalMs;
    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;

    private ScheduledExecutorService broadcaster;
    private ScheduledFuture<?> broadcastTask;

    public DashboardLiveHub(MetricsSampler sampler, FlowscopeProperties properties) {
        FlowscopeProperties.Dashboard d = properties.getDashboard();
        if (d.getBroadcastIntervalMs() < 1) {
            throw new IllegalArgumentException("broadcastIntervalMs must be >= 1, was " + d.getBroadcastIntervalMs());
        }
        this.sampler = sampler;
        this.broadcastIntervalMs = d.getBroadcastIntervalMs();
        this.sendTimeLimitMs = d.getSendTimeLimitMs();
        this.sendBufferLimitBytes = d.getSendBufferLimitBytes();
    }

    public void add(WebSocketSession session) {
        clients.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferLimitBytes));
    }

    public void remove(String sessionId) {
        clients.remove(sessionId);
    }

    public int clientCount() {
        return clients.size();
    }

    public boolean isRegistered(String sessionId) {
        return clients.containsKey(sessionId);
    }

    /**
     * Samples now and sends the result to one client. Used on connect and on request,
     * so a viewer never waits for the next tick.
     */
    public boolean pushLatest(String sessionId) {
        try {
            return sendTo(sessionId, om.writeValueAsString(sampler.getLatestMetrics()));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize metrics snapshot", e);
            return false;
        }
    }

    /**
     * Sends raw JSON to one client. A failed send unregisters that client.
     */
    public boolean sendTo(String sessionId, String json) {
        WebSocketSession s = clients.get(sessionId);
        if (s == null) return false;
        return deliver(s, new TextMessage(json));
    }

    /**
     * One broadcast tick: every registered client gets the same snapshot.
     *
     * @return number of clients the snapshot was delivered to
     */
    public int broadcastOnce() {
        if (clients.isEmpty()) return 0;

        MetricsSnapshot snapshot = sampler.getLastPublished().orElseGet(sampler::getLatestMetrics);
        TextMessage msg;
        try {
            msg = new TextMessage(om.writeValueAsString(snapshot));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize metrics snapshot", e);
            return 0;
        }

        int delivered = 0;
        for (WebSocketSession s : new ArrayList<>(clients.values())) {
            if (deliver(s, msg)) delivered++;
        }
        return delivered;
    }

    public synchronized void startBroadcast() {
        if (broadcastTask != null) return;
        broadcaster = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dashboard-broadcast");
            t.setDaemon(true);
            return t;
        });
        broadcastTask = broadcaster.scheduleAtFixedRate(this::tick, broadcastIntervalMs, broadcastIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Dashboard broadcast started. intervalMs={}", broadcastIntervalMs);
    }

    public synchronized void stopBroadcast() {
        if (broadcastTask == null) return;
        broadcastTask.cancel(false);
        broadcaster.shutdown();
        try {
            if (!broadcaster.awaitTermination(5, TimeUnit.SECONDS)) {
                broadcaster.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            broadcaster.shutdownNow();
        }
        broadcastTask = null;
        broadcaster = null;
        log.info("Dashboard broadcast stopped");
    }

    public void closeAll() {
        List<WebSocketSession> open = new ArrayList<>(clients.values());
        clients.clear();
        for (WebSocketSession s : open) {
            try {
                s.close(CloseStatus.GOING_AWAY);
            } catch (Exception e) {
                log.debug("close failed. sessionId={} err={}", s.getId(), e.toString());
            }
        }
        log.info("Closed {} dashboard client(s)", open.size());
    }

    private void tick() {
        try {
            int delivered = broadcastOnce();
            log.debug("broadcast tick delivered={} clients={}", delivered, clients.size());
        } catch (Exception e) {
            // keep the schedule alive; a thrown exception would cancel it
            log.error("Error in broadcast loop", e);
        }
    }

    private boolean deliver(WebSocketSession s, TextMessage msg) {
        try {
            if (!s.isOpen()) {
                drop(s, "closed");
                return false;
            }
            s.sendMessage(msg);
            return true;
        } catch (Exception e) {
            drop(s, e.toString());
            return false;
        }
    }

    private void drop(WebSocketSession s, String reason) {
        if (clients.remove(s.getId()) != null) {
            log.info("Dashboard client dropped. sessionId={} reason={} total={}", s.getId(), reason, clients.size());
        }
        try {
            if (s.isOpen()) s.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (Exception e) {
            log.debug("close after failed send also failed. sessionId={} err={}", s.getId(), e.toString());
        }
    }
}
