package com.example.flowscope.ws;

import com.example.flowscope.sampler.MetricsSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Lifecycle of the live dashboard.
 * <p>
 * Starts in a phase below the embedded web server, so the sampler and broadcast loop run
 * before the listening socket opens. Stops on {@link ContextClosedEvent}, which Spring
 * publishes before any lifecycle bean stops, so the broadcast loop is cancelled, clients
 * closed and the sampler stopped while the socket is still held; the web server releases
 * it afterwards.
 */
@Component
public class DashboardServer implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(DashboardServer.class);

    // embedded web server start/stop runs at Integer.MAX_VALUE - 1
    private static final int PHASE = Integer.MAX_VALUE - 2;

    private final MetricsSampler sampler;
    private final DashboardLiveHub hub;
    private volatile boolean running;

    public DashboardServer(MetricsSampler sampler, DashboardLiveHub hub) {
        this.sampler = sampler;
        this.hub = hub;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        sampler.start();
        hub.startBroadcast();
        running = true;
        log.info("Dashboard server started");
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        hub.stopBroadcast();
        hub.closeAll();
        sampler.stop();
        running = false;
        log.info("Dashboard server stopped");
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
