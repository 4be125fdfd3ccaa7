package com.example.flowscope.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables under {@code flowscope.*}. Defaults match a single local dashboard.
 */
@ConfigurationProperties(prefix = "flowscope")
public class FlowscopeProperties {

    private final Trace trace = new Trace();
    private final Sampler sampler = new Sampler();
    private final Dashboard dashboard = new Dashboard();

    public Trace getTrace() { return trace; }
    public Sampler getSampler() { return sampler; }
    public Dashboard getDashboard() { return dashboard; }

    public static class Trace {
        private int maxTraces = 10_000;
        // a checkpoint for an unknown id opens a trace of type "unknown" instead of failing
        private boolean autoCreateOnUnknownCheckpoint = true;
        private boolean recordStartCheckpoint = true;

        public int getMaxTraces() { return maxTraces; }
        public void setMaxTraces(int maxTraces) { this.maxTraces = maxTraces; }

        public boolean isAutoCreateOnUnknownCheckpoint() { return autoCreateOnUnknownCheckpoint; }
        public void setAutoCreateOnUnknownCheckpoint(boolean v) { this.autoCreateOnUnknownCheckpoint = v; }

        public boolean isRecordStartCheckpoint() { return recordStartCheckpoint; }
        public void setRecordStartCheckpoint(boolean recordStartCheckpoint) { this.recordStartCheckpoint = recordStartCheckpoint; }
    }

    public static class Sampler {
        private long intervalMs = 1000;
        private int historySize = 300;
        private int queueCapacity = 1000;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Dashboard {
        private long broadcastIntervalMs = 1000;
        private int sendTimeLimitMs = 5000;
        private int sendBufferLimitBytes = 512 * 1024;

        public long getBroadcastIntervalMs() { return broadcastIntervalMs; }
        public void setBroadcastIntervalMs(long broadcastIntervalMs) { this.broadcastIntervalMs = broadcastIntervalMs; }

        public int getSendTimeLimitMs() { return sendTimeLimitMs; }
        public void setSendTimeLimitMs(int sendTimeLimitMs) { this.sendTimeLimitMs = sendTimeLimitMs; }

        public int getSendBufferLimitBytes() { return sendBufferLimitBytes; }
        public void setSendBufferLimitBytes(int sendBufferLimitBytes) { this.sendBufferLimitBytes = sendBufferLimitBytes; }
    }
}
