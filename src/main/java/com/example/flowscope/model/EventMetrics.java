package com.example.flowscope.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"timestamp", "events_queued", "events_processed", "events_failed",
        "avg_processing_time", "queue_depth"})
public class EventMetrics {
    private final double timestamp;
    private final long eventsQueued;
    private final long eventsProcessed;
    private final long eventsFailed;
    private final double avgProcessingTime;
    private final int queueDepth;

    public EventMetrics(double timestamp, long eventsQueued, long eventsProcessed, long eventsFailed,
                        double avgProcessingTime, int queueDepth) {
        this.timestamp = timestamp;
        this.eventsQueued = eventsQueued;
        this.eventsProcessed = eventsProcessed;
        this.eventsFailed = eventsFailed;
        this.avgProcessingTime = avgProcessingTime;
        this.queueDepth = queueDepth;
    }

    @JsonProperty("timestamp") public double getTimestamp() { return timestamp; }
    @JsonProperty("events_queued") public long getEventsQueued() { return eventsQueued; }
    @JsonProperty("events_processed") public long getEventsProcessed() { return eventsProcessed; }
    @JsonProperty("events_failed") public long getEventsFailed() { return eventsFailed; }
    @JsonProperty("avg_processing_time") public double getAvgProcessingTime() { return avgProcessingTime; }
    @JsonProperty("queue_depth") public int getQueueDepth() { return queueDepth; }
}
