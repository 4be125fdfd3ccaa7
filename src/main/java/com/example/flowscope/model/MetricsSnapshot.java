package com.example.flowscope.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One sampler reading. Serialized as-is onto the dashboard socket, so the JSON
 * field names here are the wire contract.
 */
@JsonPropertyOrder({"system", "actions", "events"})
public class MetricsSnapshot {
    private final SystemMetrics system;
    private final ActionMetrics actions;
    private final EventMetrics events;

    public MetricsSnapshot(SystemMetrics system, ActionMetrics actions, EventMetrics events) {
        this.system = system;
        this.actions = actions;
        this.events = events;
    }

    @JsonProperty("system") public SystemMetrics getSystem() { return system; }
    @JsonProperty("actions") public ActionMetrics getActions() { return actions; }
    @JsonProperty("events") public EventMetrics getEvents() { return events; }
}
