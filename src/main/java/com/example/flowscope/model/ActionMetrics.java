package com.example.flowscope.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"timestamp", "total_actions", "actions_per_minute", "avg_duration",
        "current_action", "queue_depth", "success_rate", "error_count"})
public class ActionMetrics {
    private final double timestamp;
    private final int totalActions;
    private final double actionsPerMinute;
    private final double avgDuration;
    private final String currentAction;     // null when idle
    private final int queueDepth;
    private final double successRate;       // percent, 100 when nothing ran in the last minute
    private final int errorCount;

    public ActionMetrics(double timestamp, int totalActions, double actionsPerMinute, double avgDuration,
                         String currentAction, int queueDepth, double successRate, int errorCount) {
        this.timestamp = timestamp;
        this.totalActions = totalActions;
        this.actionsPerMinute = actionsPerMinute;
        this.avgDuration = avgDuration;
        this.currentAction = currentAction;
        this.queueDepth = queueDepth;
        this.successRate = successRate;
        this.errorCount = errorCount;
    }

    @JsonProperty("timestamp") public double getTimestamp() { return timestamp; }
    @JsonProperty("total_actions") public int getTotalActions() { return totalActions; }
    @JsonProperty("actions_per_minute") public double getActionsPerMinute() { return actionsPerMinute; }
    @JsonProperty("avg_duration") public double getAvgDuration() { return avgDuration; }
    @JsonProperty("current_action") public String getCurrentAction() { return currentAction; }
    @JsonProperty("queue_depth") public int getQueueDepth() { return queueDepth; }
    @JsonProperty("success_rate") public double getSuccessRate() { return successRate; }
    @JsonProperty("error_count") public int getErrorCount() { return errorCount; }
}
