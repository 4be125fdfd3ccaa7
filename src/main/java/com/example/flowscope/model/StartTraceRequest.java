package com.example.flowscope.model;

import java.util.Map;

public class StartTraceRequest {
    private String eventId;
    private String eventType;   // e.g. "click", "keypress"
    private Map<String, Object> metadata;   // optional

    public StartTraceRequest() {}

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
}
