package com.example.flowscope.analysis;

import com.example.flowscope.model.EventTrace;

public class TraceAnomaly {
    private final String eventId;
    private final EventTrace trace;
    private final String stage;

    public TraceAnomaly(String eventId, EventTrace trace, String stage) {
        this.eventId = eventId;
        this.trace = trace;
        this.stage = stage;
    }

    public String getEventId() { return eventId; }
    public EventTrace getTrace() { return trace; }
    public String getStage() { return stage; }
}
