package com.example.flowscope.store;

public class TraceNotFoundException extends RuntimeException {

    private final String eventId;

    public TraceNotFoundException(String eventId) {
        super("trace not found: " + eventId);
        this.eventId = eventId;
    }

    public String getEventId() { return eventId; }
}
