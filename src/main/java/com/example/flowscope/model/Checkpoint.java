package com.example.flowscope.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One named instant in an event's journey. Immutable once recorded.
 */
public class Checkpoint {
    private final String name;
    private final double timestamp;     // epoch seconds
    private final Map<String, Object> metadata;
    private final long owner;           // recording thread id, diagnostics only

    public Checkpoint(String name, double timestamp, Map<String, Object> metadata, long owner) {
        this.name = name;
        this.timestamp = timestamp;
        this.metadata = (metadata == null || metadata.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.owner = owner;
    }

    public String getName() { return name; }
    public double getTimestamp() { return timestamp; }
    public Map<String, Object> getMetadata() { return metadata; }
    public long getOwner() { return owner; }
}
