package com.example.flowscope.model;

import java.util.Map;

public class CheckpointRequest {
    private String name;    // e.g. "frontend_emit"
    private Map<String, Object> metadata;

    public CheckpointRequest() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
}
