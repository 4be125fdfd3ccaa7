package com.example.flowscope.model;

public class ActionRecord {
    private final double timestamp;
    private final String name;
    private final double duration;
    private final boolean success;

    public ActionRecord(double timestamp, String name, double duration, boolean success) {
        this.timestamp = timestamp;
        this.name = name;
        this.duration = duration;
        this.success = success;
    }

    public double getTimestamp() { return timestamp; }
    public String getName() { return name; }
    public double getDuration() { return duration; }
    public boolean isSuccess() { return success; }
}
