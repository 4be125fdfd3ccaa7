package com.example.flowscope.model;

public class ActionRecordRequest {
    private String name;
    private double durationSec;
    private boolean success = true;

    public ActionRecordRequest() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public double getDurationSec() { return durationSec; }
    public void setDurationSec(double durationSec) { this.durationSec = durationSec; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }
}
