package com.example.flowscope.model;

public class EventRecordRequest {
    private double processingTimeSec;
    private boolean success = true;

    public EventRecordRequest() {}

    public double getProcessingTimeSec() { return processingTimeSec; }
    public void setProcessingTimeSec(double processingTimeSec) { this.processingTimeSec = processingTimeSec; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }
}
