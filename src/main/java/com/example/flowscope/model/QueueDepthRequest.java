package com.example.flowscope.model;

public class QueueDepthRequest {
    private int depth;

    public QueueDepthRequest() {}

    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }
}
