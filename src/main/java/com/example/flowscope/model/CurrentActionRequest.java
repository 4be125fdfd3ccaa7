package com.example.flowscope.model;

public class CurrentActionRequest {
    private String name;    // null clears

    public CurrentActionRequest() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
