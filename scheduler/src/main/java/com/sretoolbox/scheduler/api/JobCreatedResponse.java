package com.sretoolbox.scheduler.api;

public class JobCreatedResponse {
    private String id;

    public JobCreatedResponse() {
    }

    public JobCreatedResponse(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }
}
