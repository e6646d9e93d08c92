package com.sretoolbox.scheduler.api;

/**
 * Returned for every accepted cancel call, whatever the job's state; the transition itself happens on the worker.
 */
public class CancelResponse {
    public static final String CANCEL_REQUESTED = "cancel_requested";

    private String id;
    private String status;

    public CancelResponse() {
    }

    public CancelResponse(String id) {
        this.id = id;
        this.status = CANCEL_REQUESTED;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
