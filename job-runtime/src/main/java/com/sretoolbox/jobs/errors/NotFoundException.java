package com.sretoolbox.jobs.errors;

public class NotFoundException extends JobRuntimeException {
    public NotFoundException(String kind, String id) {
        super(kind + " " + id + " not found");
    }
}
