package com.sretoolbox.jobs.errors;

public class JobRuntimeException extends RuntimeException {
    public JobRuntimeException(String message) {
        super(message);
    }

    public JobRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
