package com.sretoolbox.jobs.errors;

public class QueueUnavailableException extends JobRuntimeException {
    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
