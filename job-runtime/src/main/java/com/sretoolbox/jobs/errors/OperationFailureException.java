package com.sretoolbox.jobs.errors;

public class OperationFailureException extends JobRuntimeException {
    public OperationFailureException(String message) {
        super(message);
    }

    public OperationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
