package com.sretoolbox.jobs.errors;

/**
 * Infrastructure failure talking to the progress store (unreachable, timed out). Retryable.
 */
public class ProgressStoreException extends JobRuntimeException {
    public ProgressStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
