package com.sretoolbox.jobs.errors;

/**
 * Raised at a cancellation checkpoint once the job's cancellation flag is observed. Operations let it
 * propagate; the engine turns it into a {@code cancelled} record.
 */
public class JobCancelledException extends Exception {
    public JobCancelledException(String jobId) {
        super("Job " + jobId + " cancelled");
    }
}
