package com.sretoolbox.jobs.errors;

/**
 * A write lost its compare-and-set, usually against a state a reaper or a faster delivery already finalized.
 * Never surfaced to API callers.
 */
public class StaleWriteException extends JobRuntimeException {
    public StaleWriteException(String jobId, String attempted) {
        super("Stale write dropped for job " + jobId + ": " + attempted);
    }
}
