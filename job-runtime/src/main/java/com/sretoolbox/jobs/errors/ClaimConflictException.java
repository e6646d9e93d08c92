package com.sretoolbox.jobs.errors;

import com.sretoolbox.jobs.JobStatus;

/**
 * Another worker won the queued to running compare-and-set. Benign: the loser moves on to the next descriptor.
 */
public class ClaimConflictException extends JobRuntimeException {
    private final String jobId;

    public ClaimConflictException(String jobId, JobStatus observed) {
        super("Job " + jobId + " could not be claimed (status " + (observed == null ? "unknown" : observed.wireName()) + ")");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
