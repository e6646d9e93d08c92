package com.sretoolbox.store;

import com.sretoolbox.jobs.JobRecord;
import com.sretoolbox.jobs.JobStatus;

/**
 * Guards every compare-and-set against edges the job state machine does not have.
 * Violations are programming errors and fail fast; lost races are reported by the store, not here.
 */
public final class JobTransitions {
    private JobTransitions() {
    }

    public static void check(JobRecord expected, JobRecord updated) {
        if (!expected.getId().equals(updated.getId())) {
            throw new IllegalArgumentException("job id mismatch: " + expected.getId() + " vs " + updated.getId());
        }
        JobStatus from = expected.getStatus();
        JobStatus to = updated.getStatus();
        if (!from.canTransitionTo(to)) {
            throw new IllegalArgumentException("illegal transition " + from.wireName() + " -> " + to.wireName());
        }
        if (updated.getProgress() < 0 || updated.getProgress() > 100) {
            throw new IllegalArgumentException("progress out of range: " + updated.getProgress());
        }
        if (from == JobStatus.RUNNING && to == JobStatus.RUNNING && updated.getProgress() < expected.getProgress()) {
            throw new IllegalArgumentException("progress must not decrease: " + expected.getProgress() + " -> "
                    + updated.getProgress());
        }
        boolean hasResult = updated.getResult() != null && !updated.getResult().isNull();
        boolean hasError = updated.getError() != null;
        switch (to) {
            case SUCCEEDED -> {
                if (hasError) {
                    throw new IllegalArgumentException("succeeded job must not carry an error");
                }
            }
            case FAILED -> {
                if (!hasError || hasResult) {
                    throw new IllegalArgumentException("failed job needs an error and no result");
                }
            }
            default -> {
                if (hasResult || hasError) {
                    throw new IllegalArgumentException(to.wireName() + " job must not carry result or error");
                }
            }
        }
    }

    /** Short label for metrics and logs, e.g. {@code running->succeeded}. */
    public static String label(JobRecord expected, JobRecord updated) {
        return expected.getStatus().wireName() + "->" + updated.getStatus().wireName();
    }
}
