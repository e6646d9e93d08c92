package com.sretoolbox.worker.engine;

import com.sretoolbox.jobs.errors.JobCancelledException;

public interface CancelSignal {

    boolean isCancelled();

    default void checkpoint() throws JobCancelledException {
        if (isCancelled()) {
            throw new JobCancelledException(jobId());
        }
    }

    String jobId();
}
