package com.sretoolbox.worker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.sretoolbox.jobs.JobDescriptor;

/**
 * One toolkit capability, registered under {@link #name()} and resolved by the job's {@code operation}.
 * <p>
 * Implementations read their input from {@link JobDescriptor#getPayload()}, call
 * {@link ProgressReporter#report} at bounded intervals and return the success payload. Throwing marks the job
 * failed with the exception message; a {@link com.sretoolbox.jobs.errors.JobCancelledException} raised from a
 * checkpoint marks it cancelled.
 */
public interface ToolkitOperation {

    String name();

    JsonNode execute(JobDescriptor job, ProgressReporter progress, CancelSignal cancel) throws Exception;
}
