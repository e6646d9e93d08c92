package com.sretoolbox.worker.engine;

import com.sretoolbox.jobs.errors.JobCancelledException;

/**
 * Progress callback handed to a running operation. Each {@link #report} is a cancellation checkpoint, so the
 * cancellation observation latency equals the reporting interval: call it at least every 2 seconds or every
 * 5% of progress, whichever comes first.
 */
public interface ProgressReporter {

    /**
     * Records {@code percent} (clamped to 0..100 and never below the last reported value) together with a log
     * line, then checks the cancellation flag.
     */
    void report(int percent, String message) throws JobCancelledException;

    /** Appends a log line without touching progress. */
    void log(String message);
}
