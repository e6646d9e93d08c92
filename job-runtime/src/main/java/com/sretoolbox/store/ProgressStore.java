package com.sretoolbox.store;

import com.sretoolbox.jobs.JobRecord;
import com.sretoolbox.jobs.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Shared job state visible to submitters, workers and the reaper.
 * <p>
 * Versioned fields (status, progress, result, error, worker id, updated_at) only change through
 * {@link #compareAndSet}. Log lines are append-only and the cancellation flag is set-only; neither
 * bumps the version. Implementations throw {@link com.sretoolbox.jobs.errors.ProgressStoreException}
 * when the backing store is unreachable.
 */
public interface ProgressStore extends AutoCloseable {

    /** Inserts a new record; fails with IllegalStateException if the id is already taken. */
    void create(JobRecord record);

    /** Current snapshot including the newest log lines, or empty for unknown/expired ids. */
    Optional<JobRecord> get(String jobId);

    /**
     * Applies {@code updated} iff the stored record still has {@code expected}'s status and version.
     *
     * @return the stored record with its new version when applied; empty when another writer won
     */
    Optional<JobRecord> compareAndSet(JobRecord expected, JobRecord updated);

    void appendLog(String jobId, String message);

    /** Sets the cancellation flag. Returns false for unknown ids. */
    boolean requestCancel(String jobId);

    boolean isCancelRequested(String jobId);

    /** Newest first; returned records carry no log lines. */
    JobPage list(JobFilter filter);

    List<JobRecord> findByStatus(JobStatus status);

    /**
     * Restores status lookups lost to a partially applied write. Stores without a separate index have nothing
     * to do.
     *
     * @return number of records whose lookup was restored
     */
    default int reconcileIndex() {
        return 0;
    }

    /** Retention only. */
    boolean delete(String jobId);

    boolean isHealthy();

    @Override
    default void close() {
    }
}
