package com.sretoolbox.store;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.JobLogEntry;
import com.sretoolbox.jobs.JobRecord;
import com.sretoolbox.jobs.JobStatus;
import com.sretoolbox.jobs.errors.ProgressStoreException;
import com.sretoolbox.metrics.StoreMetrics;
import com.sretoolbox.support.Json;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Progress store on Cassandra. Every compare-and-set is a lightweight transaction (Paxos) conditioned
 * on {@code status} and {@code version}; results are checked via {@code [applied]}.
 * <p>
 * {@code jobs_by_status} is a secondary index maintained after each applied status change. It can lag
 * the {@code jobs} row, so every read through it re-checks the row, and {@link #reconcileIndex()} restores
 * entries lost to a failed index write. The session is owned by the caller.
 */
@Slf4j
public class CassandraProgressStore implements ProgressStore {
    private final CqlSession session;
    private final ObjectMapper mapper;
    private final StoreMetrics metrics;
    private final Clock clock;
    private final int maxLogLines;

    private final PreparedStatement insertJobStmt;
    private final PreparedStatement selectJobStmt;
    private final PreparedStatement casJobStmt;
    private final PreparedStatement cancelJobStmt;
    private final PreparedStatement selectCancelStmt;
    private final PreparedStatement deleteJobStmt;
    private final PreparedStatement insertLogStmt;
    private final PreparedStatement selectLogsStmt;
    private final PreparedStatement deleteLogsStmt;
    private final PreparedStatement insertIndexStmt;
    private final PreparedStatement deleteIndexStmt;
    private final PreparedStatement selectIndexStmt;
    private final PreparedStatement selectIndexEntryStmt;
    private final PreparedStatement scanJobsStmt;

    public CassandraProgressStore(CqlSession session, ObjectMapper mapper, int maxLogLines, Clock clock,
            StoreMetrics metrics) {
        this.session = session;
        this.mapper = mapper;
        this.maxLogLines = maxLogLines;
        this.clock = clock;
        this.metrics = metrics == null ? StoreMetrics.noop() : metrics;

        this.insertJobStmt = session.prepare(
                "INSERT INTO jobs (job_id, status, progress, operation, toolkit, type, payload, cancel_requested, "
                        + "version, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?) IF NOT EXISTS");
        this.selectJobStmt = session.prepare(
                "SELECT job_id, status, progress, operation, toolkit, type, payload, result, error, cancel_requested, "
                        + "worker_id, version, created_at, updated_at FROM jobs WHERE job_id = ?");
        this.casJobStmt = session.prepare(
                "UPDATE jobs SET status = ?, progress = ?, result = ?, error = ?, worker_id = ?, updated_at = ?, "
                        + "version = ? WHERE job_id = ? IF status = ? AND version = ?");
        this.cancelJobStmt = session.prepare(
                "UPDATE jobs SET cancel_requested = true WHERE job_id = ? IF EXISTS");
        this.selectCancelStmt = session.prepare(
                "SELECT cancel_requested FROM jobs WHERE job_id = ?");
        this.deleteJobStmt = session.prepare(
                "DELETE FROM jobs WHERE job_id = ? IF EXISTS");
        this.insertLogStmt = session.prepare(
                "INSERT INTO job_logs (job_id, seq, ts, message) VALUES (?, ?, ?, ?)");
        this.selectLogsStmt = session.prepare(
                "SELECT ts, message FROM job_logs WHERE job_id = ? LIMIT ?");
        this.deleteLogsStmt = session.prepare(
                "DELETE FROM job_logs WHERE job_id = ?");
        this.insertIndexStmt = session.prepare(
                "INSERT INTO jobs_by_status (status, job_id) VALUES (?, ?)");
        this.deleteIndexStmt = session.prepare(
                "DELETE FROM jobs_by_status WHERE status = ? AND job_id = ?");
        this.selectIndexStmt = session.prepare(
                "SELECT job_id FROM jobs_by_status WHERE status = ?");
        this.selectIndexEntryStmt = session.prepare(
                "SELECT job_id FROM jobs_by_status WHERE status = ? AND job_id = ?");
        this.scanJobsStmt = session.prepare("SELECT job_id, status FROM jobs");
    }

    @Override
    public void create(JobRecord record) {
        Instant now = record.getCreatedAt() == null ? clock.instant() : record.getCreatedAt();
        Row row = execute(insertJobStmt.bind(record.getId(), record.getStatus().wireName(), record.getProgress(),
                record.getOperation(), record.getToolkit(), record.getType(), Json.write(mapper, record.getPayload()),
                record.isCancelRequested(), now, record.getUpdatedAt() == null ? now : record.getUpdatedAt())).one();
        if (row == null || !row.getBoolean("[applied]")) {
            throw new IllegalStateException("job " + record.getId() + " already exists");
        }
        indexBestEffort(insertIndexStmt.bind(record.getStatus().wireName(), record.getId()), record.getId());
    }

    @Override
    public Optional<JobRecord> get(String jobId) {
        return readJob(jobId).map(r -> r.toBuilder().logs(readLogs(jobId)).build());
    }

    @Override
    public Optional<JobRecord> compareAndSet(JobRecord expected, JobRecord updated) {
        JobTransitions.check(expected, updated);
        String op = JobTransitions.label(expected, updated);
        Instant updatedAt = updated.getUpdatedAt() == null ? clock.instant() : updated.getUpdatedAt();
        long nextVersion = expected.getVersion() + 1;
        long t0 = System.nanoTime();
        boolean applied;
        try {
            Row row = execute(casJobStmt.bind(updated.getStatus().wireName(), updated.getProgress(),
                    Json.write(mapper, updated.getResult()), updated.getError(), updated.getWorkerId(), updatedAt,
                    nextVersion, expected.getId(), expected.getStatus().wireName(), expected.getVersion())).one();
            applied = row != null && row.getBoolean("[applied]");
        } catch (ProgressStoreException e) {
            // the outcome of a timed-out LWT is unknown; a retry with the same expected version would lose
            if (!landed(expected.getId(), updated, nextVersion)) {
                throw e;
            }
            log.warn("CAS {} on job {} timed out but was applied", op, expected.getId());
            applied = true;
        }
        metrics.observeCasLatencySeconds(op, (System.nanoTime() - t0) / 1_000_000_000.0);
        if (!applied) {
            metrics.incCasConflict(op);
            return Optional.empty();
        }
        if (expected.getStatus() != updated.getStatus()) {
            indexBestEffort(insertIndexStmt.bind(updated.getStatus().wireName(), expected.getId()), expected.getId());
            indexBestEffort(deleteIndexStmt.bind(expected.getStatus().wireName(), expected.getId()), expected.getId());
        }
        return Optional.of(expected.toBuilder()
                .status(updated.getStatus())
                .progress(updated.getProgress())
                .result(updated.getResult())
                .error(updated.getError())
                .workerId(updated.getWorkerId())
                .updatedAt(updatedAt)
                .version(nextVersion)
                .build());
    }

    @Override
    public void appendLog(String jobId, String message) {
        execute(insertLogStmt.bind(jobId, Uuids.timeBased(), clock.instant(), message));
    }

    @Override
    public boolean requestCancel(String jobId) {
        Row row = execute(cancelJobStmt.bind(jobId)).one();
        return row != null && row.getBoolean("[applied]");
    }

    @Override
    public boolean isCancelRequested(String jobId) {
        Row row = execute(selectCancelStmt.bind(jobId)).one();
        return row != null && !row.isNull("cancel_requested") && row.getBoolean("cancel_requested");
    }

    @Override
    public JobPage list(JobFilter filter) {
        Set<JobStatus> statuses = filter.getStatuses().isEmpty() ? Set.of(JobStatus.values()) : filter.getStatuses();
        List<JobRecord> matching = new ArrayList<>();
        for (JobStatus status : statuses) {
            for (JobRecord r : findByStatus(status)) {
                if (filter.matches(r)) {
                    matching.add(r);
                }
            }
        }
        return JobPage.of(matching, filter);
    }

    @Override
    public List<JobRecord> findByStatus(JobStatus status) {
        List<JobRecord> found = new ArrayList<>();
        for (Row row : execute(selectIndexStmt.bind(status.wireName()))) {
            String jobId = row.getString("job_id");
            Optional<JobRecord> job = readJob(jobId);
            if (job.isPresent() && job.get().getStatus() == status) {
                found.add(job.get());
            } else if (job.isEmpty() || job.get().isTerminal()) {
                // index entry outlived its row, or its row moved to an absorbing state
                execute(deleteIndexStmt.bind(status.wireName(), jobId));
            }
        }
        return found;
    }

    /**
     * Full scan of {@code jobs}, re-adding the index entry of every row whose current status is not indexed.
     *
     * @return number of entries restored
     */
    @Override
    public int reconcileIndex() {
        int restored = 0;
        for (Row row : execute(scanJobsStmt.bind())) {
            String jobId = row.getString("job_id");
            String status = row.getString("status");
            if (status == null || execute(selectIndexEntryStmt.bind(status, jobId)).one() != null) {
                continue;
            }
            execute(insertIndexStmt.bind(status, jobId));
            log.warn("Restored missing {} index entry for job {}", status, jobId);
            restored++;
        }
        return restored;
    }

    @Override
    public boolean delete(String jobId) {
        Optional<JobRecord> current = readJob(jobId);
        Row row = execute(deleteJobStmt.bind(jobId)).one();
        boolean removed = row != null && row.getBoolean("[applied]");
        execute(deleteLogsStmt.bind(jobId));
        current.ifPresent(r -> execute(deleteIndexStmt.bind(r.getStatus().wireName(), jobId)));
        return removed;
    }

    @Override
    public boolean isHealthy() {
        try {
            session.execute("SELECT now() FROM system.local");
            return true;
        } catch (DriverException e) {
            log.warn("Progress store health check failed: {}", e.getMessage());
            return false;
        }
    }

    private Optional<JobRecord> readJob(String jobId) {
        Row r = execute(selectJobStmt.bind(jobId)).one();
        if (r == null) {
            return Optional.empty();
        }
        return Optional.of(JobRecord.builder()
                .id(r.getString("job_id"))
                .status(JobStatus.fromWire(r.getString("status")))
                .progress(r.isNull("progress") ? 0 : r.getInt("progress"))
                .operation(r.getString("operation"))
                .toolkit(r.getString("toolkit"))
                .type(r.getString("type"))
                .payload(Json.readTree(mapper, r.getString("payload")))
                .result(Json.readTree(mapper, r.getString("result")))
                .error(r.getString("error"))
                .cancelRequested(!r.isNull("cancel_requested") && r.getBoolean("cancel_requested"))
                .workerId(r.getString("worker_id"))
                .version(r.isNull("version") ? 0L : r.getLong("version"))
                .createdAt(r.getInstant("created_at"))
                .updatedAt(r.getInstant("updated_at"))
                .build());
    }

    private List<JobLogEntry> readLogs(String jobId) {
        List<JobLogEntry> logs = new ArrayList<>();
        for (Row row : execute(selectLogsStmt.bind(jobId, maxLogLines))) {
            logs.add(JobLogEntry.of(row.getInstant("ts"), row.getString("message")));
        }
        // newest-first on disk
        Collections.reverse(logs);
        return logs;
    }

    private boolean landed(String jobId, JobRecord updated, long version) {
        // a serial read completes or supersedes any in-flight Paxos round
        Row r = execute(selectJobStmt.bind(jobId), DefaultConsistencyLevel.LOCAL_SERIAL).one();
        return r != null
                && !r.isNull("version") && r.getLong("version") == version
                && updated.getStatus().wireName().equals(r.getString("status"))
                && Objects.equals(updated.getWorkerId(), r.getString("worker_id"))
                && Objects.equals(updated.getError(), r.getString("error"));
    }

    private void indexBestEffort(BoundStatement statement, String jobId) {
        try {
            execute(statement);
        } catch (ProgressStoreException e) {
            log.warn("Status index update for job {} failed, left to reconciliation: {}", jobId, e.getMessage());
        }
    }

    private ResultSet execute(BoundStatement statement) {
        return execute(statement, DefaultConsistencyLevel.LOCAL_QUORUM);
    }

    private ResultSet execute(BoundStatement statement, DefaultConsistencyLevel consistency) {
        try {
            return session.execute(statement.setConsistencyLevel(consistency));
        } catch (DriverException e) {
            throw new ProgressStoreException("progress store unavailable: " + e.getMessage(), e);
        }
    }
}
