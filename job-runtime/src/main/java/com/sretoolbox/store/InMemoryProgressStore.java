package com.sretoolbox.store;

import com.sretoolbox.jobs.JobLogEntry;
import com.sretoolbox.jobs.JobRecord;
import com.sretoolbox.jobs.JobStatus;
import com.sretoolbox.metrics.StoreMetrics;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Single-process progress store. Same compare-and-set semantics as the Cassandra store; each record is
 * guarded by its own monitor.
 */
public class InMemoryProgressStore implements ProgressStore {
    private final ConcurrentHashMap<String, Entry> jobs = new ConcurrentHashMap<>();
    private final int maxLogLines;
    private final Clock clock;
    private final StoreMetrics metrics;

    public InMemoryProgressStore() {
        this(200, Clock.systemUTC(), StoreMetrics.noop());
    }

    public InMemoryProgressStore(int maxLogLines, Clock clock, StoreMetrics metrics) {
        this.maxLogLines = maxLogLines;
        this.clock = clock;
        this.metrics = metrics == null ? StoreMetrics.noop() : metrics;
    }

    private static final class Entry {
        JobRecord record;
        boolean cancelRequested;
        final Deque<JobLogEntry> logs = new ArrayDeque<>();

        Entry(JobRecord record) {
            this.record = record;
            this.cancelRequested = record.isCancelRequested();
        }
    }

    @Override
    public void create(JobRecord record) {
        JobRecord stored = record.toBuilder().logs(List.of()).version(0L).build();
        Entry previous = jobs.putIfAbsent(record.getId(), new Entry(stored));
        if (previous != null) {
            throw new IllegalStateException("job " + record.getId() + " already exists");
        }
    }

    @Override
    public Optional<JobRecord> get(String jobId) {
        Entry e = jobs.get(jobId);
        if (e == null) {
            return Optional.empty();
        }
        synchronized (e) {
            return Optional.of(snapshot(e, true));
        }
    }

    @Override
    public Optional<JobRecord> compareAndSet(JobRecord expected, JobRecord updated) {
        JobTransitions.check(expected, updated);
        String op = JobTransitions.label(expected, updated);
        long t0 = System.nanoTime();
        Entry e = jobs.get(expected.getId());
        if (e == null) {
            metrics.incCasConflict(op);
            return Optional.empty();
        }
        synchronized (e) {
            JobRecord current = e.record;
            metrics.observeCasLatencySeconds(op, (System.nanoTime() - t0) / 1_000_000_000.0);
            if (current.getStatus() != expected.getStatus() || current.getVersion() != expected.getVersion()) {
                metrics.incCasConflict(op);
                return Optional.empty();
            }
            e.record = current.toBuilder()
                    .status(updated.getStatus())
                    .progress(updated.getProgress())
                    .result(updated.getResult())
                    .error(updated.getError())
                    .workerId(updated.getWorkerId())
                    .updatedAt(updated.getUpdatedAt() == null ? clock.instant() : updated.getUpdatedAt())
                    .version(current.getVersion() + 1)
                    .build();
            return Optional.of(snapshot(e, true));
        }
    }

    @Override
    public void appendLog(String jobId, String message) {
        Entry e = jobs.get(jobId);
        if (e == null) {
            return;
        }
        synchronized (e) {
            e.logs.addLast(JobLogEntry.of(clock.instant(), message));
            while (e.logs.size() > maxLogLines) {
                e.logs.removeFirst();
            }
        }
    }

    @Override
    public boolean requestCancel(String jobId) {
        Entry e = jobs.get(jobId);
        if (e == null) {
            return false;
        }
        synchronized (e) {
            e.cancelRequested = true;
        }
        return true;
    }

    @Override
    public boolean isCancelRequested(String jobId) {
        Entry e = jobs.get(jobId);
        if (e == null) {
            return false;
        }
        synchronized (e) {
            return e.cancelRequested;
        }
    }

    @Override
    public JobPage list(JobFilter filter) {
        List<JobRecord> matching = new ArrayList<>();
        for (Entry e : jobs.values()) {
            JobRecord r;
            synchronized (e) {
                r = snapshot(e, false);
            }
            if (filter.matches(r)) {
                matching.add(r);
            }
        }
        return JobPage.of(matching, filter);
    }

    @Override
    public List<JobRecord> findByStatus(JobStatus status) {
        return jobs.values().stream()
                .map(e -> {
                    synchronized (e) {
                        return snapshot(e, false);
                    }
                })
                .filter(r -> r.getStatus() == status)
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String jobId) {
        return jobs.remove(jobId) != null;
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    private static JobRecord snapshot(Entry e, boolean withLogs) {
        return e.record.toBuilder()
                .cancelRequested(e.cancelRequested)
                .logs(withLogs ? List.copyOf(e.logs) : List.of())
                .build();
    }
}
