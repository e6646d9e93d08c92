package com.sretoolbox.jobs;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.sretoolbox.metrics.StoreMetrics;
import com.sretoolbox.queue.Delivery;
import com.sretoolbox.queue.InMemoryTaskQueue;
import com.sretoolbox.store.InMemoryProgressStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Collectors;
import org.junit.Test;

public class JobReaperTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration DEAD = Duration.ofSeconds(300);
    private static final Duration RETENTION = Duration.ofDays(7);
    private static final Duration QUEUE_STALE = Duration.ofSeconds(900);

    private final InMemoryProgressStore store =
            new InMemoryProgressStore(200, Clock.fixed(T0, ZoneOffset.UTC), StoreMetrics.noop());
    private final InMemoryTaskQueue queue = new InMemoryTaskQueue();

    private JobDescriptor descriptor(String id) {
        return JobDescriptor.builder().jobId(id).operation("probe").toolkit("probe").type("probe")
                .payload(JsonNodeFactory.instance.objectNode().put("url", "https://example.com")).enqueuedAt(T0)
                .build();
    }

    private JobRecord queued(String id) {
        store.create(JobRecord.queued(descriptor(id), T0));
        return store.get(id).orElseThrow();
    }

    private JobRecord running(String id, Instant lastUpdate) {
        store.create(JobRecord.queued(JobDescriptor.builder().jobId(id).operation("probe").build(), T0));
        JobRecord queued = store.get(id).orElseThrow();
        return store.compareAndSet(queued, queued.toBuilder().status(JobStatus.RUNNING).workerId("w1")
                .updatedAt(lastUpdate).build()).orElseThrow();
    }

    private JobReaper reaperAt(Instant now) {
        return new JobReaper(store, queue, DEAD, QUEUE_STALE, RETENTION, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    public void failsJobsWithoutProgressPastTheDeadWorkerWindow() {
        running("stale", T0);
        running("fresh", T0.plusSeconds(200));

        JobReaper.Result result = reaperAt(T0.plusSeconds(301)).reap();

        assertThat(result.getAbandoned(), is(1));
        JobRecord stale = store.get("stale").orElseThrow();
        assertThat(stale.getStatus(), is(JobStatus.FAILED));
        assertThat(stale.getError(), containsString("no progress for 300s"));
        assertThat(stale.getLogs().get(0).getMessage(), containsString("Error: "));
        assertThat(store.get("fresh").orElseThrow().getStatus(), is(JobStatus.RUNNING));
    }

    @Test
    public void exactlyAtTheWindowIsNotReaped() {
        running("edge", T0);
        assertThat(reaperAt(T0.plus(DEAD)).reap().getAbandoned(), is(0));
    }

    @Test
    public void purgesTerminalJobsPastRetentionOnly() {
        JobRecord old = running("old", T0);
        store.compareAndSet(old, old.toBuilder().status(JobStatus.SUCCEEDED).progress(100).updatedAt(T0).build());
        JobRecord recent = running("recent", T0);
        store.compareAndSet(recent, recent.toBuilder().status(JobStatus.SUCCEEDED).progress(100)
                .updatedAt(T0.plus(Duration.ofDays(6))).build());

        JobReaper.Result result = reaperAt(T0.plus(Duration.ofDays(7)).plusSeconds(1)).reap();

        assertThat(result.getPurged(), is(1));
        assertThat(store.get("old").isPresent(), is(false));
        assertThat(store.get("recent").isPresent(), is(true));
    }

    @Test
    public void staleQueuedJobWithoutQueueEntryIsRequeued() throws Exception {
        queued("lost");

        JobReaper.Result result = reaperAt(T0.plusSeconds(901)).reap();

        assertThat(result.getRequeued(), is(1));
        JobRecord r = store.get("lost").orElseThrow();
        assertThat(r.getStatus(), is(JobStatus.QUEUED));
        assertThat(r.getLogs().stream().map(JobLogEntry::getMessage).collect(Collectors.toList()),
                hasItem(JobReaper.REQUEUED_LOG));
        Delivery d = queue.dequeue().orElseThrow();
        assertThat(d.getJobId(), is("lost"));
        assertThat(d.getDescriptor().getPayload().get("url").asText(), is("https://example.com"));
    }

    @Test
    public void queuedJobStillWaitingInTheQueueIsLeftAlone() {
        queued("backlog");
        queue.enqueue(descriptor("backlog"));

        assertThat(reaperAt(T0.plusSeconds(901)).reap().getRequeued(), is(0));
        assertThat(queue.pendingCount(), is(1));
    }

    @Test
    public void recentlyQueuedJobIsNotRequeued() {
        queued("fresh");
        assertThat(reaperAt(T0.plus(QUEUE_STALE)).reap().getRequeued(), is(0));
        assertThat(queue.pendingCount(), is(0));
    }

    @Test
    public void staleQueuedJobWithPendingCancelIsCancelled() {
        queued("abandoned");
        store.requestCancel("abandoned");

        assertThat(reaperAt(T0.plusSeconds(901)).reap().getRequeued(), is(1));
        JobRecord r = store.get("abandoned").orElseThrow();
        assertThat(r.getStatus(), is(JobStatus.CANCELLED));
        assertThat(queue.pendingCount(), is(0));
    }

    @Test
    public void reportsRepairedIndexEntries() {
        InMemoryProgressStore repairing = new InMemoryProgressStore() {
            @Override
            public int reconcileIndex() {
                return 2;
            }
        };
        JobReaper reaper = new JobReaper(repairing, queue, DEAD, QUEUE_STALE, RETENTION,
                Clock.fixed(T0, ZoneOffset.UTC));
        assertThat(reaper.reap().getRepaired(), is(2));
    }
}
