package com.sretoolbox.store;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.JobRecord;
import com.sretoolbox.jobs.JobStatus;
import com.sretoolbox.metrics.StoreMetrics;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;

public class InMemoryProgressStoreTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemoryProgressStore store =
            new InMemoryProgressStore(3, Clock.fixed(T0, ZoneOffset.UTC), StoreMetrics.noop());

    private JobRecord newJob(String id, String toolkit, Instant createdAt) {
        JobRecord r = JobRecord.queued(JobDescriptor.builder().jobId(id).operation("probe").toolkit(toolkit)
                .type(toolkit + ".probe").build(), createdAt);
        store.create(r);
        return store.get(id).orElseThrow();
    }

    @Test(expected = IllegalStateException.class)
    public void createRejectsDuplicateIds() {
        newJob("a", "http", T0);
        newJob("a", "http", T0);
    }

    @Test
    public void compareAndSetBumpsVersionAndRejectsStaleExpected() {
        JobRecord queued = newJob("a", "http", T0);
        JobRecord running = store.compareAndSet(queued,
                queued.toBuilder().status(JobStatus.RUNNING).workerId("w1").build()).orElseThrow();
        assertThat(running.getVersion(), is(1L));
        assertThat(running.getWorkerId(), is("w1"));

        // a second worker presenting the original snapshot loses
        Optional<JobRecord> second = store.compareAndSet(queued,
                queued.toBuilder().status(JobStatus.RUNNING).workerId("w2").build());
        assertThat(second.isPresent(), is(false));
        assertThat(store.get("a").orElseThrow().getWorkerId(), is("w1"));
    }

    @Test
    public void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        JobRecord queued = newJob("race", "http", T0);
        AtomicInteger winners = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(8);
        for (int i = 0; i < 8; i++) {
            String worker = "w" + i;
            new Thread(() -> {
                try {
                    start.await();
                    if (store.compareAndSet(queued, queued.toBuilder().status(JobStatus.RUNNING).workerId(worker)
                            .build()).isPresent()) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        done.await();
        assertThat(winners.get(), is(1));
    }

    @Test
    public void logsAndCancelFlagDoNotInvalidateVersion() {
        JobRecord queued = newJob("a", "http", T0);
        JobRecord running = store.compareAndSet(queued, queued.toBuilder().status(JobStatus.RUNNING).build())
                .orElseThrow();
        store.appendLog("a", "one");
        assertThat(store.requestCancel("a"), is(true));
        assertThat(store.isCancelRequested("a"), is(true));
        assertThat(store.compareAndSet(running, running.toBuilder().progress(50).build()).isPresent(), is(true));
    }

    @Test
    public void logsAreBoundedToNewestLines() {
        newJob("a", "http", T0);
        for (int i = 1; i <= 5; i++) {
            store.appendLog("a", "line " + i);
        }
        JobRecord r = store.get("a").orElseThrow();
        assertThat(r.getLogs().size(), is(3));
        assertThat(r.getLogs().get(0).getMessage(), is("line 3"));
        assertThat(r.getLogs().get(2).getMessage(), is("line 5"));
    }

    @Test
    public void requestCancelOnUnknownIdReturnsFalse() {
        assertThat(store.requestCancel("missing"), is(false));
        assertThat(store.isCancelRequested("missing"), is(false));
    }

    @Test
    public void listFiltersSortsNewestFirstAndPaginates() {
        newJob("a", "http", T0);
        newJob("b", "Zabbix", T0.plusSeconds(10));
        newJob("c", "http", T0.plusSeconds(20));
        newJob("d", "http", T0.plusSeconds(30));

        JobPage page = store.list(JobFilter.builder().toolkits(Set.of("HTTP")).limit(2).offset(1).build());
        assertThat(page.getTotal(), is(3));
        assertThat(page.getJobs().size(), is(2));
        assertThat(page.getJobs().get(0).getId(), is("c"));
        assertThat(page.getJobs().get(1).getId(), is("a"));
        assertThat(page.getJobs().get(0).getLogs().isEmpty(), is(true));

        JobPage zabbix = store.list(JobFilter.builder().toolkits(Set.of("zabbix")).build());
        assertThat(zabbix.getTotal(), is(1));
    }

    @Test
    public void findByStatusAndDelete() {
        JobRecord a = newJob("a", "http", T0);
        newJob("b", "http", T0);
        store.compareAndSet(a, a.toBuilder().status(JobStatus.CANCELLED).build());
        assertThat(store.findByStatus(JobStatus.CANCELLED).size(), is(1));
        assertThat(store.findByStatus(JobStatus.QUEUED).size(), is(1));
        assertThat(store.delete("a"), is(true));
        assertThat(store.get("a").isPresent(), is(false));
        assertThat(store.delete("a"), is(false));
    }
}
