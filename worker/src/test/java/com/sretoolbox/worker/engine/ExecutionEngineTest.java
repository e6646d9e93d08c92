package com.sretoolbox.worker.engine;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.JobLogEntry;
import com.sretoolbox.jobs.JobRecord;
import com.sretoolbox.jobs.JobStatus;
import com.sretoolbox.jobs.errors.SecretUnavailableException;
import com.sretoolbox.support.Backoff;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.junit.Test;

public class ExecutionEngineTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final RecordingProgressStore store = new RecordingProgressStore();
    private final OperationRegistry registry = new OperationRegistry();
    private final Backoff backoff = new Backoff(2, Duration.ofMillis(1), Duration.ofMillis(1), ms -> {
    });
    private final ExecutionEngine engine =
            new ExecutionEngine(store, registry, backoff, "w1", Clock.systemUTC(), EngineMetrics.noop());

    private JobDescriptor submit(String id, String operation) {
        JobDescriptor d = JobDescriptor.builder().jobId(id).operation(operation).toolkit(operation).type(operation)
                .payload(JsonNodeFactory.instance.objectNode()).enqueuedAt(Instant.now()).build();
        store.create(JobRecord.queued(d, Instant.now()));
        return d;
    }

    private JobRecord job(String id) {
        return store.delegate.get(id).orElseThrow();
    }

    private List<String> logMessages(String id) {
        return job(id).getLogs().stream().map(JobLogEntry::getMessage).collect(Collectors.toList());
    }

    @Test
    public void succeedsWithMonotonicProgress() {
        registry.register(new ScriptedOperation("work", (job, progress, cancel) -> {
            progress.report(10, "ten");
            progress.report(30, "thirty");
            progress.report(20, "late report");
            progress.report(80, "eighty");
            return mapper.createObjectNode().put("ok", true);
        }));
        JobDescriptor d = submit("j1", "work");

        engine.execute(d);

        JobRecord r = job("j1");
        assertThat(r.getStatus(), is(JobStatus.SUCCEEDED));
        assertThat(r.getProgress(), is(100));
        assertThat(r.getResult().get("ok").asBoolean(), is(true));
        assertThat(r.getError(), is(nullValue()));
        assertThat(r.getWorkerId(), is("w1"));
        List<Integer> progress = store.applied.stream().map(JobRecord::getProgress).collect(Collectors.toList());
        assertThat(progress, is(List.of(0, 10, 30, 30, 80, 100)));
        List<String> logs = logMessages("j1");
        assertThat(logs.get(0), is("Job execution started"));
        assertThat(logs.get(logs.size() - 1), is("Job completed"));
    }

    @Test
    public void redeliveryAfterCompletionChangesNothing() {
        ScriptedOperation op = new ScriptedOperation("work", (job, progress, cancel) -> null);
        registry.register(op);
        JobDescriptor d = submit("j1", "work");

        engine.execute(d);
        JobRecord first = job("j1");
        engine.execute(d);
        JobRecord second = job("j1");

        assertThat(op.invocations.get(), is(1));
        assertThat(second.getVersion(), is(first.getVersion()));
        assertThat(second.getStatus(), is(JobStatus.SUCCEEDED));
        assertThat(second.getLogs().size(), is(first.getLogs().size()));
    }

    @Test
    public void cancelBeforeClaimNeverRuns() {
        ScriptedOperation op = new ScriptedOperation("work", (job, progress, cancel) -> null);
        registry.register(op);
        JobDescriptor d = submit("j1", "work");
        store.requestCancel("j1");

        engine.execute(d);

        assertThat(op.invocations.get(), is(0));
        assertThat(job("j1").getStatus(), is(JobStatus.CANCELLED));
        List<JobStatus> statuses = store.applied.stream().map(JobRecord::getStatus).collect(Collectors.toList());
        assertThat(statuses, not(hasItem(JobStatus.RUNNING)));
        assertThat(logMessages("j1"), hasItem("Job cancelled before execution"));
    }

    @Test
    public void cancelObservedAtCheckpointStopsTheOperation() {
        AtomicBoolean ranPastCancel = new AtomicBoolean(false);
        registry.register(new ScriptedOperation("work", (job, progress, cancel) -> {
            progress.report(10, "step 1");
            store.requestCancel(job.getJobId());
            progress.report(20, "step 2");
            ranPastCancel.set(true);
            return mapper.createObjectNode();
        }));
        JobDescriptor d = submit("j1", "work");

        engine.execute(d);

        JobRecord r = job("j1");
        assertThat(ranPastCancel.get(), is(false));
        assertThat(r.getStatus(), is(JobStatus.CANCELLED));
        assertThat(r.getResult(), is(nullValue()));
        assertThat(r.getError(), is(nullValue()));
        assertThat(r.getProgress(), is(20));
        assertThat(logMessages("j1"), hasItem("Cancellation acknowledged during execution"));
    }

    @Test
    public void operationExceptionBecomesFailedRecord() {
        registry.register(new ScriptedOperation("work", (job, progress, cancel) -> {
            progress.report(40, "halfway");
            throw new IllegalStateException("disk full");
        }));
        engine.execute(submit("j1", "work"));

        JobRecord r = job("j1");
        assertThat(r.getStatus(), is(JobStatus.FAILED));
        assertThat(r.getError(), is("disk full"));
        assertThat(r.getResult(), is(nullValue()));
        assertThat(r.getProgress(), is(40));
        assertThat(logMessages("j1"), hasItem("Error: disk full"));
    }

    @Test
    public void errorFromOperationStillReachesTerminalState() {
        registry.register(new ScriptedOperation("work", (job, progress, cancel) -> {
            progress.report(10, "recursing");
            throw new StackOverflowError();
        }));
        engine.execute(submit("j1", "work"));

        JobRecord r = job("j1");
        assertThat(r.getStatus(), is(JobStatus.FAILED));
        assertThat(r.getError(), is("StackOverflowError"));
        assertThat(logMessages("j1"), hasItem("Error: StackOverflowError"));
    }

    @Test
    public void missingCredentialFailsWithActionableMessage() {
        registry.register(new ScriptedOperation("work", (job, progress, cancel) -> {
            throw new SecretUnavailableException("zabbix", "api_token");
        }));
        engine.execute(submit("j1", "work"));

        JobRecord r = job("j1");
        assertThat(r.getStatus(), is(JobStatus.FAILED));
        assertThat(r.getError(), containsString("'api_token'"));
        assertThat(r.getError(), containsString("'zabbix'"));
    }

    @Test
    public void unknownOperationFails() {
        engine.execute(submit("j1", "nope"));
        JobRecord r = job("j1");
        assertThat(r.getStatus(), is(JobStatus.FAILED));
        assertThat(r.getError(), is("No handler registered for operation nope"));
    }

    @Test
    public void jobRunningElsewhereIsLeftAlone() {
        ScriptedOperation op = new ScriptedOperation("work", (job, progress, cancel) -> null);
        registry.register(op);
        JobDescriptor d = submit("j1", "work");
        JobRecord queued = job("j1");
        store.compareAndSet(queued, queued.toBuilder().status(JobStatus.RUNNING).workerId("w0").build());

        engine.execute(d);

        assertThat(op.invocations.get(), is(0));
        assertThat(job("j1").getWorkerId(), is("w0"));
        assertThat(job("j1").getStatus(), is(JobStatus.RUNNING));
    }

    @Test
    public void finalizedByReaperBeatsZombieWorker() {
        registry.register(new ScriptedOperation("work", (job, progress, cancel) -> {
            progress.report(10, "started");
            JobRecord current = store.get(job.getJobId()).orElseThrow();
            store.compareAndSet(current, current.toBuilder().status(JobStatus.FAILED).error("reaped").build());
            return mapper.createObjectNode().put("late", true);
        }));
        engine.execute(submit("j1", "work"));

        JobRecord r = job("j1");
        assertThat(r.getStatus(), is(JobStatus.FAILED));
        assertThat(r.getError(), is("reaped"));
        assertThat(r.getResult(), is(nullValue()));
    }

    @Test
    public void storeOutageAbandonsJobAsRunning() {
        registry.register(new ScriptedOperation("work", (job, progress, cancel) -> {
            progress.report(10, "started");
            store.offline = true;
            progress.report(50, "never recorded");
            return mapper.createObjectNode();
        }));
        engine.execute(submit("j1", "work"));
        store.offline = false;

        JobRecord r = job("j1");
        assertThat(r.getStatus(), is(JobStatus.RUNNING));
        assertThat(r.getProgress(), is(10));
    }

    @Test
    public void unknownJobIsDropped() {
        engine.execute(JobDescriptor.builder().jobId("ghost").operation("work").build());
        assertThat(store.delegate.get("ghost").isPresent(), is(false));
    }
}
