package com.sretoolbox.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.JobService;
import com.sretoolbox.jobs.errors.NotFoundException;
import com.sretoolbox.probe.InMemoryProbeHistoryStore;
import com.sretoolbox.probe.InMemoryProbeTemplateStore;
import com.sretoolbox.probe.NotificationChannel;
import com.sretoolbox.probe.NotificationRule;
import com.sretoolbox.probe.NotificationThreshold;
import com.sretoolbox.probe.ProbeExecutionSummary;
import com.sretoolbox.probe.ProbeHistoryEntry;
import com.sretoolbox.probe.ProbeTemplate;
import com.sretoolbox.queue.InMemoryTaskQueue;
import com.sretoolbox.scheduler.api.ProbeTemplateRequest;
import com.sretoolbox.store.InMemoryProgressStore;
import com.sretoolbox.support.Backoff;
import com.sretoolbox.support.Json;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;
import org.junit.Test;

public class ProbeTemplateServiceTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final ObjectMapper mapper = Json.newMapper();
    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryProbeTemplateStore templates = new InMemoryProbeTemplateStore();
    private final InMemoryProbeHistoryStore history = new InMemoryProbeHistoryStore();
    private final InMemoryTaskQueue queue = new InMemoryTaskQueue();
    private final JobService jobs = new JobService(new InMemoryProgressStore(), queue,
            new Backoff(1, Duration.ZERO, Duration.ZERO), clock);
    private final ProbeTemplateService service =
            new ProbeTemplateService(templates, history, jobs, mapper, 300, clock, () -> "tpl-1");

    private static ProbeTemplateRequest.ProbeTemplateRequestBuilder valid() {
        return ProbeTemplateRequest.builder()
                .name("Checkout API")
                .url("https://checkout.example.com/health")
                .slaMs(200);
    }

    @Test
    public void createAppliesDefaultsAndIsDueImmediately() {
        ProbeTemplate t = service.create(valid()
                .tags(Arrays.asList("prod", " edge ", "prod", ""))
                .notificationRules(List.of(NotificationRule.builder()
                        .channel(NotificationChannel.SLACK).target(" #sre ").threshold(null).build()))
                .build());

        assertThat(t.getId(), is("tpl-1"));
        assertThat(t.getMethod(), is("GET"));
        assertThat(t.getIntervalSeconds(), is(300));
        assertThat(t.getNextRunAt(), is(T0));
        assertThat(t.getCreatedAt(), is(T0));
        assertThat(t.getTags(), is(List.of("prod", "edge")));
        assertThat(t.getNotificationRules().get(0).getTarget(), is("#sre"));
        assertThat(t.getNotificationRules().get(0).getThreshold(), is(NotificationThreshold.BREACH));
        assertThat(templates.findDue(T0).size(), is(1));
    }

    @Test
    public void invalidRequestsAreRejected() {
        List<UnaryOperator<ProbeTemplateRequest.ProbeTemplateRequestBuilder>> cases = new ArrayList<>();
        cases.add(b -> b.name(" "));
        cases.add(b -> b.name("x".repeat(121)));
        cases.add(b -> b.description("d".repeat(501)));
        cases.add(b -> b.url(null));
        cases.add(b -> b.url("ftp://files.example.com"));
        cases.add(b -> b.url("/health"));
        cases.add(b -> b.url("https://bad host/"));
        cases.add(b -> b.method("DELETE"));
        cases.add(b -> b.slaMs(null));
        cases.add(b -> b.slaMs(0));
        cases.add(b -> b.slaMs(60_001));
        cases.add(b -> b.intervalSeconds(29));
        cases.add(b -> b.intervalSeconds(3601));
        cases.add(b -> b.notificationRules(List.of(NotificationRule.builder()
                .channel(NotificationChannel.EMAIL).target(" ").build())));
        cases.add(b -> b.notificationRules(List.of(NotificationRule.builder().target("ops@example.com").build())));

        for (int i = 0; i < cases.size(); i++) {
            try {
                service.create(cases.get(i).apply(valid()).build());
                fail("case " + i + " should be rejected");
            } catch (IllegalArgumentException expected) {
                // rejected
            }
        }
        assertThat(templates.list().isEmpty(), is(true));
    }

    @Test
    public void boundaryValuesAreAccepted() {
        ProbeTemplate t = service.create(valid().name("x".repeat(120)).method("head").slaMs(60_000)
                .intervalSeconds(30).build());
        assertThat(t.getMethod(), is("HEAD"));
        assertThat(t.getIntervalSeconds(), is(30));
    }

    @Test
    public void updateKeepsScheduleUnlessIntervalChanges() {
        service.create(valid().intervalSeconds(60).build());
        templates.compareAndSetNextRun("tpl-1", T0, T0.plusSeconds(60));
        clock.advance(Duration.ofSeconds(10));

        ProbeTemplate renamed = service.update("tpl-1", valid().name("Checkout v2").intervalSeconds(60).build());
        assertThat(renamed.getName(), is("Checkout v2"));
        assertThat(renamed.getNextRunAt(), is(T0.plusSeconds(60)));
        assertThat(renamed.getCreatedAt(), is(T0));
        assertThat(renamed.getUpdatedAt(), is(T0.plusSeconds(10)));

        ProbeTemplate slower = service.update("tpl-1", valid().intervalSeconds(600).build());
        assertThat(slower.getNextRunAt(), is(T0.plusSeconds(610)));
    }

    @Test(expected = NotFoundException.class)
    public void updateOfUnknownTemplateIsNotFound() {
        service.update("missing", valid().build());
    }

    @Test
    public void deleteRemovesTemplate() {
        service.create(valid().build());
        service.delete("tpl-1");
        try {
            service.get("tpl-1");
            fail("expected NotFoundException");
        } catch (NotFoundException e) {
            assertThat(e.getMessage(), is("probe template tpl-1 not found"));
        }
    }

    @Test(expected = NotFoundException.class)
    public void deleteOfUnknownTemplateIsNotFound() {
        service.delete("missing");
    }

    @Test
    public void runNowEnqueuesWithoutTouchingSchedule() throws Exception {
        service.create(valid().build());
        templates.compareAndSetNextRun("tpl-1", T0, T0.plusSeconds(300));

        String jobId = service.runNow("tpl-1");

        assertThat(queue.dequeue().get().getJobId(), is(jobId));
        assertThat(templates.get("tpl-1").get().getNextRunAt(), is(T0.plusSeconds(300)));
    }

    @Test
    public void historyIsNewestFirstAndLimitIsBounded() {
        service.create(valid().build());
        for (int i = 1; i <= 3; i++) {
            history.record(ProbeHistoryEntry.builder()
                    .templateId("tpl-1")
                    .jobId("job-" + i)
                    .recordedAt(T0.plusSeconds(i))
                    .summary(ProbeExecutionSummary.builder().templateId("tpl-1").metSla(true).build())
                    .build());
        }

        List<ProbeHistoryEntry> entries = service.history("tpl-1", 2);
        assertThat(entries.size(), is(2));
        assertThat(entries.get(0).getJobId(), is("job-3"));
        assertThat(service.history("tpl-1", null).size(), is(3));

        try {
            service.history("tpl-1", 0);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // rejected
        }
    }
}
