package com.sretoolbox.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.JobService;
import com.sretoolbox.jobs.JobSubmission;
import com.sretoolbox.jobs.errors.JobRuntimeException;
import com.sretoolbox.probe.ProbeRequest;
import com.sretoolbox.probe.ProbeTemplate;
import com.sretoolbox.probe.ProbeTemplateStore;
import com.sretoolbox.scheduler.metrics.SchedulerMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Turns due probe templates into probe jobs.
 * <p>
 * Each due template is claimed by a compare-and-set of {@code next_run_at} from the value read to
 * {@code now + interval}; only the winner enqueues, so concurrent ticks fire a template at most once.
 * Missed ticks are not backfilled.
 */
@Slf4j
public class ProbeScheduler {
    private final ProbeTemplateStore templates;
    private final JobService jobs;
    private final ObjectMapper mapper;
    private final int defaultIntervalSeconds;
    private final SchedulerMetrics metrics;

    public ProbeScheduler(ProbeTemplateStore templates, JobService jobs, ObjectMapper mapper,
            int defaultIntervalSeconds, SchedulerMetrics metrics) {
        this.templates = templates;
        this.jobs = jobs;
        this.mapper = mapper;
        this.defaultIntervalSeconds = defaultIntervalSeconds;
        this.metrics = metrics == null ? SchedulerMetrics.noop() : metrics;
    }

    /**
     * @return number of probe jobs enqueued by this tick
     */
    public int tick(Instant now) {
        List<ProbeTemplate> due = templates.findDue(now);
        int enqueued = 0;
        for (ProbeTemplate template : due) {
            int interval = template.getIntervalSeconds() > 0 ? template.getIntervalSeconds() : defaultIntervalSeconds;
            Instant next = now.plusSeconds(interval);
            if (!templates.compareAndSetNextRun(template.getId(), template.getNextRunAt(), next)) {
                log.debug("Template {} already advanced by another tick", template.getId());
                continue;
            }
            try {
                String jobId = jobs.submit(submissionFor(template, mapper));
                metrics.probeJobEnqueued();
                enqueued++;
                log.info("Template {} fired job {}, next run at {}", template.getId(), jobId, next);
            } catch (JobRuntimeException e) {
                log.error("Template {} could not be enqueued, skipping this run", template.getId(), e);
            }
        }
        return enqueued;
    }

    /** Copies the template's current configuration into the job payload. */
    static JobSubmission submissionFor(ProbeTemplate template, ObjectMapper mapper) {
        return JobSubmission.builder()
                .operation(ProbeRequest.OPERATION)
                .payload(mapper.valueToTree(ProbeRequest.fromTemplate(template)))
                .build();
    }
}
