package com.sretoolbox.worker.operations;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.errors.OperationFailureException;
import com.sretoolbox.probe.ProbeExecutionSample;
import com.sretoolbox.probe.ProbeExecutionSummary;
import com.sretoolbox.probe.ProbeRequest;
import com.sretoolbox.worker.engine.CancelSignal;
import com.sretoolbox.worker.engine.ProgressReporter;
import com.sretoolbox.worker.engine.ToolkitOperation;
import com.sretoolbox.worker.notify.NotificationDispatcher;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Synthetic latency probe. Takes {@code sample_size} measurements against the SLA, one progress checkpoint per
 * sample, then hands the summary to the notification dispatcher.
 */
public class ProbeOperation implements ToolkitOperation {
    private static final Set<String> METHODS = Set.of("GET", "HEAD", "POST");

    private final LatencySampler sampler;
    private final NotificationDispatcher dispatcher;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ProbeOperation(LatencySampler sampler, NotificationDispatcher dispatcher, ObjectMapper mapper,
            Clock clock) {
        this.sampler = sampler;
        this.dispatcher = dispatcher;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return ProbeRequest.OPERATION;
    }

    @Override
    public JsonNode execute(JobDescriptor job, ProgressReporter progress, CancelSignal cancel) throws Exception {
        ProbeRequest req = parse(job.getPayload());
        int samples = req.getSampleSize();
        String method = req.getMethod() == null ? "GET" : req.getMethod().toUpperCase(Locale.ROOT);
        progress.log("Probing " + method + " " + req.getUrl() + " (" + samples + " samples, SLA " + req.getSlaMs()
                + " ms)");

        List<ProbeExecutionSample> taken = new ArrayList<>();
        for (int attempt = 1; attempt <= samples; attempt++) {
            cancel.checkpoint();
            ProbeExecutionSample sample = sample(req, method, attempt);
            taken.add(sample);
            progress.report(attempt * 90 / samples, "Attempt " + attempt + ": " + sample.getMessage());
        }

        ProbeExecutionSummary summary = ProbeExecutionSummary.from(req.getTemplateId(), req.getTemplateName(),
                req.getSlaMs(), taken);
        summary = dispatcher.dispatch(job.getJobId(), req.getNotificationRules(), summary, progress::log);
        progress.log(summary.isMetSla()
                ? "SLA met: average " + summary.getAverageLatencyMs() + " ms"
                : "SLA breached on " + summary.getBreachCount() + " of " + samples + " samples");
        return mapper.valueToTree(summary);
    }

    private ProbeExecutionSample sample(ProbeRequest req, String method, int attempt) throws InterruptedException {
        Instant ts = clock.instant();
        List<Double> overrides = req.getLatencyOverrides();
        if (overrides != null && attempt - 1 < overrides.size() && overrides.get(attempt - 1) != null) {
            return ProbeExecutionSample.measured(attempt, ts, overrides.get(attempt - 1), req.getSlaMs());
        }
        long t0 = System.nanoTime();
        try {
            return ProbeExecutionSample.measured(attempt, ts, sampler.measureMillis(req.getUrl(), method),
                    req.getSlaMs());
        } catch (IOException | IllegalArgumentException e) {
            double elapsed = (System.nanoTime() - t0) / 1_000_000.0;
            return ProbeExecutionSample.failed(attempt, ts, elapsed,
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private ProbeRequest parse(JsonNode payload) {
        ProbeRequest req;
        try {
            req = mapper.treeToValue(payload, ProbeRequest.class);
        } catch (JsonProcessingException e) {
            throw new OperationFailureException("Invalid probe payload: " + e.getOriginalMessage(), e);
        }
        if (req == null || req.getUrl() == null || req.getUrl().isBlank()) {
            throw new OperationFailureException("Probe payload requires 'url'");
        }
        if (!ProbeRequest.isValidSampleSize(req.getSampleSize())) {
            throw new OperationFailureException("Invalid probe payload: " + ProbeRequest.sampleSizeRule());
        }
        if (req.getSlaMs() <= 0) {
            throw new OperationFailureException("Probe payload requires a positive 'sla_ms'");
        }
        if (req.getMethod() != null && !METHODS.contains(req.getMethod().toUpperCase(Locale.ROOT))) {
            throw new OperationFailureException("Unsupported probe method: " + req.getMethod());
        }
        return req;
    }
}
