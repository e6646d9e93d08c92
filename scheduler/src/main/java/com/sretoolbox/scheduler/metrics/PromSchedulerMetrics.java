package com.sretoolbox.scheduler.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;

/**
 * Prometheus-backed implementation of SchedulerMetrics.
 */
public class PromSchedulerMetrics implements SchedulerMetrics {
    private final Counter probeJobsEnqueued;
    private final Counter jobsReaped;
    private final Counter httpRequestsTotal;

    public PromSchedulerMetrics(CollectorRegistry registry) {
        this.probeJobsEnqueued = Counter.build()
                .name("scheduler_probe_jobs_enqueued_total")
                .help("Probe jobs enqueued by the scheduler tick")
                .register(registry);
        this.jobsReaped = Counter.build()
                .name("reaper_jobs_reaped_total")
                .help("Running jobs finalized as failed after the dead-worker window")
                .register(registry);
        this.httpRequestsTotal = Counter.build()
                .name("http_requests_total")
                .help("Scheduler HTTP requests")
                .labelNames("path", "method", "status")
                .register(registry);
    }

    @Override
    public void probeJobEnqueued() {
        probeJobsEnqueued.inc();
    }

    @Override
    public void jobsReaped(int count) {
        if (count > 0) {
            jobsReaped.inc(count);
        }
    }

    @Override
    public void httpRequest(String path, String method, int status) {
        httpRequestsTotal.labels(path, method, String.valueOf(status)).inc();
    }
}
