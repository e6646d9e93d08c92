package com.sretoolbox.worker.metrics;

import com.sretoolbox.worker.engine.EngineMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.hotspot.DefaultExports;

/**
 * Prometheus-backed implementation of EngineMetrics.
 */
public class PromWorkerMetrics implements EngineMetrics {
    private final Counter jobsProcessedTotal;
    private final Gauge jobsInProgress;
    private final Histogram jobDurationSeconds;

    public PromWorkerMetrics(CollectorRegistry registry) {
        // register default JVM metrics once
        DefaultExports.initialize();

        this.jobsProcessedTotal = Counter.build()
                .name("jobs_processed_total")
                .help("Total jobs processed by outcome")
                .labelNames("status")
                .register(registry);
        this.jobsInProgress = Gauge.build()
                .name("jobs_in_progress")
                .help("Jobs currently executing on this worker")
                .register(registry);
        this.jobDurationSeconds = Histogram.build()
                .name("job_duration_seconds")
                .help("Job execution duration in seconds")
                .buckets(0.05, 0.1, 0.25, 0.5, 1, 2, 5, 10, 30, 60)
                .register(registry);
    }

    @Override
    public void jobStarted() {
        jobsInProgress.inc();
    }

    @Override
    public void jobFinished(String outcome, double seconds) {
        jobsInProgress.dec();
        jobsProcessedTotal.labels(outcome).inc();
        jobDurationSeconds.observe(seconds);
    }
}
