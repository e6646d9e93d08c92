package com.sretoolbox.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

/**
 * Prometheus-backed implementation of StoreMetrics.
 */
public class PromStoreMetrics implements StoreMetrics {
    private final Counter casConflicts;
    private final Histogram casLatencySeconds;

    public PromStoreMetrics(CollectorRegistry registry) {
        this.casConflicts = Counter.build()
                .name("store_cas_conflicts_total")
                .help("Compare-and-set writes that were not applied")
                .labelNames("op")
                .register(registry);
        this.casLatencySeconds = Histogram.build()
                .name("store_cas_latency_seconds")
                .help("Latency of compare-and-set operations in seconds")
                .buckets(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
                .labelNames("op")
                .register(registry);
    }

    @Override
    public void observeCasLatencySeconds(String op, double seconds) {
        casLatencySeconds.labels(op).observe(seconds);
    }

    @Override
    public void incCasConflict(String op) {
        casConflicts.labels(op).inc();
    }
}
