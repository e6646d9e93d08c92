package com.sretoolbox.metrics;

/**
 * Metrics hook for compare-and-set traffic against the progress store. Default is no-op.
 */
public interface StoreMetrics {
    void observeCasLatencySeconds(String op, double seconds);

    void incCasConflict(String op);

    static StoreMetrics noop() {
        return new StoreMetrics() {
            public void observeCasLatencySeconds(String op, double seconds) {
            }

            public void incCasConflict(String op) {
            }
        };
    }
}
