package com.sretoolbox.scheduler.metrics;

/**
 * Metrics hook for the control plane. Default is no-op.
 */
public interface SchedulerMetrics {
    void probeJobEnqueued();

    void jobsReaped(int count);

    void httpRequest(String path, String method, int status);

    static SchedulerMetrics noop() {
        return new SchedulerMetrics() {
            public void probeJobEnqueued() {
            }

            public void jobsReaped(int count) {
            }

            public void httpRequest(String path, String method, int status) {
            }
        };
    }
}
