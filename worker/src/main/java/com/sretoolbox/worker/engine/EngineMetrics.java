package com.sretoolbox.worker.engine;

/**
 * Metrics hook for job execution. Default is no-op.
 */
public interface EngineMetrics {
    void jobStarted();

    /** {@code outcome} is a terminal status name, or {@code abandoned}/{@code skipped}. */
    void jobFinished(String outcome, double seconds);

    static EngineMetrics noop() {
        return new EngineMetrics() {
            public void jobStarted() {
            }

            public void jobFinished(String outcome, double seconds) {
            }
        };
    }
}
