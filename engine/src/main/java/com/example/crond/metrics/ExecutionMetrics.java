package com.example.crond.metrics;

/**
 * Minimal metrics hook for the scheduling engine. Default is no-op.
 */
public interface ExecutionMetrics {
    String OUTCOME_SUCCESS = "success";
    String OUTCOME_FAILED = "failed";
    String OUTCOME_TIMED_OUT = "timed_out";
    String OUTCOME_SPAWN_FAILED = "spawn_failed";

    void observeExecution(String task, String outcome, double seconds);

    void incAlertSent();

    void incAlertFailed();

    void setActiveJobs(int count);

    static ExecutionMetrics noop() {
        return new ExecutionMetrics() {
            public void observeExecution(String task, String outcome, double seconds) {
            }

            public void incAlertSent() {
            }

            public void incAlertFailed() {
            }

            public void setActiveJobs(int count) {
            }
        };
    }
}
