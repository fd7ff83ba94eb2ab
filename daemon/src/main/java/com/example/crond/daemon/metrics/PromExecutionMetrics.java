package com.example.crond.daemon.metrics;

import com.example.crond.metrics.ExecutionMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.hotspot.DefaultExports;

/**
 * Prometheus-backed implementation of ExecutionMetrics.
 */
public class PromExecutionMetrics implements ExecutionMetrics {
    private final Counter executions;
    private final Histogram executionDurationSeconds;
    private final Counter alertsSent;
    private final Counter alertsFailed;
    private final Gauge activeJobs;

    public PromExecutionMetrics(CollectorRegistry registry) {
        // register default JVM metrics once
        DefaultExports.initialize();

        this.executions = Counter.build()
                .name("crond_executions_total")
                .help("Task executions by outcome")
                .labelNames("task", "outcome")
                .register(registry);
        this.executionDurationSeconds = Histogram.build()
                .name("crond_execution_duration_seconds")
                .help("Task execution duration in seconds")
                .buckets(0.05, 0.1, 0.25, 0.5, 1, 2, 5, 10, 30, 60, 300)
                .labelNames("task")
                .register(registry);
        this.alertsSent = Counter.build()
                .name("crond_alerts_sent_total")
                .help("Webhook alerts delivered")
                .register(registry);
        this.alertsFailed = Counter.build()
                .name("crond_alerts_failed_total")
                .help("Webhook alerts that could not be delivered")
                .register(registry);
        this.activeJobs = Gauge.build()
                .name("crond_active_jobs")
                .help("Job loops registered by the last reload")
                .register(registry);
    }

    @Override
    public void observeExecution(String task, String outcome, double seconds) {
        executions.labels(task, outcome).inc();
        executionDurationSeconds.labels(task).observe(seconds);
    }

    @Override
    public void incAlertSent() {
        alertsSent.inc();
    }

    @Override
    public void incAlertFailed() {
        alertsFailed.inc();
    }

    @Override
    public void setActiveJobs(int count) {
        activeJobs.set(count);
    }
}
