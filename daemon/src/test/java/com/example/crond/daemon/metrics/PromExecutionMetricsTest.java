package com.example.crond.daemon.metrics;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.Before;
import org.junit.Test;

import com.example.crond.metrics.ExecutionMetrics;

import io.prometheus.client.CollectorRegistry;

public class PromExecutionMetricsTest {
    private CollectorRegistry registry;
    private PromExecutionMetrics metrics;

    @Before
    public void setUp() {
        registry = new CollectorRegistry();
        metrics = new PromExecutionMetrics(registry);
    }

    @Test
    public void countsExecutionsByTaskAndOutcome() {
        metrics.observeExecution("backup", ExecutionMetrics.OUTCOME_SUCCESS, 0.2);
        metrics.observeExecution("backup", ExecutionMetrics.OUTCOME_SUCCESS, 0.3);
        metrics.observeExecution("backup", ExecutionMetrics.OUTCOME_TIMED_OUT, 5.0);

        assertThat(registry.getSampleValue("crond_executions_total",
                new String[]{"task", "outcome"}, new String[]{"backup", "success"}), is(2.0));
        assertThat(registry.getSampleValue("crond_executions_total",
                new String[]{"task", "outcome"}, new String[]{"backup", "timed_out"}), is(1.0));
        assertThat(registry.getSampleValue("crond_execution_duration_seconds_count",
                new String[]{"task"}, new String[]{"backup"}), is(3.0));
    }

    @Test
    public void tracksAlertsAndActiveJobs() {
        metrics.incAlertSent();
        metrics.incAlertFailed();
        metrics.incAlertFailed();
        metrics.setActiveJobs(4);

        assertThat(registry.getSampleValue("crond_alerts_sent_total"), is(1.0));
        assertThat(registry.getSampleValue("crond_alerts_failed_total"), is(2.0));
        assertThat(registry.getSampleValue("crond_active_jobs"), is(4.0));
    }

    @Test
    public void serverExposesMetricsAndProbes() throws Exception {
        metrics.setActiveJobs(2);
        AtomicBoolean ready = new AtomicBoolean(false);
        HttpClient client = HttpClient.newHttpClient();

        try (MetricsServer server = MetricsServer.start(0, registry, ready::get)) {
            String base = "http://127.0.0.1:" + server.getPort();

            HttpResponse<String> scrape = get(client, base + "/metrics");
            assertThat(scrape.statusCode(), is(200));
            assertThat(scrape.body(), containsString("crond_active_jobs 2.0"));

            assertThat(get(client, base + "/healthz").statusCode(), is(200));
            assertThat(get(client, base + "/readyz").statusCode(), is(503));
            ready.set(true);
            assertThat(get(client, base + "/readyz").statusCode(), is(200));
        }
    }

    private static HttpResponse<String> get(HttpClient client, String url) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(URI.create(url)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }
}
