package com.example.crond.alert;

import com.example.crond.metrics.ExecutionMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts {@code {"text": "..."}} to a chat-style webhook. Failures are logged, never thrown.
 */
public class WebhookAlerter implements Alerter {
    private static final Logger logger = LoggerFactory.getLogger(WebhookAlerter.class);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;
    private final ExecutionMetrics metrics;

    public WebhookAlerter(Duration requestTimeout, ExecutionMetrics metrics) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), new ObjectMapper(), requestTimeout,
                metrics);
    }

    public WebhookAlerter(HttpClient client, ObjectMapper mapper, Duration requestTimeout, ExecutionMetrics metrics) {
        this.client = client;
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
        this.metrics = (metrics == null ? ExecutionMetrics.noop() : metrics);
    }

    static String formatText(String taskName, String message) {
        return "**crond Task Failed** \n\n**Task:** `" + taskName + "`\n**Error** " + message;
    }

    @Override
    public void alert(String webhookUrl, String taskName, String message) {
        try {
            ObjectNode payload = mapper.createObjectNode();
            payload.put("text", formatText(taskName, message));
            HttpRequest request = HttpRequest.newBuilder(URI.create(webhookUrl))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(payload)))
                    .build();
            HttpResponse<Void> res = client.send(request, HttpResponse.BodyHandlers.discarding());
            int code = res.statusCode();
            if (code >= 200 && code < 300) {
                logger.info("[{}] Webhook alert sent successfully.", taskName);
                metrics.incAlertSent();
            } else {
                logger.error("[{}] Failed to send webhook. Status: {}", taskName, code);
                metrics.incAlertFailed();
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.error("[{}] Failed to send webhook: {}", taskName, e.getMessage());
            metrics.incAlertFailed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("[{}] Webhook alert interrupted", taskName);
            metrics.incAlertFailed();
        }
    }
}
