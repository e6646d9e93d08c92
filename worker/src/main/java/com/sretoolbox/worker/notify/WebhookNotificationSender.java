package com.sretoolbox.worker.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.probe.NotificationRule;
import com.sretoolbox.probe.ProbeExecutionSummary;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * POSTs the summary as JSON to the rule's target URL. Any non-2xx answer is a delivery failure.
 */
public class WebhookNotificationSender implements NotificationSender {
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public WebhookNotificationSender(HttpClient client, ObjectMapper mapper, Duration timeout) {
        this.client = client;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    @Override
    public void send(NotificationRule rule, ProbeExecutionSummary summary) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(rule.getTarget()))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(summary)))
                .build();
        HttpResponse<Void> resp = client.send(req, HttpResponse.BodyHandlers.discarding());
        if (resp.statusCode() / 100 != 2) {
            throw new IOException("webhook " + rule.getTarget() + " answered HTTP " + resp.statusCode());
        }
    }
}
