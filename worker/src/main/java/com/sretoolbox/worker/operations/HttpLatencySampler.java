package com.sretoolbox.worker.operations;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Measures request latency with the JDK HTTP client. Any HTTP status counts as a response.
 */
public class HttpLatencySampler implements LatencySampler {
    private final HttpClient client;
    private final Duration timeout;

    public HttpLatencySampler(HttpClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public double measureMillis(String url, String method) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        long t0 = System.nanoTime();
        client.send(req, HttpResponse.BodyHandlers.discarding());
        return (System.nanoTime() - t0) / 1_000_000.0;
    }
}
