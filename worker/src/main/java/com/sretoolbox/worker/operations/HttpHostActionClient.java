package com.sretoolbox.worker.operations;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@code POST <endpoint>/hosts/<action>} with the host object as body and a bearer token.
 */
public class HttpHostActionClient implements HostActionClient {
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpHostActionClient(HttpClient client, ObjectMapper mapper, Duration timeout) {
        this.client = client;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    @Override
    public void apply(String endpoint, String action, JsonNode host, String token)
            throws IOException, InterruptedException {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(base + "/hosts/" + action))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + token)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(host)))
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new IOException("HTTP " + resp.statusCode() + ": " + resp.body());
        }
    }
}
