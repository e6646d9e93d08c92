package com.sretoolbox.worker.operations;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Applies one action to one host on a remote monitoring endpoint.
 */
public interface HostActionClient {
    void apply(String endpoint, String action, JsonNode host, String token) throws IOException, InterruptedException;
}
