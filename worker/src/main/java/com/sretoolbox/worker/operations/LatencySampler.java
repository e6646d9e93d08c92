package com.sretoolbox.worker.operations;

import java.io.IOException;

public interface LatencySampler {

    /** Issues one request and returns the time to a response, in milliseconds. */
    double measureMillis(String url, String method) throws IOException, InterruptedException;
}
