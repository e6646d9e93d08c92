package com.sretoolbox.worker.operations;

import java.io.IOException;
import java.time.Duration;

public interface ConnectivityChecker {

    /** Opens and closes one TCP connection, returning the connect time in milliseconds. */
    double connect(String host, int port, Duration timeout) throws IOException;
}
