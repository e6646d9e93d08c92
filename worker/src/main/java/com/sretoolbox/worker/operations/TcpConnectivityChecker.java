package com.sretoolbox.worker.operations;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

public class TcpConnectivityChecker implements ConnectivityChecker {

    @Override
    public double connect(String host, int port, Duration timeout) throws IOException {
        long t0 = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
        }
        return (System.nanoTime() - t0) / 1_000_000.0;
    }
}
