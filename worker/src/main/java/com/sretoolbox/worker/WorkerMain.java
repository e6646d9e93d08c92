package com.sretoolbox.worker;

import com.datastax.oss.driver.api.core.CqlSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.metrics.PromStoreMetrics;
import com.sretoolbox.probe.CassandraProbeHistoryStore;
import com.sretoolbox.probe.NotificationChannel;
import com.sretoolbox.probe.ProbeHistoryStore;
import com.sretoolbox.queue.CassandraTaskQueue;
import com.sretoolbox.queue.TaskQueue;
import com.sretoolbox.store.CassandraProgressStore;
import com.sretoolbox.store.CassandraSessions;
import com.sretoolbox.store.ProgressStore;
import com.sretoolbox.support.EnvConfig;
import com.sretoolbox.support.Json;
import com.sretoolbox.support.RuntimeSettings;
import com.sretoolbox.worker.engine.ExecutionEngine;
import com.sretoolbox.worker.engine.OperationRegistry;
import com.sretoolbox.worker.metrics.PromWorkerMetrics;
import com.sretoolbox.worker.notify.LoggingNotificationSender;
import com.sretoolbox.worker.notify.NotificationDispatcher;
import com.sretoolbox.worker.notify.WebhookNotificationSender;
import com.sretoolbox.worker.operations.BulkHostActionOperation;
import com.sretoolbox.worker.operations.ConnectivitySweepOperation;
import com.sretoolbox.worker.operations.HttpHostActionClient;
import com.sretoolbox.worker.operations.HttpLatencySampler;
import com.sretoolbox.worker.operations.ProbeOperation;
import com.sretoolbox.worker.operations.TcpConnectivityChecker;
import com.sretoolbox.worker.secrets.EnvSecretResolver;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

@Slf4j
public class WorkerMain {
    private static volatile boolean ready = false;

    public static void main(String[] args) throws Exception {
        EnvConfig env = EnvConfig.fromEnvironment();
        WorkerSettings settings = WorkerSettings.from(env);
        RuntimeSettings runtime = settings.getRuntime();
        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = Json.newMapper();
        CollectorRegistry registry = CollectorRegistry.defaultRegistry;

        CqlSession session = CassandraSessions.open(runtime);
        ProgressStore store = new CassandraProgressStore(session, mapper, runtime.getMaxLogLines(), clock,
                new PromStoreMetrics(registry));
        TaskQueue queue = new CassandraTaskQueue(session, mapper, runtime.getQueueBuckets(), runtime.getQueueLease(),
                runtime.getQueuePollInterval(), settings.getWorkerId(), clock);
        ProbeHistoryStore history = new CassandraProbeHistoryStore(session, mapper);

        OperationRegistry operations = defaultOperations(env, settings, history, mapper, clock);
        ExecutionEngine engine = new ExecutionEngine(store, operations, runtime.storeBackoff(),
                settings.getWorkerId(), clock, new PromWorkerMetrics(registry));
        WorkerPool pool = new WorkerPool(queue, engine, settings.getConcurrency());

        HttpServer server = startServer(settings.getHttpPort(), store, registry, () -> ready);
        pool.start();
        ready = true;
        log.info("Worker {} started: http port {}, {} consumer(s), operations {}", settings.getWorkerId(),
                settings.getHttpPort(), settings.getConcurrency(), operations.names());

        // Graceful shutdown hook: stop dequeuing, wait for in-flight jobs
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown initiated");
            ready = false;
            try {
                pool.stop(WorkerSettings.SHUTDOWN_GRACE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            server.stop(1);
            session.close();
            log.info("Shutdown complete");
        }));
    }

    static OperationRegistry defaultOperations(EnvConfig env, WorkerSettings settings, ProbeHistoryStore history,
            ObjectMapper mapper, Clock clock) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(settings.getProbeTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        NotificationDispatcher dispatcher = new NotificationDispatcher(history,
                Map.of(NotificationChannel.WEBHOOK,
                        new WebhookNotificationSender(http, mapper, settings.getNotifyTimeout())),
                new LoggingNotificationSender(), clock);
        return new OperationRegistry()
                .register(new ProbeOperation(new HttpLatencySampler(http, settings.getProbeTimeout()), dispatcher,
                        mapper, clock))
                .register(new ConnectivitySweepOperation(new TcpConnectivityChecker(), mapper))
                .register(new BulkHostActionOperation(new EnvSecretResolver(env),
                        new HttpHostActionClient(http, mapper, settings.getProbeTimeout()), mapper));
    }

    /**
     * Starts {@code /healthz}, {@code /readyz} and {@code /metrics}. Port 0 picks a free port (for tests).
     */
    static HttpServer startServer(int port, ProgressStore store, CollectorRegistry registry, BooleanSupplier ready)
            throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/healthz", exchange -> {
            boolean healthy = store.isHealthy();
            respond(exchange, healthy ? 200 : 503, healthy ? "OK" : "UNHEALTHY");
        });
        server.createContext("/readyz", exchange -> {
            boolean isReady = ready.getAsBoolean();
            respond(exchange, isReady ? 200 : 503, isReady ? "READY" : "NOT_READY");
        });
        server.createContext("/metrics", new MetricsHandlerProm(registry));
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        return server;
    }

    private static void respond(HttpExchange exchange, int code, String body) throws IOException {
        byte[] data = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    static class MetricsHandlerProm implements HttpHandler {
        private final CollectorRegistry registry;

        MetricsHandlerProm(CollectorRegistry registry) {
            this.registry = registry;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            exchange.getResponseHeaders().set("Content-Type", TextFormat.CONTENT_TYPE_004);
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            byte[] data = writer.toString().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, data.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(data);
            }
        }
    }
}
