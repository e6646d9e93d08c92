package com.sretoolbox.scheduler;

import com.datastax.oss.driver.api.core.CqlSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.JobReaper;
import com.sretoolbox.jobs.JobService;
import com.sretoolbox.jobs.JobStatus;
import com.sretoolbox.jobs.JobSubmission;
import com.sretoolbox.jobs.errors.NotFoundException;
import com.sretoolbox.jobs.errors.QueueUnavailableException;
import com.sretoolbox.metrics.PromStoreMetrics;
import com.sretoolbox.probe.CassandraProbeHistoryStore;
import com.sretoolbox.probe.CassandraProbeTemplateStore;
import com.sretoolbox.probe.ProbeHistoryStore;
import com.sretoolbox.probe.ProbeRequest;
import com.sretoolbox.probe.ProbeTemplateStore;
import com.sretoolbox.queue.CassandraTaskQueue;
import com.sretoolbox.queue.TaskQueue;
import com.sretoolbox.scheduler.api.CancelResponse;
import com.sretoolbox.scheduler.api.ErrorResponse;
import com.sretoolbox.scheduler.api.JobCreatedResponse;
import com.sretoolbox.scheduler.api.ProbeTemplateRequest;
import com.sretoolbox.scheduler.metrics.PromSchedulerMetrics;
import com.sretoolbox.scheduler.metrics.SchedulerMetrics;
import com.sretoolbox.store.CassandraProgressStore;
import com.sretoolbox.store.CassandraSessions;
import com.sretoolbox.store.JobFilter;
import com.sretoolbox.store.ProgressStore;
import com.sretoolbox.support.EnvConfig;
import com.sretoolbox.support.Json;
import com.sretoolbox.support.RuntimeSettings;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.prometheus.client.hotspot.DefaultExports;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

@Slf4j
public class SchedulerMain {
    private static volatile boolean ready = false;
    private static volatile boolean shuttingDown = false;

    public static void main(String[] args) throws Exception {
        EnvConfig env = EnvConfig.fromEnvironment();
        SchedulerSettings settings = SchedulerSettings.from(env);
        RuntimeSettings runtime = settings.getRuntime();
        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = Json.newMapper();
        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        DefaultExports.initialize();

        CqlSession session = CassandraSessions.open(runtime);
        ProgressStore store = new CassandraProgressStore(session, mapper, runtime.getMaxLogLines(), clock,
                new PromStoreMetrics(registry));
        TaskQueue queue = new CassandraTaskQueue(session, mapper, runtime.getQueueBuckets(), runtime.getQueueLease(),
                runtime.getQueuePollInterval(), "scheduler-" + UUID.randomUUID(), clock);
        ProbeTemplateStore templates = new CassandraProbeTemplateStore(session, mapper);
        ProbeHistoryStore history = new CassandraProbeHistoryStore(session, mapper);
        SchedulerMetrics metrics = new PromSchedulerMetrics(registry);

        JobService jobs = new JobService(store, queue, runtime.storeBackoff(), clock);
        ProbeTemplateService templateService = new ProbeTemplateService(templates, history, jobs, mapper,
                settings.getDefaultIntervalSeconds(), clock);
        ProbeScheduler scheduler = new ProbeScheduler(templates, jobs, mapper, settings.getDefaultIntervalSeconds(),
                metrics);
        JobReaper reaper = new JobReaper(store, queue, runtime.getDeadWorkerTimeout(), runtime.getQueueStaleTimeout(),
                runtime.getRetention(), clock);

        HttpServer server = startServer(settings.getHttpPort(), jobs, templateService, store, registry, metrics,
                mapper, () -> ready);
        startLoop("probe-scheduler", settings.getTick(), () -> scheduler.tick(clock.instant()));
        startLoop("job-reaper", settings.getReaperInterval(), () -> metrics.jobsReaped(reaper.reap().getAbandoned()));
        ready = true;
        log.info("Scheduler started: http port {}, tick {}s, reaper every {}s", settings.getHttpPort(),
                settings.getTick().toSeconds(), settings.getReaperInterval().toSeconds());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown initiated");
            ready = false;
            shuttingDown = true;
            server.stop(1);
            queue.close();
            session.close();
            log.info("Shutdown complete");
        }));
    }

    static Thread startLoop(String name, Duration interval, Runnable body) {
        Thread t = new Thread(() -> {
            while (!shuttingDown) {
                try {
                    body.run();
                } catch (RuntimeException e) {
                    log.error("{} iteration failed", name, e);
                }
                try {
                    Thread.sleep(interval.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    /**
     * Starts the job and probe-template API plus {@code /healthz}, {@code /readyz} and {@code /metrics}.
     * Port 0 picks a free port (for tests).
     */
    static HttpServer startServer(int port, JobService jobs, ProbeTemplateService templates, ProgressStore store,
            CollectorRegistry registry, SchedulerMetrics metrics, ObjectMapper mapper, BooleanSupplier ready)
            throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/healthz", exchange -> {
            boolean healthy = store.isHealthy();
            respond(exchange, metrics, healthy ? 200 : 503, healthy ? "OK" : "UNHEALTHY");
        });
        server.createContext("/readyz", exchange -> {
            boolean isReady = ready.getAsBoolean();
            respond(exchange, metrics, isReady ? 200 : 503, isReady ? "READY" : "NOT_READY");
        });
        server.createContext("/metrics", new MetricsHandlerProm(registry));
        server.createContext("/jobs", new JobsHandler(jobs, mapper, metrics));
        server.createContext("/probe-templates", new ProbeTemplatesHandler(templates, mapper, metrics));
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        return server;
    }

    private static void respond(HttpExchange exchange, SchedulerMetrics metrics, int code, String body)
            throws IOException {
        metrics.httpRequest(normalizePath(exchange.getRequestURI().getPath()), exchange.getRequestMethod(), code);
        byte[] data = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    static String normalizePath(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        String[] parts = segments(rawPath);
        if (parts.length < 2 || !(parts[0].equals("jobs") || parts[0].equals("probe-templates"))) {
            return rawPath;
        }
        StringBuilder sb = new StringBuilder("/").append(parts[0]).append("/:id");
        for (int i = 2; i < parts.length; i++) {
            sb.append('/').append(parts[i]);
        }
        return sb.toString();
    }

    private static String[] segments(String path) {
        String trimmed = path.replaceAll("^/+|/+$", "");
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/+");
    }

    static Map<String, List<String>> queryParams(String rawQuery) {
        Map<String, List<String>> out = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return out;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            for (String v : value.split(",")) {
                if (!v.isBlank()) {
                    out.computeIfAbsent(key, k -> new ArrayList<>()).add(v.trim());
                }
            }
        }
        return out;
    }

    private static Integer intParam(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(values.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
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

    /**
     * JSON handler with the shared error mapping: not found 404, bad input 400, queue down 503, anything else 500.
     */
    abstract static class ApiHandler implements HttpHandler {
        protected final ObjectMapper mapper;
        private final SchedulerMetrics metrics;

        ApiHandler(ObjectMapper mapper, SchedulerMetrics metrics) {
            this.mapper = mapper;
            this.metrics = metrics;
        }

        abstract void route(HttpExchange exchange, String[] path) throws IOException;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                route(exchange, segments(exchange.getRequestURI().getPath()));
            } catch (NotFoundException e) {
                respondJson(exchange, 404, ErrorResponse.notFound(e.getMessage()));
            } catch (IllegalArgumentException e) {
                respondJson(exchange, 400, ErrorResponse.badRequest(e.getMessage()));
            } catch (JsonProcessingException e) {
                respondJson(exchange, 400, ErrorResponse.badRequest(e.getOriginalMessage()));
            } catch (QueueUnavailableException e) {
                respondJson(exchange, 503, ErrorResponse.queueUnavailable(e.getMessage()));
            } catch (RuntimeException e) {
                log.error("{} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                respondJson(exchange, 500, ErrorResponse.internal());
            }
        }

        protected <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
            try (InputStream is = exchange.getRequestBody()) {
                return mapper.readValue(is, type);
            }
        }

        protected void respondJson(HttpExchange exchange, int code, Object value) throws IOException {
            byte[] data = mapper.writeValueAsBytes(value);
            metrics.httpRequest(normalizePath(exchange.getRequestURI().getPath()), exchange.getRequestMethod(), code);
            exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
            exchange.sendResponseHeaders(code, data.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(data);
            }
        }

        protected void respondNoContent(HttpExchange exchange) throws IOException {
            metrics.httpRequest(normalizePath(exchange.getRequestURI().getPath()), exchange.getRequestMethod(), 204);
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        }

        protected void methodNotAllowed(HttpExchange exchange) throws IOException {
            respondJson(exchange, 405, ErrorResponse.methodNotAllowed(exchange.getRequestMethod()));
        }

        protected void unknownPath(HttpExchange exchange) throws IOException {
            respondJson(exchange, 404, ErrorResponse.notFound("no route for " + exchange.getRequestURI().getPath()));
        }

        protected static boolean is(HttpExchange exchange, String method) {
            return method.equalsIgnoreCase(exchange.getRequestMethod());
        }
    }

    static class JobsHandler extends ApiHandler {
        private final JobService jobs;

        JobsHandler(JobService jobs, ObjectMapper mapper, SchedulerMetrics metrics) {
            super(mapper, metrics);
            this.jobs = jobs;
        }

        @Override
        void route(HttpExchange exchange, String[] path) throws IOException {
            if (path.length == 1) {
                if (is(exchange, "POST")) {
                    JobSubmission submission = readBody(exchange, JobSubmission.class);
                    if (submission == null) {
                        throw new IllegalArgumentException("request body is required");
                    }
                    if (submission.getOperation() != null
                            && ProbeRequest.OPERATION.equals(submission.getOperation().trim())) {
                        ProbeRequest.checkSampleSize(submission.getPayload());
                    }
                    respondJson(exchange, 201, new JobCreatedResponse(jobs.submit(submission)));
                } else if (is(exchange, "GET")) {
                    respondJson(exchange, 200, jobs.listJobs(filter(exchange.getRequestURI().getRawQuery())));
                } else {
                    methodNotAllowed(exchange);
                }
                return;
            }
            String id = path[1];
            if (path.length == 2) {
                if (is(exchange, "GET")) {
                    respondJson(exchange, 200, jobs.getStatus(id));
                } else {
                    methodNotAllowed(exchange);
                }
                return;
            }
            if (path.length == 3 && path[2].equals("cancel")) {
                if (is(exchange, "POST")) {
                    jobs.requestCancel(id);
                    respondJson(exchange, 202, new CancelResponse(id));
                } else {
                    methodNotAllowed(exchange);
                }
                return;
            }
            unknownPath(exchange);
        }

        private static JobFilter filter(String rawQuery) {
            Map<String, List<String>> params = queryParams(rawQuery);
            Set<JobStatus> statuses = new LinkedHashSet<>();
            for (String s : params.getOrDefault("status", List.of())) {
                statuses.add(JobStatus.fromWire(s));
            }
            Integer limit = intParam(params, "limit");
            Integer offset = intParam(params, "offset");
            if ((limit != null && limit < 0) || (offset != null && offset < 0)) {
                throw new IllegalArgumentException("limit and offset must not be negative");
            }
            return JobFilter.builder()
                    .toolkits(Set.copyOf(params.getOrDefault("toolkit", List.of())))
                    .statuses(statuses)
                    .limit(limit)
                    .offset(offset == null ? 0 : offset)
                    .build();
        }
    }

    static class ProbeTemplatesHandler extends ApiHandler {
        private final ProbeTemplateService templates;

        ProbeTemplatesHandler(ProbeTemplateService templates, ObjectMapper mapper, SchedulerMetrics metrics) {
            super(mapper, metrics);
            this.templates = templates;
        }

        @Override
        void route(HttpExchange exchange, String[] path) throws IOException {
            if (path.length == 1) {
                if (is(exchange, "POST")) {
                    respondJson(exchange, 201, templates.create(readBody(exchange, ProbeTemplateRequest.class)));
                } else if (is(exchange, "GET")) {
                    respondJson(exchange, 200, templates.list());
                } else {
                    methodNotAllowed(exchange);
                }
                return;
            }
            String id = path[1];
            if (path.length == 2) {
                if (is(exchange, "GET")) {
                    respondJson(exchange, 200, templates.get(id));
                } else if (is(exchange, "PUT")) {
                    respondJson(exchange, 200, templates.update(id, readBody(exchange, ProbeTemplateRequest.class)));
                } else if (is(exchange, "DELETE")) {
                    templates.delete(id);
                    respondNoContent(exchange);
                } else {
                    methodNotAllowed(exchange);
                }
                return;
            }
            if (path.length == 3 && path[2].equals("run")) {
                if (is(exchange, "POST")) {
                    respondJson(exchange, 201, new JobCreatedResponse(templates.runNow(id)));
                } else {
                    methodNotAllowed(exchange);
                }
                return;
            }
            if (path.length == 3 && path[2].equals("history")) {
                if (is(exchange, "GET")) {
                    Map<String, List<String>> params = queryParams(exchange.getRequestURI().getRawQuery());
                    respondJson(exchange, 200, templates.history(id, intParam(params, "limit")));
                } else {
                    methodNotAllowed(exchange);
                }
                return;
            }
            unknownPath(exchange);
        }
    }
}
