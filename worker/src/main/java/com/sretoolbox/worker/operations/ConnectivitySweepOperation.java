package com.sretoolbox.worker.operations;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.errors.OperationFailureException;
import com.sretoolbox.worker.engine.CancelSignal;
import com.sretoolbox.worker.engine.ProgressReporter;
import com.sretoolbox.worker.engine.ToolkitOperation;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * TCP reachability sweep over {@code endpoints[].ports[]}, repeated {@code repetitions} times.
 */
public class ConnectivitySweepOperation implements ToolkitOperation {
    public static final String NAME = "connectivity_sweep";

    private final ConnectivityChecker checker;
    private final ObjectMapper mapper;

    public ConnectivitySweepOperation(ConnectivityChecker checker, ObjectMapper mapper) {
        this.checker = checker;
        this.mapper = mapper;
    }

    private static final class Target {
        final String host;
        final int port;
        final String protocol;

        Target(String host, int port, String protocol) {
            this.host = host;
            this.port = port;
            this.protocol = protocol;
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JsonNode execute(JobDescriptor job, ProgressReporter progress, CancelSignal cancel) throws Exception {
        JsonNode payload = job.getPayload() == null ? mapper.createObjectNode() : job.getPayload();
        int repetitions = Math.max(1, payload.path("repetitions").asInt(1));
        Duration timeout = Duration.ofMillis(Math.max(1, payload.path("timeout_ms").asLong(2000)));
        List<Target> targets = targets(payload.path("endpoints"));

        ObjectNode result = mapper.createObjectNode();
        ArrayNode results = mapper.createArrayNode();
        if (targets.isEmpty()) {
            progress.log("No endpoints configured; nothing to probe");
            result.put("ok", true).put("total_probes", 0).put("failures", 0).put("repetitions", repetitions);
            result.set("results", results);
            return result;
        }

        int total = targets.size() * repetitions;
        int done = 0;
        int failures = 0;
        for (int attempt = 1; attempt <= repetitions; attempt++) {
            for (Target t : targets) {
                cancel.checkpoint();
                ObjectNode r = probe(t, timeout, attempt);
                if (!"reachable".equals(r.get("status").asText())) {
                    failures++;
                }
                results.add(r);
                done++;
                progress.report(done * 100 / total, "attempt " + attempt + ": " + t.host + ":" + t.port + "/"
                        + t.protocol + " " + r.get("message").asText());
            }
        }
        result.put("ok", failures == 0).put("total_probes", total).put("failures", failures)
                .put("repetitions", repetitions);
        result.set("results", results);
        return result;
    }

    private ObjectNode probe(Target t, Duration timeout, int attempt) {
        ObjectNode r = mapper.createObjectNode()
                .put("host", t.host)
                .put("port", t.port)
                .put("protocol", t.protocol)
                .put("attempt", attempt);
        if (!"tcp".equals(t.protocol)) {
            return r.put("status", "unsupported").putNull("latency_ms")
                    .put("message", "protocol " + t.protocol + " is not supported");
        }
        try {
            double latency = Math.round(checker.connect(t.host, t.port, timeout) * 100.0) / 100.0;
            return r.put("status", "reachable").put("latency_ms", latency).put("message", latency + " ms");
        } catch (IOException e) {
            return r.put("status", "unreachable").putNull("latency_ms")
                    .put("message", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private static List<Target> targets(JsonNode endpoints) {
        List<Target> out = new ArrayList<>();
        for (JsonNode endpoint : endpoints) {
            String host = endpoint.path("host").asText("");
            if (host.isBlank()) {
                throw new OperationFailureException("Every endpoint needs a 'host'");
            }
            for (JsonNode port : endpoint.path("ports")) {
                int number = port.isInt() ? port.asInt() : port.path("port").asInt(-1);
                if (number < 1 || number > 65535) {
                    throw new OperationFailureException("Invalid port for host " + host + ": " + port);
                }
                String protocol = port.path("protocol").asText("tcp").toLowerCase(Locale.ROOT);
                out.add(new Target(host, number, protocol));
            }
        }
        return out;
    }
}
