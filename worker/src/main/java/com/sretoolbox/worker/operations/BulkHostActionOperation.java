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
import com.sretoolbox.worker.secrets.SecretResolver;

import java.io.IOException;

/**
 * Applies {@code action} to every host in {@code hosts} through a monitoring endpoint, authenticating with a
 * credential resolved for the job's toolkit. {@code dry_run} walks the hosts without calling the endpoint.
 */
public class BulkHostActionOperation implements ToolkitOperation {
    public static final String NAME = "bulk_host_action";

    private final SecretResolver secrets;
    private final HostActionClient client;
    private final ObjectMapper mapper;

    public BulkHostActionOperation(SecretResolver secrets, HostActionClient client, ObjectMapper mapper) {
        this.secrets = secrets;
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JsonNode execute(JobDescriptor job, ProgressReporter progress, CancelSignal cancel) throws Exception {
        JsonNode payload = job.getPayload() == null ? mapper.createObjectNode() : job.getPayload();
        String action = payload.path("action").asText("");
        String endpoint = payload.path("endpoint").asText("");
        boolean dryRun = payload.path("dry_run").asBoolean(false);
        JsonNode hosts = payload.path("hosts");
        if (action.isBlank() || !action.matches("[A-Za-z0-9_-]+")) {
            throw new OperationFailureException("Payload requires a valid 'action'");
        }
        if (endpoint.isBlank() && !dryRun) {
            throw new OperationFailureException("Payload requires 'endpoint'");
        }
        String token = secrets.resolve(job.getToolkit(), payload.path("credential").asText("api_token"));

        int total = hosts.size();
        progress.log((dryRun ? "Dry run: " : "") + "Applying '" + action + "' to " + total + " host(s)");
        ArrayNode failed = mapper.createArrayNode();
        int processed = 0;
        for (int i = 0; i < total; i++) {
            cancel.checkpoint();
            JsonNode host = hosts.get(i);
            String name = host.isTextual() ? host.asText() : host.path("host").asText("");
            if (name.isBlank()) {
                name = "host-" + (i + 1);
            }
            String line;
            if (dryRun) {
                line = "Dry run: would apply '" + action + "' to host '" + name + "'";
                processed++;
            } else {
                try {
                    client.apply(endpoint, action, host, token);
                    line = "Applied '" + action + "' to host '" + name + "'";
                    processed++;
                } catch (IOException e) {
                    failed.add(mapper.createObjectNode().put("host", name).put("error", e.getMessage()));
                    line = "Failed to apply '" + action + "' to host '" + name + "': " + e.getMessage();
                }
            }
            progress.report((i + 1) * 100 / total, line + " (" + (i + 1) + "/" + total + ")");
        }
        if (total > 0 && processed == 0) {
            throw new OperationFailureException("All " + total + " host(s) failed; first error: "
                    + failed.get(0).path("error").asText());
        }
        ObjectNode result = mapper.createObjectNode()
                .put("action", action)
                .put("processed", processed)
                .put("dry_run", dryRun);
        result.set("failed", failed);
        return result;
    }
}
