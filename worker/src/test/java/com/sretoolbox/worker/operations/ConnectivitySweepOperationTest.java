package com.sretoolbox.worker.operations;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.errors.OperationFailureException;
import com.sretoolbox.support.Json;
import java.io.IOException;
import org.junit.Test;

public class ConnectivitySweepOperationTest {
    private final ObjectMapper mapper = Json.newMapper();
    private final FakeProgress progress = new FakeProgress();
    private final ConnectivityChecker checker = (host, port, timeout) -> {
        if (host.equals("down")) {
            throw new IOException("Connection refused");
        }
        return 1.234;
    };
    private final ConnectivitySweepOperation operation = new ConnectivitySweepOperation(checker, mapper);

    private JobDescriptor job(String payload) throws Exception {
        return JobDescriptor.builder().jobId("job-1").operation(ConnectivitySweepOperation.NAME)
                .payload(mapper.readTree(payload)).build();
    }

    @Test
    public void sweepsEveryPortForEveryRepetition() throws Exception {
        JsonNode result = operation.execute(job("{\"endpoints\":["
                + "{\"host\":\"db\",\"ports\":[5432,{\"port\":53,\"protocol\":\"udp\"}]},"
                + "{\"host\":\"down\",\"ports\":[22]}],\"repetitions\":2}"), progress, progress);

        assertThat(result.get("total_probes").asInt(), is(6));
        assertThat(result.get("failures").asInt(), is(4));
        assertThat(result.get("ok").asBoolean(), is(false));
        assertThat(result.get("repetitions").asInt(), is(2));

        JsonNode first = result.get("results").get(0);
        assertThat(first.get("status").asText(), is("reachable"));
        assertThat(first.get("latency_ms").asDouble(), is(1.23));
        assertThat(result.get("results").get(1).get("status").asText(), is("unsupported"));
        assertThat(result.get("results").get(2).get("status").asText(), is("unreachable"));
        assertThat(result.get("results").get(2).get("message").asText(), is("Connection refused"));
        assertThat(result.get("results").get(5).get("attempt").asInt(), is(2));

        assertThat(progress.percents.size(), is(6));
        assertThat(progress.percents.get(5), is(100));
    }

    @Test
    public void noEndpointsSucceedsWithoutProbing() throws Exception {
        JsonNode result = operation.execute(job("{}"), progress, progress);

        assertThat(result.get("ok").asBoolean(), is(true));
        assertThat(result.get("total_probes").asInt(), is(0));
        assertThat(progress.lines, hasItem("No endpoints configured; nothing to probe"));
    }

    @Test(expected = OperationFailureException.class)
    public void outOfRangePortIsRejected() throws Exception {
        operation.execute(job("{\"endpoints\":[{\"host\":\"db\",\"ports\":[70000]}]}"), progress, progress);
    }

    @Test(expected = OperationFailureException.class)
    public void endpointWithoutHostIsRejected() throws Exception {
        operation.execute(job("{\"endpoints\":[{\"ports\":[80]}]}"), progress, progress);
    }
}
