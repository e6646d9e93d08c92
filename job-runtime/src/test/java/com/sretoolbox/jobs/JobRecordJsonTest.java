package com.sretoolbox.jobs;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.support.Json;
import java.time.Instant;
import java.util.List;
import org.junit.Test;

public class JobRecordJsonTest {
    private final ObjectMapper mapper = Json.newMapper();

    @Test
    public void serializesWireShape() throws Exception {
        Instant ts = Instant.parse("2024-05-01T10:00:00Z");
        JobRecord r = JobRecord.builder()
                .id("j1")
                .status(JobStatus.RUNNING)
                .progress(40)
                .operation("probe")
                .logs(List.of(JobLogEntry.of(ts, "Job execution started")))
                .cancelRequested(true)
                .version(7)
                .createdAt(ts)
                .updatedAt(ts)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(r));

        assertThat(json.get("status").asText(), is("running"));
        assertThat(json.get("created_at").asText(), is("2024-05-01T10:00:00Z"));
        assertThat(json.get("cancel_requested").asBoolean(), is(true));
        assertThat(json.get("logs").get(0).get("ts").asText(), is("2024-05-01T10:00:00Z"));
        assertThat(json.get("logs").get(0).get("message").asText(), is("Job execution started"));
        assertThat(json.has("result"), is(false));
        assertThat(json.has("error"), is(false));
        assertThat(json.has("version"), is(false));
        assertThat(json.has("terminal"), is(false));
    }

    @Test
    public void readsBackStatusCaseInsensitively() throws Exception {
        JobRecord r = mapper.readValue("{\"id\":\"j1\",\"status\":\"SUCCEEDED\",\"progress\":100}", JobRecord.class);
        assertThat(r.getStatus(), is(JobStatus.SUCCEEDED));
        assertThat(r.getLogs().isEmpty(), is(true));
    }
}
