package com.sretoolbox.probe;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.errors.ProgressStoreException;
import com.sretoolbox.support.Json;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class CassandraProbeHistoryStore implements ProbeHistoryStore {
    private final CqlSession session;
    private final ObjectMapper mapper;

    private final PreparedStatement insertStmt;
    private final PreparedStatement selectStmt;
    private final PreparedStatement selectOverflowStmt;
    private final PreparedStatement deleteStmt;

    public CassandraProbeHistoryStore(CqlSession session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
        this.insertStmt = session.prepare(
                "INSERT INTO probe_history (template_id, recorded_at, entry_id, job_id, summary) VALUES (?, ?, ?, ?, ?)");
        this.selectStmt = session.prepare(
                "SELECT template_id, recorded_at, job_id, summary FROM probe_history WHERE template_id = ? LIMIT ?");
        this.selectOverflowStmt = session.prepare(
                "SELECT recorded_at, entry_id FROM probe_history WHERE template_id = ? LIMIT ?");
        this.deleteStmt = session.prepare(
                "DELETE FROM probe_history WHERE template_id = ? AND recorded_at = ? AND entry_id = ?");
    }

    @Override
    public void record(ProbeHistoryEntry entry) {
        execute(insertStmt.bind(entry.getTemplateId(), entry.getRecordedAt(), Uuids.timeBased(), entry.getJobId(),
                Json.write(mapper, entry.getSummary())));
        trim(entry.getTemplateId());
    }

    private void trim(String templateId) {
        int index = 0;
        // a few concurrent inserts may push past the bound before the next trim catches up
        for (Row row : execute(selectOverflowStmt.bind(templateId, MAX_ENTRIES + 16))) {
            if (index++ >= MAX_ENTRIES) {
                execute(deleteStmt.bind(templateId, row.getInstant("recorded_at"), row.getUuid("entry_id")));
            }
        }
    }

    @Override
    public Optional<ProbeHistoryEntry> latest(String templateId) {
        List<ProbeHistoryEntry> newest = list(templateId, 1);
        return newest.isEmpty() ? Optional.empty() : Optional.of(newest.get(0));
    }

    @Override
    public List<ProbeHistoryEntry> list(String templateId, int limit) {
        List<ProbeHistoryEntry> out = new ArrayList<>();
        if (limit <= 0) {
            return out;
        }
        for (Row row : execute(selectStmt.bind(templateId, Math.min(limit, MAX_ENTRIES)))) {
            out.add(ProbeHistoryEntry.builder()
                    .templateId(row.getString("template_id"))
                    .recordedAt(row.getInstant("recorded_at"))
                    .jobId(row.getString("job_id"))
                    .summary(Json.read(mapper, row.getString("summary"), ProbeExecutionSummary.class))
                    .build());
        }
        return out;
    }

    private ResultSet execute(BoundStatement statement) {
        try {
            return session.execute(statement.setConsistencyLevel(DefaultConsistencyLevel.LOCAL_QUORUM));
        } catch (DriverException e) {
            throw new ProgressStoreException("probe history store unavailable: " + e.getMessage(), e);
        }
    }
}
