package com.sretoolbox.probe;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.errors.ProgressStoreException;
import com.sretoolbox.support.Json;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Probe templates on Cassandra. The scheduler's claim on a tick is a lightweight transaction
 * {@code IF next_run_at = ?}, so two scheduler replicas reading the same due template fire it once.
 */
public class CassandraProbeTemplateStore implements ProbeTemplateStore {
    private static final TypeReference<List<NotificationRule>> RULES = new TypeReference<>() {
    };

    private final CqlSession session;
    private final ObjectMapper mapper;

    private final PreparedStatement insertStmt;
    private final PreparedStatement selectStmt;
    private final PreparedStatement selectAllStmt;
    private final PreparedStatement updateStmt;
    private final PreparedStatement deleteStmt;
    private final PreparedStatement claimStmt;
    private final PreparedStatement claimUnsetStmt;
    private final PreparedStatement rescheduleStmt;

    public CassandraProbeTemplateStore(CqlSession session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
        String columns = "template_id, name, description, url, method, sla_ms, interval_seconds, notification_rules, "
                + "tags, next_run_at, created_at, updated_at";
        this.insertStmt = session.prepare("INSERT INTO probe_templates (" + columns
                + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) IF NOT EXISTS");
        this.selectStmt = session.prepare("SELECT " + columns + " FROM probe_templates WHERE template_id = ?");
        this.selectAllStmt = session.prepare("SELECT " + columns + " FROM probe_templates");
        this.updateStmt = session.prepare("UPDATE probe_templates SET name = ?, description = ?, url = ?, method = ?, "
                + "sla_ms = ?, interval_seconds = ?, notification_rules = ?, tags = ?, updated_at = ? "
                + "WHERE template_id = ? IF EXISTS");
        this.deleteStmt = session.prepare("DELETE FROM probe_templates WHERE template_id = ? IF EXISTS");
        this.claimStmt = session.prepare(
                "UPDATE probe_templates SET next_run_at = ? WHERE template_id = ? IF next_run_at = ?");
        this.claimUnsetStmt = session.prepare(
                "UPDATE probe_templates SET next_run_at = ? WHERE template_id = ? IF next_run_at = null");
        this.rescheduleStmt = session.prepare(
                "UPDATE probe_templates SET next_run_at = ? WHERE template_id = ? IF EXISTS");
    }

    @Override
    public void create(ProbeTemplate t) {
        Row row = execute(insertStmt.bind(t.getId(), t.getName(), t.getDescription(), t.getUrl(), t.getMethod(),
                t.getSlaMs(), t.getIntervalSeconds(), Json.write(mapper, t.getNotificationRules()), t.getTags(),
                t.getNextRunAt(), t.getCreatedAt(), t.getUpdatedAt())).one();
        if (row == null || !row.getBoolean("[applied]")) {
            throw new IllegalStateException("probe template " + t.getId() + " already exists");
        }
    }

    @Override
    public Optional<ProbeTemplate> get(String templateId) {
        Row row = execute(selectStmt.bind(templateId)).one();
        return row == null ? Optional.empty() : Optional.of(fromRow(row));
    }

    @Override
    public List<ProbeTemplate> list() {
        List<ProbeTemplate> all = new ArrayList<>();
        for (Row row : execute(selectAllStmt.bind())) {
            all.add(fromRow(row));
        }
        all.sort(Comparator.comparing(ProbeTemplate::getId));
        return all;
    }

    @Override
    public boolean update(ProbeTemplate t) {
        return applied(execute(updateStmt.bind(t.getName(), t.getDescription(), t.getUrl(), t.getMethod(),
                t.getSlaMs(), t.getIntervalSeconds(), Json.write(mapper, t.getNotificationRules()), t.getTags(),
                t.getUpdatedAt(), t.getId())));
    }

    @Override
    public boolean delete(String templateId) {
        return applied(execute(deleteStmt.bind(templateId)));
    }

    @Override
    public boolean compareAndSetNextRun(String templateId, Instant expected, Instant next) {
        BoundStatement stmt = expected == null
                ? claimUnsetStmt.bind(next, templateId)
                : claimStmt.bind(next, templateId, expected);
        return applied(execute(stmt));
    }

    @Override
    public void rescheduleNextRun(String templateId, Instant next) {
        execute(rescheduleStmt.bind(next, templateId));
    }

    private ProbeTemplate fromRow(Row r) {
        return ProbeTemplate.builder()
                .id(r.getString("template_id"))
                .name(r.getString("name"))
                .description(r.getString("description"))
                .url(r.getString("url"))
                .method(r.getString("method"))
                .slaMs(r.getInt("sla_ms"))
                .intervalSeconds(r.getInt("interval_seconds"))
                .notificationRules(readRules(r.getString("notification_rules")))
                .tags(r.isNull("tags") ? List.of() : r.getList("tags", String.class))
                .nextRunAt(r.getInstant("next_run_at"))
                .createdAt(r.getInstant("created_at"))
                .updatedAt(r.getInstant("updated_at"))
                .build();
    }

    private List<NotificationRule> readRules(String raw) {
        if (raw == null) {
            return List.of();
        }
        try {
            return mapper.readValue(raw, RULES);
        } catch (IOException e) {
            throw new IllegalArgumentException("stored notification rules are malformed: " + e.getMessage(), e);
        }
    }

    private static boolean applied(ResultSet rs) {
        Row row = rs.one();
        return row != null && row.getBoolean("[applied]");
    }

    private ResultSet execute(BoundStatement statement) {
        try {
            return session.execute(statement.setConsistencyLevel(DefaultConsistencyLevel.LOCAL_QUORUM));
        } catch (DriverException e) {
            throw new ProgressStoreException("probe template store unavailable: " + e.getMessage(), e);
        }
    }
}
