package com.sretoolbox.store;

import com.datastax.oss.driver.api.core.CqlSession;

import java.util.List;

public final class CassandraSchema {
    private CassandraSchema() {
    }

    static final List<String> TABLES = List.of(
            "CREATE TABLE IF NOT EXISTS jobs (job_id text PRIMARY KEY, status text, progress int, operation text, "
                    + "toolkit text, type text, payload text, result text, error text, cancel_requested boolean, "
                    + "worker_id text, version bigint, created_at timestamp, updated_at timestamp)",
            "CREATE TABLE IF NOT EXISTS jobs_by_status (status text, job_id text, PRIMARY KEY (status, job_id))",
            "CREATE TABLE IF NOT EXISTS job_logs (job_id text, seq timeuuid, ts timestamp, message text, "
                    + "PRIMARY KEY (job_id, seq)) WITH CLUSTERING ORDER BY (seq DESC)",
            "CREATE TABLE IF NOT EXISTS job_queue (bucket_id int, enqueued_at timestamp, job_id text, "
                    + "descriptor text, lease_expires_at timestamp, leased_by text, "
                    + "PRIMARY KEY (bucket_id, enqueued_at, job_id))",
            "CREATE TABLE IF NOT EXISTS probe_templates (template_id text PRIMARY KEY, name text, description text, "
                    + "url text, method text, sla_ms int, interval_seconds int, notification_rules text, "
                    + "tags list<text>, next_run_at timestamp, created_at timestamp, updated_at timestamp)",
            "CREATE TABLE IF NOT EXISTS probe_history (template_id text, recorded_at timestamp, entry_id timeuuid, "
                    + "job_id text, summary text, PRIMARY KEY (template_id, recorded_at, entry_id)) "
                    + "WITH CLUSTERING ORDER BY (recorded_at DESC, entry_id DESC)");

    public static void createTables(CqlSession session) {
        for (String ddl : TABLES) {
            session.execute(ddl);
        }
    }
}
