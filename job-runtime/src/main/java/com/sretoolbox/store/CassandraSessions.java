package com.sretoolbox.store;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.sretoolbox.support.RuntimeSettings;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

@Slf4j
public final class CassandraSessions {
    private CassandraSessions() {
    }

    /**
     * Opens a keyspace-bound session, creating the keyspace and tables on first use.
     */
    public static CqlSession open(RuntimeSettings settings) {
        // Build session WITHOUT keyspace first to allow auto-create if missing
        try (CqlSession bootstrap = CqlSession.builder()
                .addContactPoint(new InetSocketAddress(settings.getContactPoint(), settings.getPort()))
                .withLocalDatacenter(settings.getLocalDc())
                .build()) {
            ensureKeyspace(bootstrap, settings.getKeyspace(), settings.getReplicationFactor());
        }
        // Rebuild session bound to keyspace to avoid runtime keyspace change warnings
        CqlSession session = CqlSession.builder()
                .addContactPoint(new InetSocketAddress(settings.getContactPoint(), settings.getPort()))
                .withLocalDatacenter(settings.getLocalDc())
                .withKeyspace(settings.getKeyspace())
                .build();
        CassandraSchema.createTables(session);
        return session;
    }

    static void ensureKeyspace(CqlSession session, String keyspace, int replicationFactor) {
        ResultSet rs = session.execute(
                "SELECT keyspace_name FROM system_schema.keyspaces WHERE keyspace_name='" + keyspace + "'");
        if (rs.one() == null) {
            log.info("Keyspace '{}' not found, creating (replication_factor={})", keyspace, replicationFactor);
            session.execute("CREATE KEYSPACE IF NOT EXISTS " + keyspace
                    + " WITH replication = {'class':'SimpleStrategy','replication_factor':" + replicationFactor + "}");
        } else {
            log.debug("Keyspace '{}' exists", keyspace);
        }
    }
}
