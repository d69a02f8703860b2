package io.github.pierce.xmlflat.warehouse;

import io.github.pierce.xmlflat.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection and schema state for one load run.
 *
 * <p>Auto-commit is switched off when the session opens so every table is
 * committed or rolled back on its own. Closing the session closes the
 * connection.</p>
 */
public final class LoadSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LoadSession.class);

    private final Connection connection;
    private final WarehouseConfig config;
    private final SchemaRegistry registry;
    private boolean closed;

    LoadSession(Connection connection, WarehouseConfig config, SchemaRegistry registry) throws SQLException {
        this.connection = connection;
        this.config = config;
        this.registry = registry;
        connection.setAutoCommit(false);
    }

    public Connection getConnection() {
        return connection;
    }

    public WarehouseConfig getConfig() {
        return config;
    }

    public SchemaRegistry getRegistry() {
        return registry;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
            LOG.info("Disconnected from warehouse");
        } catch (SQLException e) {
            LOG.warn("Failed to close warehouse connection cleanly: {}", e.getMessage(), e);
        }
    }
}
