package io.github.pierce.xmlflat.warehouse;

import io.github.pierce.xmlflat.DenormalizedResult;
import io.github.pierce.xmlflat.FlattenedTable;
import io.github.pierce.xmlflat.schema.ColumnType;
import io.github.pierce.xmlflat.schema.IdentifierNormalizer;
import io.github.pierce.xmlflat.schema.SchemaRegistry;
import io.github.pierce.xmlflat.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * {@link WarehouseLoader} over plain JDBC.
 *
 * <p>For each table: create it from the first row's inferred schema if it
 * does not exist, add missing columns as {@code VARCHAR(500)}, batch-insert
 * every row with all values bound as text, then commit. Any failure rolls
 * back that table only and the next table proceeds.</p>
 *
 * <p>Identifiers are quoted. Table and column existence is read through
 * {@link DatabaseMetaData}.</p>
 */
public class JdbcWarehouseLoader implements WarehouseLoader {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcWarehouseLoader.class);

    private final WarehouseConfig config;
    private final ConnectionFactory connectionFactory;
    private final SchemaRegistry registry = new SchemaRegistry();

    public JdbcWarehouseLoader(WarehouseConfig config) {
        this(config, () -> DriverManager.getConnection(config.getJdbcUrl(), config.getUser(), config.getPassword()));
    }

    public JdbcWarehouseLoader(WarehouseConfig config, ConnectionFactory connectionFactory) {
        this.config = config;
        this.connectionFactory = connectionFactory;
    }

    /**
     * Opens a session on a fresh connection. The caller owns the session and must close it.
     */
    public LoadSession openSession() {
        Connection connection = null;
        try {
            connection = connectionFactory.open();
            LoadSession session = new LoadSession(connection, config, registry);
            LOG.info("Connected to warehouse - schema: {}", config.getSchema());
            return session;
        } catch (SQLException e) {
            closeQuietly(connection, e);
            LOG.error("Failed to connect to warehouse: {}", e.getMessage());
            throw new WarehouseLoadException("Failed to connect to warehouse: " + e.getMessage(), e);
        }
    }

    @Override
    public LoadReport load(DenormalizedResult result) {
        try (LoadSession session = openSession()) {
            return load(session, result);
        }
    }

    public LoadReport load(LoadSession session, DenormalizedResult result) {
        Map<String, Integer> loaded = new LinkedHashMap<>();
        Map<String, Exception> failed = new LinkedHashMap<>();

        for (FlattenedTable table : result.tables()) {
            String tableName = tableIdentifier(table.getName());
            if (table.size() == 0) {
                LOG.warn("No records to load for table {}", tableName);
                continue;
            }
            try {
                int rows = loadTable(session, tableName, table);
                loaded.put(tableName, rows);
                LOG.info("Loaded {} records into {}", rows, tableName);
            } catch (SQLException | RuntimeException e) {
                rollback(session, tableName, e);
                session.getRegistry().evict(tableName);
                failed.put(tableName, e);
                LOG.error("Failed to load data into {}: {}", tableName, e.getMessage());
            }
        }

        LoadReport report = new LoadReport(loaded, failed);
        report.logSummary();
        return report;
    }

    /**
     * Warehouse identifier for a table: prefix plus name, normalized.
     */
    public String tableIdentifier(String tableName) {
        return IdentifierNormalizer.normalize(config.getTablePrefix() + tableName);
    }

    private int loadTable(LoadSession session, String tableName, FlattenedTable table) throws SQLException {
        Connection connection = session.getConnection();
        List<Map<String, String>> rows = table.normalizedRows();

        ensureTable(connection, session.getRegistry(), tableName, rows.get(0));

        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, String> row : rows) {
            columns.addAll(row.keySet());
        }
        List<String> added = session.getRegistry().widen(tableName, columns,
                (column, type) -> addColumn(connection, tableName, column, type));
        if (!added.isEmpty()) {
            LOG.info("Added {} column(s) to {}: {}", added.size(), tableName, added);
        }

        insertRows(connection, tableName, new ArrayList<>(columns), rows);
        connection.commit();
        return rows.size();
    }

    /**
     * Registers the table's schema, reading it from the target or creating
     * the table from the sample row. Runs once per table across concurrent
     * loads sharing this loader.
     */
    private void ensureTable(Connection connection, SchemaRegistry registry, String tableName,
                             Map<String, String> sampleRow)
            throws SQLException {
        registry.resolve(tableName, () -> {
            Set<String> existingColumns = fetchColumns(connection, tableName);
            if (!existingColumns.isEmpty()) {
                LOG.info("Table {} already exists", tableName);
                return TableSchema.ofExistingColumns(existingColumns);
            }

            TableSchema schema = TableSchema.fromSample(sampleRow);
            StringJoiner definitions = new StringJoiner(", ");
            schema.columns().forEach((column, type) ->
                    definitions.add(IdentifierNormalizer.quote(column) + " " + type.sqlName()));

            String ddl = "CREATE TABLE IF NOT EXISTS " + qualified(tableName) + " (" + definitions + ")";
            try (Statement statement = connection.createStatement()) {
                statement.execute(ddl);
            }
            // Another writer may have created the table first with other columns.
            Set<String> created = fetchColumns(connection, tableName);
            if (!created.isEmpty() && !created.equals(schema.columns().keySet())) {
                LOG.warn("Table {} was created concurrently with columns {}", tableName, created);
                return TableSchema.ofExistingColumns(created);
            }
            LOG.info("Created table: {}", tableName);
            return schema;
        });
    }

    private Set<String> fetchColumns(Connection connection, String tableName) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        String escape = metaData.getSearchStringEscape();
        Set<String> columns = new LinkedHashSet<>();
        try (ResultSet rs = metaData.getColumns(null, escapePattern(config.getSchema(), escape),
                escapePattern(tableName, escape), null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME"));
            }
        }
        return columns;
    }

    private void addColumn(Connection connection, String tableName, String column, ColumnType type)
            throws SQLException {
        String ddl = "ALTER TABLE " + qualified(tableName) + " ADD COLUMN "
                + IdentifierNormalizer.quote(column) + " " + type.sqlName();
        try (Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        }
        LOG.info("Added column {} to {}", column, tableName);
    }

    private void insertRows(Connection connection, String tableName, List<String> columns,
                            List<Map<String, String>> rows) throws SQLException {
        StringJoiner names = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");
        for (String column : columns) {
            names.add(IdentifierNormalizer.quote(column));
            placeholders.add("?");
        }
        String sql = "INSERT INTO " + qualified(tableName) + " (" + names + ") VALUES (" + placeholders + ")";

        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (Map<String, String> row : rows) {
                for (int i = 0; i < columns.size(); i++) {
                    String value = row.get(columns.get(i));
                    if (value == null) {
                        statement.setNull(i + 1, Types.VARCHAR);
                    } else {
                        statement.setString(i + 1, value);
                    }
                }
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private void rollback(LoadSession session, String tableName, Exception cause) {
        try {
            session.getConnection().rollback();
            LOG.debug("Rolled back {}", tableName);
        } catch (SQLException e) {
            cause.addSuppressed(e);
            LOG.error("Rollback of {} failed: {}", tableName, e.getMessage());
        }
    }

    private static void closeQuietly(Connection connection, SQLException cause) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private String qualified(String tableName) {
        return IdentifierNormalizer.quote(config.getSchema()) + "." + IdentifierNormalizer.quote(tableName);
    }

    private static String escapePattern(String value, String escape) {
        if (escape == null || escape.isEmpty()) {
            return value;
        }
        return value.replace(escape, escape + escape)
                .replace("_", escape + "_")
                .replace("%", escape + "%");
    }

    /**
     * Opens connections to the warehouse.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }
}
