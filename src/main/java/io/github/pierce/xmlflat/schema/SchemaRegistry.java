package io.github.pierce.xmlflat.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of known table schemas keyed by table identifier.
 *
 * <p>Widening goes through {@link #widen(String, Iterable, ColumnAdder)},
 * which holds the table schema's monitor while it checks and adds columns,
 * so two concurrent loads of the same table never add the same column
 * twice.</p>
 */
public class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, TableSchema> schemas = new ConcurrentHashMap<>();
    private final Map<String, Object> tableLocks = new ConcurrentHashMap<>();

    /**
     * Registers a schema unless one is already known for the table.
     *
     * @return the schema now registered for the table
     */
    public TableSchema register(String table, TableSchema schema) {
        TableSchema existing = schemas.putIfAbsent(table, schema);
        return existing != null ? existing : schema;
    }

    /**
     * Returns the table's schema, calling {@code loader} to produce it when
     * none is registered. Calls for the same table are serialized, so the
     * loader runs at most once until the table is evicted and no other
     * caller sees a schema the loader did not produce.
     *
     * @throws E if the loader fails; nothing is registered in that case
     */
    public <E extends Exception> TableSchema resolve(String table, SchemaLoader<E> loader) throws E {
        TableSchema known = schemas.get(table);
        if (known != null) {
            return known;
        }
        synchronized (tableLocks.computeIfAbsent(table, k -> new Object())) {
            known = schemas.get(table);
            if (known != null) {
                return known;
            }
            TableSchema schema = loader.load();
            schemas.put(table, schema);
            LOG.debug("Resolved schema for {}: {}", table, schema);
            return schema;
        }
    }

    public Optional<TableSchema> find(String table) {
        return Optional.ofNullable(schemas.get(table));
    }

    /**
     * Adds every identifier the table does not know yet, calling {@code adder}
     * for each one before recording it. If the adder fails, the column stays
     * unknown and the exception propagates.
     *
     * @return identifiers that were added, in order
     * @throws IllegalStateException if no schema is registered for the table
     */
    public <E extends Exception> List<String> widen(String table, Iterable<String> identifiers,
                                                    ColumnAdder<E> adder) throws E {
        TableSchema schema = schemas.get(table);
        if (schema == null) {
            throw new IllegalStateException("No schema registered for table " + table);
        }

        List<String> added = new ArrayList<>();
        synchronized (schema) {
            for (String identifier : identifiers) {
                if (!schema.contains(identifier)) {
                    adder.addColumn(identifier, ColumnType.DEFAULT_TEXT);
                    schema.addColumn(identifier, ColumnType.DEFAULT_TEXT);
                    added.add(identifier);
                    LOG.debug("Widened {} with column {}", table, identifier);
                }
            }
        }
        return added;
    }

    /**
     * Forgets the table's schema so the next load reads it from the target
     * again. Used after a rollback, which may have undone column additions.
     */
    public void evict(String table) {
        schemas.remove(table);
    }

    public int size() {
        return schemas.size();
    }

    /**
     * Reads or creates a table's schema in the underlying target.
     */
    @FunctionalInterface
    public interface SchemaLoader<E extends Exception> {
        TableSchema load() throws E;
    }

    /**
     * Applies a column addition to the underlying target.
     */
    @FunctionalInterface
    public interface ColumnAdder<E extends Exception> {
        void addColumn(String identifier, ColumnType type) throws E;
    }
}
