package io.github.pierce.xmlflat.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered mapping of normalized column identifier to {@link ColumnType}.
 *
 * <p>A schema starts from the types inferred for one sample row and only
 * ever grows: columns seen later are appended as {@link ColumnType#DEFAULT_TEXT}
 * and existing columns are never retyped or removed. All methods are
 * synchronized on the instance so check-then-add sequences can be made atomic
 * by holding its monitor.</p>
 */
public final class TableSchema {

    private final Map<String, ColumnType> columns = new LinkedHashMap<>();

    private TableSchema() {
    }

    public static TableSchema empty() {
        return new TableSchema();
    }

    /**
     * Infers one type per value of the sample row. Names are normalized; when
     * two names normalize to the same identifier the first one wins.
     */
    public static TableSchema fromSample(Map<String, String> sampleRow) {
        TableSchema schema = new TableSchema();
        for (Map.Entry<String, String> entry : sampleRow.entrySet()) {
            schema.columns.putIfAbsent(IdentifierNormalizer.normalize(entry.getKey()),
                    ColumnTypeInferrer.infer(entry.getValue()));
        }
        return schema;
    }

    /**
     * Builds the schema a table would end up with after loading the rows in
     * order: types from the first row, then every new column widened in.
     */
    public static TableSchema infer(List<? extends Map<String, String>> rows) {
        if (rows.isEmpty()) {
            return empty();
        }
        TableSchema schema = fromSample(rows.get(0));
        for (int i = 1; i < rows.size(); i++) {
            schema.widen(rows.get(i).keySet());
        }
        return schema;
    }

    /**
     * Schema for columns that already exist in a target whose types are not
     * tracked; every column is recorded as default text.
     */
    public static TableSchema ofExistingColumns(Collection<String> identifiers) {
        TableSchema schema = new TableSchema();
        for (String identifier : identifiers) {
            schema.columns.putIfAbsent(identifier, ColumnType.DEFAULT_TEXT);
        }
        return schema;
    }

    /**
     * Adds every column not yet known as {@link ColumnType#DEFAULT_TEXT}.
     *
     * @param rawNames column names, normalized before comparison
     * @return the normalized identifiers that were added, in order
     */
    public synchronized List<String> widen(Collection<String> rawNames) {
        List<String> added = new ArrayList<>();
        for (String raw : rawNames) {
            String identifier = IdentifierNormalizer.normalize(raw);
            if (!columns.containsKey(identifier)) {
                columns.put(identifier, ColumnType.DEFAULT_TEXT);
                added.add(identifier);
            }
        }
        return added;
    }

    public synchronized boolean contains(String identifier) {
        return columns.containsKey(identifier);
    }

    public synchronized ColumnType typeOf(String identifier) {
        return columns.get(identifier);
    }

    synchronized void addColumn(String identifier, ColumnType type) {
        columns.putIfAbsent(identifier, type);
    }

    /**
     * Returns a snapshot of the columns in definition order.
     */
    public synchronized Map<String, ColumnType> columns() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public synchronized int size() {
        return columns.size();
    }

    @Override
    public synchronized String toString() {
        return "TableSchema" + columns;
    }
}
