package io.github.pierce.xmlflat;

import io.github.pierce.xmlflat.schema.IdentifierNormalizer;
import io.github.pierce.xmlflat.schema.TableSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One denormalized table: the rows produced for a level-1 tag and the schema
 * inferred from them.
 *
 * <p>Rows keep the column names built during flattening. The schema is keyed
 * by normalized identifiers, see {@link IdentifierNormalizer}.</p>
 */
public final class FlattenedTable {

    private final String name;
    private final RowSet rows;
    private final TableSchema schema;

    public FlattenedTable(String name, List<? extends Map<String, String>> rows) {
        this.name = name;
        this.rows = new RowSet(rows);
        this.schema = TableSchema.infer(this.rows.getRows());
    }

    public String getName() {
        return name;
    }

    /**
     * Rows keyed by the raw column names built during flattening. These keys
     * do not match {@link #getSchema()}; use {@link #normalizedRows()} to
     * pair rows with the schema.
     */
    public List<Map<String, String>> getRows() {
        return rows.getRows();
    }

    public RowSet getRowSet() {
        return rows;
    }

    /**
     * Schema keyed by normalized identifiers, matching the keys of
     * {@link #normalizedRows()}.
     */
    public TableSchema getSchema() {
        return schema;
    }

    public int size() {
        return rows.size();
    }

    /**
     * Rows re-keyed by normalized identifier. If two names collide after
     * normalization, the later value in the row wins.
     */
    public List<Map<String, String>> normalizedRows() {
        List<Map<String, String>> normalized = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows.getRows()) {
            Map<String, String> copy = new LinkedHashMap<>();
            row.forEach((column, value) -> copy.put(IdentifierNormalizer.normalize(column), value));
            normalized.add(copy);
        }
        return normalized;
    }

    @Override
    public String toString() {
        return "FlattenedTable{" + name + ", rows=" + rows.size() + ", columns=" + schema.size() + "}";
    }
}
