package io.github.pierce.xmlflat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered collection of flattened rows.
 *
 * <p>Rows may have different key sets. {@link #getColumns()} is the union of
 * all keys in first-seen order and is the header to use for columnar
 * output.</p>
 */
public final class RowSet {

    private final List<Map<String, String>> rows;
    private final Set<String> columns;

    public RowSet(List<? extends Map<String, String>> rows) {
        List<Map<String, String>> copy = new ArrayList<>(rows.size());
        Set<String> union = new LinkedHashSet<>();
        for (Map<String, String> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            union.addAll(row.keySet());
        }
        this.rows = Collections.unmodifiableList(copy);
        this.columns = Collections.unmodifiableSet(union);
    }

    public List<Map<String, String>> getRows() {
        return rows;
    }

    public Set<String> getColumns() {
        return columns;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public String toString() {
        return "RowSet{rows=" + rows.size() + ", columns=" + columns.size() + "}";
    }
}
