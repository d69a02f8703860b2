package io.github.pierce.xmlflat;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tables produced by denormalizing one document, keyed by level-1 tag in the
 * order the tags were first seen.
 */
public final class DenormalizedResult {

    private static final DenormalizedResult EMPTY = new DenormalizedResult(Map.of());

    private final Map<String, FlattenedTable> tables;

    public DenormalizedResult(Map<String, FlattenedTable> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static DenormalizedResult empty() {
        return EMPTY;
    }

    public Map<String, FlattenedTable> getTables() {
        return tables;
    }

    public Collection<FlattenedTable> tables() {
        return tables.values();
    }

    public Optional<FlattenedTable> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    public int totalRows() {
        int total = 0;
        for (FlattenedTable table : tables.values()) {
            total += table.size();
        }
        return total;
    }

    @Override
    public String toString() {
        return "DenormalizedResult{tables=" + tables.keySet() + "}";
    }
}
