package io.github.pierce.xmlflat.warehouse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of loading a set of tables. Each table either committed or rolled
 * back on its own, so a report may mix both.
 */
public final class LoadReport {

    private static final Logger LOG = LoggerFactory.getLogger(LoadReport.class);

    private final Map<String, Integer> loadedTables;
    private final Map<String, Exception> failedTables;

    public LoadReport(Map<String, Integer> loadedTables, Map<String, Exception> failedTables) {
        this.loadedTables = Collections.unmodifiableMap(new LinkedHashMap<>(loadedTables));
        this.failedTables = Collections.unmodifiableMap(new LinkedHashMap<>(failedTables));
    }

    /**
     * Committed tables with the number of rows inserted into each.
     */
    public Map<String, Integer> getLoadedTables() {
        return loadedTables;
    }

    /**
     * Rolled-back tables with the failure that caused the rollback.
     */
    public Map<String, Exception> getFailedTables() {
        return failedTables;
    }

    public boolean hasFailures() {
        return !failedTables.isEmpty();
    }

    public boolean isCompleteSuccess() {
        return failedTables.isEmpty();
    }

    public int getTotalRowsLoaded() {
        int total = 0;
        for (int rows : loadedTables.values()) {
            total += rows;
        }
        return total;
    }

    /**
     * Throws if any table failed; the first failure is attached as the cause.
     */
    public void throwIfFailed() {
        if (failedTables.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("Failed to load ").append(failedTables.size()).append(" table(s): ");
        int i = 0;
        for (Map.Entry<String, Exception> failure : failedTables.entrySet()) {
            if (i++ > 0) sb.append("; ");
            sb.append(failure.getKey()).append(": ").append(failure.getValue().getMessage());
        }
        throw new WarehouseLoadException(sb.toString(), failedTables.values().iterator().next());
    }

    public void logSummary() {
        LOG.info("Warehouse load summary: {} tables loaded ({} rows), {} failed",
                loadedTables.size(), getTotalRowsLoaded(), failedTables.size());

        if (hasFailures()) {
            LOG.error("Failed tables:");
            failedTables.forEach((name, exception) ->
                    LOG.error("  - {}: {}", name, exception.getMessage()));
        }
    }

    @Override
    public String toString() {
        return "LoadReport{loaded=" + loadedTables + ", failed=" + failedTables.keySet() + "}";
    }
}
