package io.github.pierce.xmlflat.warehouse;

import io.github.pierce.xmlflat.DenormalizedResult;

/**
 * Loads denormalized tables into a relational target.
 *
 * <p>Implementations create missing tables from the first row's inferred
 * schema, add columns that appear later as text, and commit each table in its
 * own transaction. A failing table is rolled back and reported without
 * stopping the remaining tables.</p>
 */
public interface WarehouseLoader {

    /**
     * Loads every table of the result.
     *
     * @throws WarehouseLoadException if no connection to the target can be made
     */
    LoadReport load(DenormalizedResult result);
}
