package io.github.pierce.xmlflat.warehouse;

import io.github.pierce.xmlflat.FlatteningException;

/**
 * Exception thrown when tables cannot be loaded into the warehouse.
 */
public class WarehouseLoadException extends FlatteningException {

    public WarehouseLoadException(String message) {
        super(message);
    }

    public WarehouseLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
