package io.github.pierce.xmlflat.config;

import io.github.pierce.xmlflat.XmlFlattenerConfig;
import io.github.pierce.xmlflat.warehouse.WarehouseConfig;

import java.util.Optional;

/**
 * Settings read from one configuration source: flattening options, plus the
 * warehouse connection when a JDBC URL was given.
 */
public final class XmlPiercerSettings {

    private final XmlFlattenerConfig flattenerConfig;
    private final WarehouseConfig warehouseConfig;

    public XmlPiercerSettings(XmlFlattenerConfig flattenerConfig, WarehouseConfig warehouseConfig) {
        this.flattenerConfig = flattenerConfig != null ? flattenerConfig : XmlFlattenerConfig.defaults();
        this.warehouseConfig = warehouseConfig;
    }

    public static XmlPiercerSettings defaults() {
        return new XmlPiercerSettings(XmlFlattenerConfig.defaults(), null);
    }

    public XmlFlattenerConfig getFlattenerConfig() {
        return flattenerConfig;
    }

    public Optional<WarehouseConfig> getWarehouseConfig() {
        return Optional.ofNullable(warehouseConfig);
    }

    @Override
    public String toString() {
        return "XmlPiercerSettings{flattener=" + flattenerConfig + ", warehouse=" + warehouseConfig + "}";
    }
}
