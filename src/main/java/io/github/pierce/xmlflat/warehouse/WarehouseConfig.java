package io.github.pierce.xmlflat.warehouse;

import java.util.Objects;

/**
 * Connection and naming settings for loading tables into a JDBC warehouse.
 *
 * <p>Immutable once built.</p>
 */
public final class WarehouseConfig {

    public static final String DEFAULT_SCHEMA = "PUBLIC";

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String schema;
    private final String tablePrefix;

    private WarehouseConfig(Builder builder) {
        this.jdbcUrl = Objects.requireNonNull(builder.jdbcUrl, "jdbcUrl");
        this.user = builder.user;
        this.password = builder.password;
        this.schema = builder.schema;
        this.tablePrefix = builder.tablePrefix;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    /**
     * Target schema; tables are looked up and created there.
     */
    public String getSchema() {
        return schema;
    }

    /**
     * Prefix prepended to every table name, e.g. {@code STG_}.
     */
    public String getTablePrefix() {
        return tablePrefix;
    }

    @Override
    public String toString() {
        return "WarehouseConfig{" +
                "jdbcUrl='" + jdbcUrl + '\'' +
                ", user='" + user + '\'' +
                ", schema='" + schema + '\'' +
                ", tablePrefix='" + tablePrefix + '\'' +
                '}';
    }

    /**
     * Builder for WarehouseConfig.
     */
    public static final class Builder {
        private String jdbcUrl;
        private String user;
        private String password;
        private String schema = DEFAULT_SCHEMA;
        private String tablePrefix = "";

        private Builder() {
        }

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema != null && !schema.isEmpty() ? schema : DEFAULT_SCHEMA;
            return this;
        }

        public Builder tablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix != null ? tablePrefix : "";
            return this;
        }

        public WarehouseConfig build() {
            return new WarehouseConfig(this);
        }
    }
}
