package io.github.pierce.xmlflat.schema;

import java.util.Objects;

/**
 * Storage type inferred for a warehouse column.
 *
 * <p>Types are advisory: they are used when a table is created, while values
 * are always written as text.</p>
 *
 * @param kind   the type family
 * @param length maximum character length for {@link Kind#VARCHAR}, zero otherwise
 */
public record ColumnType(Kind kind, int length) {

    public static final ColumnType INTEGER = new ColumnType(Kind.INTEGER, 0);
    public static final ColumnType FLOAT = new ColumnType(Kind.FLOAT, 0);
    public static final ColumnType DATE = new ColumnType(Kind.DATE, 0);

    /**
     * Type used for empty values and for columns added by schema widening.
     */
    public static final ColumnType DEFAULT_TEXT = varchar(500);

    public ColumnType {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.VARCHAR && length <= 0) {
            throw new IllegalArgumentException("VARCHAR length must be positive: " + length);
        }
        if (kind != Kind.VARCHAR && length != 0) {
            throw new IllegalArgumentException(kind + " does not take a length");
        }
    }

    public static ColumnType varchar(int length) {
        return new ColumnType(Kind.VARCHAR, length);
    }

    /**
     * Returns the SQL spelling, e.g. {@code INTEGER} or {@code VARCHAR(300)}.
     */
    public String sqlName() {
        return kind == Kind.VARCHAR ? "VARCHAR(" + length + ")" : kind.name();
    }

    @Override
    public String toString() {
        return sqlName();
    }

    public enum Kind {
        INTEGER,
        FLOAT,
        DATE,
        VARCHAR
    }
}
