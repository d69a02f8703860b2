package io.github.pierce.xmlflat.schema;

import java.util.Locale;

/**
 * Turns column and table names into identifiers accepted by relational targets.
 */
public final class IdentifierNormalizer {

    private IdentifierNormalizer() {
        // Utility class should not be instantiated
    }

    /**
     * Replaces {@code -} and {@code .} with {@code _} and upper-cases the result.
     */
    public static String normalize(String name) {
        return name.replace('-', '_').replace('.', '_').toUpperCase(Locale.ROOT);
    }

    /**
     * Wraps an identifier in double quotes, doubling embedded quotes.
     */
    public static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
