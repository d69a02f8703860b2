package io.github.pierce.xmlflat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of trying to flatten a subtree into a single row.
 *
 * <p>{@link Flattened} carries the columns, possibly none. {@link RequiresExtraction}
 * means some node in the subtree has a repeating group, so the subtree has to
 * be fanned out instead.</p>
 */
sealed interface InlineResult permits InlineResult.Flattened, InlineResult.RequiresExtraction {

    static Flattened flattened(Map<String, String> row) {
        return new Flattened(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }

    static RequiresExtraction requiresExtraction() {
        return RequiresExtraction.INSTANCE;
    }

    record Flattened(Map<String, String> row) implements InlineResult {
    }

    record RequiresExtraction() implements InlineResult {
        static final RequiresExtraction INSTANCE = new RequiresExtraction();
    }
}
