package io.github.pierce.xmlflat.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TableSchemaTest {

    @Test
    @DisplayName("Types come from the sample row under normalized identifiers")
    void fromSample() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("item-id", "1");
        row.put("price", "9.50");
        row.put("placed", "2024-01-01");
        row.put("note", "");

        TableSchema schema = TableSchema.fromSample(row);

        assertThat(schema.columns()).containsExactly(
                Map.entry("ITEM_ID", ColumnType.INTEGER),
                Map.entry("PRICE", ColumnType.FLOAT),
                Map.entry("PLACED", ColumnType.DATE),
                Map.entry("NOTE", ColumnType.DEFAULT_TEXT));
    }

    @Test
    @DisplayName("The first name wins when two names normalize to the same identifier")
    void normalizationCollision() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("a-b", "1");
        row.put("a.b", "text");

        TableSchema schema = TableSchema.fromSample(row);

        assertThat(schema.size()).isEqualTo(1);
        assertThat(schema.typeOf("A_B")).isEqualTo(ColumnType.INTEGER);
    }

    @Test
    @DisplayName("Later rows widen the schema with text columns and never retype")
    void inferWidens() {
        TableSchema schema = TableSchema.infer(List.of(
                Map.of("a", "1"),
                Map.of("a", "not a number", "b", "2")));

        assertThat(schema.columns()).containsExactly(
                Map.entry("A", ColumnType.INTEGER),
                Map.entry("B", ColumnType.DEFAULT_TEXT));
    }

    @Test
    @DisplayName("widen reports only the identifiers it added")
    void widenReportsAdded() {
        TableSchema schema = TableSchema.fromSample(Map.of("a", "1"));

        assertThat(schema.widen(List.of("a", "b", "c-d"))).containsExactly("B", "C_D");
        assertThat(schema.widen(List.of("b"))).isEmpty();
        assertThat(schema.contains("C_D")).isTrue();
    }

    @Test
    @DisplayName("Existing target columns are recorded as text")
    void existingColumns() {
        TableSchema schema = TableSchema.ofExistingColumns(List.of("ID", "NAME"));

        assertThat(schema.columns().values()).containsOnly(ColumnType.DEFAULT_TEXT);
        assertThat(schema.columns().keySet()).containsExactly("ID", "NAME");
    }

    @Test
    @DisplayName("No rows means no columns")
    void emptyRows() {
        assertThat(TableSchema.infer(List.of()).size()).isZero();
        assertThat(TableSchema.empty().columns()).isEmpty();
    }
}
