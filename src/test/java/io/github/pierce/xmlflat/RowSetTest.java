package io.github.pierce.xmlflat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowSetTest {

    @Test
    @DisplayName("Columns are the union of row keys in first-seen order")
    void columnUnion() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("b", "1");
        first.put("a", "2");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("c", "3");
        second.put("a", "4");

        RowSet rows = new RowSet(List.of(first, second));

        assertThat(rows.getColumns()).containsExactly("b", "a", "c");
        assertThat(rows.getRows().get(1)).doesNotContainKey("b");
    }

    @Test
    @DisplayName("Rows are copied and cannot be modified")
    void immutable() {
        Map<String, String> source = new LinkedHashMap<>();
        source.put("a", "1");
        RowSet rows = new RowSet(List.of(source));

        source.put("a", "changed");

        assertThat(rows.getRows().get(0)).containsEntry("a", "1");
        assertThatThrownBy(() -> rows.getRows().get(0).put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("An empty row set has no columns")
    void empty() {
        RowSet rows = new RowSet(List.of());

        assertThat(rows.isEmpty()).isTrue();
        assertThat(rows.getColumns()).isEmpty();
    }
}
