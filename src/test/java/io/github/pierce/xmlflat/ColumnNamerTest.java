package io.github.pierce.xmlflat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnNamerTest {

    @Test
    @DisplayName("Prefix joins path and tag, an empty path yields the tag")
    void prefix() {
        ColumnNamer namer = new ColumnNamer("");

        assertThat(namer.prefix("", "data")).isEqualTo("data");
        assertThat(namer.prefix(null, "data")).isEqualTo("data");
        assertThat(namer.prefix("data", "item")).isEqualTo("data_item");
        assertThat(namer.prefix("data_item", "price")).isEqualTo("data_item_price");
    }

    @Test
    @DisplayName("Attributes are appended with the separator")
    void attribute() {
        assertThat(new ColumnNamer("").attribute("data_item", "id")).isEqualTo("data_item_id");
        assertThat(new ColumnNamer(null).attribute("item", "id")).isEqualTo("item_id");
    }

    @Test
    @DisplayName("Attribute marker is placed before the attribute name")
    void attributeMarker() {
        ColumnNamer namer = XmlFlattenerConfig.builder().attributeMarker("@").build().columnNamer();

        assertThat(namer.attribute("item", "id")).isEqualTo("item_@id");
        assertThat(namer.getAttributeMarker()).isEqualTo("@");
    }
}
