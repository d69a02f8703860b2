package io.github.pierce.xmlflat;

import io.github.pierce.xmlflat.schema.ColumnType;
import io.github.pierce.xmlflat.schema.TableSchema;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlFlattenerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private static Path ordersXml;

    private final XmlFlattener flattener = new XmlFlattener(XmlFlattenerConfig.builder().clock(CLOCK).build());

    @BeforeAll
    static void locateFixture() throws URISyntaxException {
        ordersXml = Paths.get(XmlFlattenerTest.class.getResource("/orders.xml").toURI());
    }

    @Test
    @DisplayName("flatten expands every repeat across the whole document")
    void flattenDocument() {
        RowSet rows = flattener.flatten(ordersXml);

        assertThat(rows.size()).isEqualTo(3);
        assertThat(rows.getRows()).allSatisfy(row -> assertThat(row)
                .containsEntry("export_generated", "2024-03-01")
                .containsEntry("export_data_customer_name", "Ada Lovelace")
                .containsEntry("export_data_customer_address_city", "London"));
        assertThat(rows.getRows())
                .extracting(row -> row.get("export_data_order_id") + "/" + row.get("export_data_order_line_sku"))
                .containsExactly("1001/A-1", "1001/B-7", "1002/C-3");
    }

    @Test
    @DisplayName("denormalize finds the data node below the document root")
    void denormalizeDocument() {
        DenormalizedResult result = flattener.denormalize(ordersXml);

        assertThat(result.getTables().keySet()).containsExactly("customer", "order");
        assertThat(result.totalRows()).isEqualTo(4);

        List<Map<String, String>> orders = result.table("order").orElseThrow().getRows();
        assertThat(orders.get(0)).containsEntry("order_id", "1001")
                .containsEntry("placed", "2024-02-28")
                .containsEntry("line_sku", "A-1")
                .containsEntry("_sequence_num", "1");
        assertThat(orders.get(2)).containsEntry("order_id", "1002")
                .containsEntry("order_line_sku", "C-3")
                .containsEntry("_sequence_num", "2");
    }

    @Test
    @DisplayName("Table schemas take types from the first row and widen later columns as text")
    void tableSchema() {
        TableSchema schema = flattener.denormalize(ordersXml).table("order").orElseThrow().getSchema();

        assertThat(schema.columns()).containsExactly(
                Map.entry("ORDER_ID", ColumnType.INTEGER),
                Map.entry("_SEQUENCE_NUM", ColumnType.INTEGER),
                Map.entry("PLACED", ColumnType.DATE),
                Map.entry("LINE_SKU", ColumnType.varchar(200)),
                Map.entry("QTY", ColumnType.INTEGER),
                Map.entry("PRICE", ColumnType.FLOAT),
                Map.entry("_LOAD_TIMESTAMP", ColumnType.varchar(200)),
                Map.entry("ORDER_PLACED", ColumnType.DEFAULT_TEXT),
                Map.entry("ORDER_LINE_SKU", ColumnType.DEFAULT_TEXT),
                Map.entry("ORDER_LINE_QTY", ColumnType.DEFAULT_TEXT),
                Map.entry("ORDER_LINE_PRICE", ColumnType.DEFAULT_TEXT));
    }

    @Test
    @DisplayName("Normalized rows use warehouse identifiers")
    void normalizedRows() {
        FlattenedTable customer = flattener.denormalize(ordersXml).table("customer").orElseThrow();

        assertThat(customer.normalizedRows().get(0).keySet()).containsExactly(
                "CUSTOMER_ID", "CUSTOMER_TIER", "CUSTOMER_NAME", "CUSTOMER_ADDRESS_TYPE",
                "CUSTOMER_ADDRESS_CITY", "CUSTOMER_ADDRESS_POSTCODE", "_LOAD_TIMESTAMP");
        assertThat(customer.getRows().get(0)).containsKey("customer_id");
    }

    @Test
    @DisplayName("Schema keys match normalized rows, not raw rows")
    void schemaPairsWithNormalizedRows() {
        FlattenedTable order = flattener.denormalize(ordersXml).table("order").orElseThrow();
        Set<String> schemaColumns = order.getSchema().columns().keySet();

        assertThat(order.normalizedRows())
                .allSatisfy(row -> assertThat(schemaColumns).containsAll(row.keySet()));
        assertThat(schemaColumns).doesNotContainAnyElementsOf(order.getRows().get(0).keySet());
    }

    @Test
    @DisplayName("String and node inputs give the same result")
    void stringAndNodeInputs() {
        String xml = "<data><item id=\"1\">A</item><item id=\"2\">B</item></data>";

        assertThat(flattener.flatten(xml).getRows())
                .isEqualTo(flattener.flatten(XmlNodeReader.read(xml)).getRows());
        assertThat(flattener.denormalize(xml).table("item").orElseThrow().getRows())
                .isEqualTo(flattener.denormalize(XmlNodeReader.read(xml)).table("item").orElseThrow().getRows());
    }

    @Test
    @DisplayName("Unparseable input surfaces as XmlReadException")
    void unparseableInput() {
        assertThatThrownBy(() -> flattener.denormalize("<data><item></data>"))
                .isInstanceOf(XmlReadException.class)
                .isInstanceOf(FlatteningException.class);
    }

    @Test
    @DisplayName("A null configuration falls back to defaults")
    void nullConfig() {
        XmlFlattener defaults = new XmlFlattener(null);

        assertThat(defaults.getConfig().getRootNodeTag()).isEqualTo(XmlFlattenerConfig.DEFAULT_ROOT_NODE);
        assertThat(defaults.getConfig().getMaxNestingDepth()).isEqualTo(256);
    }
}
