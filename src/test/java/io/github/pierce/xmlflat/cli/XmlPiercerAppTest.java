package io.github.pierce.xmlflat.cli;

import io.github.pierce.xmlflat.export.CsvRowSetWriter;
import io.github.pierce.xmlflat.export.JsonLinesRowSetWriter;
import io.github.pierce.xmlflat.export.XlsxRowSetWriter;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class XmlPiercerAppTest {

    @TempDir
    Path dir;

    private Path ordersXml;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private XmlPiercerApp app;

    @BeforeEach
    void setUp() throws URISyntaxException {
        ordersXml = Paths.get(XmlPiercerAppTest.class.getResource("/orders.xml").toURI());
        app = new XmlPiercerApp(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return app.run(args);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("flatten")
    class Flatten {

        @Test
        @DisplayName("Writes a CSV with one row per combination")
        void toCsv() throws IOException {
            Path output = dir.resolve("out/rows.csv");

            int exit = run("flatten", ordersXml.toString(), output.toString());

            assertThat(exit).isEqualTo(XmlPiercerApp.EXIT_OK);
            List<String> lines = Files.readAllLines(output);
            assertThat(lines).hasSize(4);
            assertThat(lines.get(0)).startsWith("export_generated,");
        }

        @Test
        @DisplayName("Writes JSON lines")
        void toJsonLines() throws IOException {
            Path output = dir.resolve("rows.jsonl");

            assertThat(run("flatten", ordersXml.toString(), output.toString())).isZero();

            assertThat(Files.readAllLines(output)).hasSize(3)
                    .allSatisfy(line -> assertThat(line).startsWith("{\"export_generated\":\"2024-03-01\""));
        }

        @Test
        @DisplayName("Unknown output formats are rejected")
        void unknownFormat() {
            int exit = run("flatten", ordersXml.toString(), dir.resolve("rows.parquet").toString());

            assertThat(exit).isEqualTo(XmlPiercerApp.EXIT_FAILURE);
            assertThat(stderr()).contains("Unsupported output format");
        }

        @Test
        @DisplayName("Writers are chosen by extension")
        void writerForExtension() {
            assertThat(XmlPiercerApp.writerFor(Paths.get("a.CSV"))).isInstanceOf(CsvRowSetWriter.class);
            assertThat(XmlPiercerApp.writerFor(Paths.get("a.jsonl"))).isInstanceOf(JsonLinesRowSetWriter.class);
            assertThat(XmlPiercerApp.writerFor(Paths.get("a.xlsx"))).isInstanceOf(XlsxRowSetWriter.class);
            assertThat(XmlPiercerApp.writerFor(Paths.get("a.txt"))).isNull();
        }
    }

    @Nested
    @DisplayName("denormalize")
    class Denormalize {

        @Test
        @DisplayName("Writes one CSV per table")
        void csvPerTable() throws IOException {
            Path output = dir.resolve("tables");

            int exit = run("denormalize", ordersXml.toString(), output.toString());

            assertThat(exit).isZero();
            assertThat(Files.readAllLines(output.resolve("customer.csv"))).hasSize(2);
            assertThat(Files.readAllLines(output.resolve("order.csv"))).hasSize(4);
        }

        @Test
        @DisplayName("Writes one sheet per table to a workbook")
        void workbook() throws IOException {
            Path output = dir.resolve("tables.xlsx");

            assertThat(run("denormalize", ordersXml.toString(), output.toString())).isZero();

            try (InputStream in = Files.newInputStream(output); Workbook workbook = new XSSFWorkbook(in)) {
                assertThat(workbook.getSheetName(0)).isEqualTo("customer");
                assertThat(workbook.getSheetName(1)).isEqualTo("order");
            }
        }

        @Test
        @DisplayName("Honors the root node from a configuration file")
        void configuredRoot() throws IOException {
            Path config = dir.resolve("piercer.properties");
            Files.writeString(config, "xmlpiercer.root.node=customer\n");
            Path output = dir.resolve("customer-tables");

            assertThat(run("denormalize", ordersXml.toString(), output.toString(), config.toString())).isZero();

            assertThat(output.resolve("name.csv")).exists();
            assertThat(output.resolve("address.csv")).exists();
        }

        @Test
        @DisplayName("Reports when the root node is missing")
        void missingRoot() throws IOException {
            Path config = dir.resolve("piercer.properties");
            Files.writeString(config, "xmlpiercer.root.node=nowhere\n");

            int exit = run("denormalize", ordersXml.toString(), dir.resolve("none").toString(), config.toString());

            assertThat(exit).isZero();
            assertThat(out.toString(StandardCharsets.UTF_8)).contains("No tables produced");
        }

        @Test
        @DisplayName("Namespace prefixes are replaced in file names")
        void fileNames() {
            assertThat(XmlPiercerApp.fileName("ns:order")).isEqualTo("ns_order");
            assertThat(XmlPiercerApp.fileName("order-line.v2")).isEqualTo("order-line.v2");
        }
    }

    @Nested
    @DisplayName("load")
    class Load {

        private String jdbcUrl;

        @BeforeEach
        void database() {
            jdbcUrl = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        }

        private Path config() throws IOException {
            Path config = dir.resolve("warehouse.properties");
            Files.writeString(config, "warehouse.jdbc.url=" + jdbcUrl + "\nwarehouse.user=sa\nwarehouse.password=\n");
            return config;
        }

        @Test
        @DisplayName("Loads every table and exits with 0")
        void loadsTables() throws IOException, SQLException {
            int exit = run("load", ordersXml.toString(), config().toString());

            assertThat(exit).isZero();
            assertThat(count("CUSTOMER")).isEqualTo(1);
            assertThat(count("ORDER")).isEqualTo(3);
        }

        @Test
        @DisplayName("Exits with 2 when some tables fail")
        void partialFailure() throws IOException, SQLException {
            try (Connection connection = DriverManager.getConnection(jdbcUrl, "sa", "");
                 Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE \"PUBLIC\".\"ORDER\" (\"ORDER_ID\" INTEGER, \"PLACED\" INTEGER)");
            }

            int exit = run("load", ordersXml.toString(), config().toString());

            assertThat(exit).isEqualTo(XmlPiercerApp.EXIT_PARTIAL_LOAD);
            assertThat(count("CUSTOMER")).isEqualTo(1);
            assertThat(count("ORDER")).isZero();
            assertThat(stderr()).contains("ORDER");
        }

        @Test
        @DisplayName("Fails without a warehouse URL")
        void missingWarehouse() throws IOException {
            Path config = dir.resolve("empty.properties");
            Files.writeString(config, "xmlpiercer.root.node=data\n");

            assertThat(run("load", ordersXml.toString(), config.toString())).isEqualTo(XmlPiercerApp.EXIT_FAILURE);
            assertThat(stderr()).contains("warehouse.jdbc.url");
        }

        private int count(String table) throws SQLException {
            try (Connection connection = DriverManager.getConnection(jdbcUrl, "sa", "");
                 Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM \"PUBLIC\".\"" + table + "\"")) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    @Nested
    @DisplayName("Usage")
    class Usage {

        @Test
        @DisplayName("Too few arguments print usage")
        void tooFewArguments() {
            assertThat(run("flatten")).isEqualTo(XmlPiercerApp.EXIT_FAILURE);
            assertThat(stderr()).contains("Usage:");
        }

        @Test
        @DisplayName("Unknown commands print usage")
        void unknownCommand() {
            assertThat(run("explode", ordersXml.toString(), "x")).isEqualTo(XmlPiercerApp.EXIT_FAILURE);
            assertThat(stderr()).contains("Unknown command: explode");
        }

        @Test
        @DisplayName("A missing input file is reported")
        void missingInput() {
            assertThat(run("flatten", dir.resolve("nope.xml").toString(), "out.csv"))
                    .isEqualTo(XmlPiercerApp.EXIT_FAILURE);
            assertThat(stderr()).contains("Input file not found");
        }

        @Test
        @DisplayName("A missing configuration file is reported")
        void missingConfig() {
            int exit = run("denormalize", ordersXml.toString(), dir.resolve("o").toString(),
                    dir.resolve("absent.yaml").toString());

            assertThat(exit).isEqualTo(XmlPiercerApp.EXIT_FAILURE);
            assertThat(stderr()).contains("Configuration file not found");
        }

        @Test
        @DisplayName("A malformed YAML configuration is reported")
        void malformedConfig() throws IOException {
            Path config = dir.resolve("broken.yml");
            Files.writeString(config, "xmlpiercer:\n  root: [data\n");

            int exit = run("flatten", ordersXml.toString(), dir.resolve("rows.csv").toString(), config.toString());

            assertThat(exit).isEqualTo(XmlPiercerApp.EXIT_FAILURE);
            assertThat(stderr()).contains("ERROR: Invalid YAML configuration");
        }
    }
}
