package io.github.pierce.xmlflat.cli;

import io.github.pierce.xmlflat.DenormalizedResult;
import io.github.pierce.xmlflat.FlatteningException;
import io.github.pierce.xmlflat.FlattenedTable;
import io.github.pierce.xmlflat.RowSet;
import io.github.pierce.xmlflat.XmlFlattener;
import io.github.pierce.xmlflat.config.XmlPiercerConfigLoader;
import io.github.pierce.xmlflat.config.XmlPiercerSettings;
import io.github.pierce.xmlflat.export.CsvRowSetWriter;
import io.github.pierce.xmlflat.export.JsonLinesRowSetWriter;
import io.github.pierce.xmlflat.export.RowSetWriter;
import io.github.pierce.xmlflat.export.XlsxRowSetWriter;
import io.github.pierce.xmlflat.warehouse.JdbcWarehouseLoader;
import io.github.pierce.xmlflat.warehouse.LoadReport;
import io.github.pierce.xmlflat.warehouse.WarehouseConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point.
 *
 * <p><b>Usage:</b></p>
 * <pre>
 * java -cp xml-piercer.jar io.github.pierce.xmlflat.cli.XmlPiercerApp flatten &lt;input.xml&gt; &lt;output.csv|jsonl|xlsx&gt; [config]
 * java -cp xml-piercer.jar io.github.pierce.xmlflat.cli.XmlPiercerApp denormalize &lt;input.xml&gt; &lt;output-dir|output.xlsx&gt; [config]
 * java -cp xml-piercer.jar io.github.pierce.xmlflat.cli.XmlPiercerApp load &lt;input.xml&gt; &lt;config&gt;
 * </pre>
 *
 * <p>{@code config} is a properties or YAML file, {@code classpath:<resource>},
 * or {@code env} to read environment variables.</p>
 */
public class XmlPiercerApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_PARTIAL_LOAD = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  flatten <input.xml> <output.(csv|jsonl|xlsx)> [config]",
            "  denormalize <input.xml> <output-dir|output.xlsx> [config]",
            "  load <input.xml> <config>");

    private final PrintStream out;
    private final PrintStream err;

    XmlPiercerApp(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new XmlPiercerApp(System.out, System.err).run(args));
    }

    int run(String[] args) {
        if (args.length < 3) {
            err.println(USAGE);
            return EXIT_FAILURE;
        }

        String command = args[0];
        Path input = Paths.get(args[1]);
        if (!Files.isRegularFile(input)) {
            err.println("ERROR: Input file not found or is not a regular file: " + input);
            return EXIT_FAILURE;
        }

        try {
            switch (command) {
                case "flatten":
                    return flatten(input, Paths.get(args[2]), settings(args, 3));
                case "denormalize":
                    return denormalize(input, Paths.get(args[2]), settings(args, 3));
                case "load":
                    return load(input, settings(args, 2));
                default:
                    err.println("ERROR: Unknown command: " + command);
                    err.println(USAGE);
                    return EXIT_FAILURE;
            }
        } catch (IOException | FlatteningException | IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int flatten(Path input, Path output, XmlPiercerSettings settings) throws IOException {
        RowSetWriter writer = writerFor(output);
        if (writer == null) {
            err.println("ERROR: Unsupported output format: " + output.getFileName());
            return EXIT_FAILURE;
        }

        RowSet rows = new XmlFlattener(settings.getFlattenerConfig()).flatten(input);
        createParent(output);
        writer.write(rows, output);
        out.println("-> " + rows.size() + " rows, " + rows.getColumns().size() + " columns saved to: " + output);
        return EXIT_OK;
    }

    private int denormalize(Path input, Path outputDir, XmlPiercerSettings settings) throws IOException {
        DenormalizedResult result = new XmlFlattener(settings.getFlattenerConfig()).denormalize(input);
        if (result.isEmpty()) {
            out.println("No tables produced; is '" + settings.getFlattenerConfig().getRootNodeTag()
                    + "' present in the document?");
            return EXIT_OK;
        }

        if (outputDir.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
            createParent(outputDir);
            new XlsxRowSetWriter().write(result, outputDir);
            out.println("-> " + result.getTables().size() + " tables saved to: " + outputDir);
            return EXIT_OK;
        }

        Files.createDirectories(outputDir);
        CsvRowSetWriter writer = new CsvRowSetWriter();
        for (FlattenedTable table : result.tables()) {
            Path target = outputDir.resolve(fileName(table.getName()) + "." + writer.extension());
            writer.write(table.getRowSet(), target);
            out.println("-> " + table.getName() + ": " + table.size() + " rows saved to: " + target);
        }
        return EXIT_OK;
    }

    private int load(Path input, XmlPiercerSettings settings) {
        WarehouseConfig warehouse = settings.getWarehouseConfig().orElse(null);
        if (warehouse == null) {
            err.println("ERROR: No warehouse configured; set " + XmlPiercerConfigLoader.JDBC_URL);
            return EXIT_FAILURE;
        }

        DenormalizedResult result = new XmlFlattener(settings.getFlattenerConfig()).denormalize(input);
        LoadReport report = new JdbcWarehouseLoader(warehouse).load(result);

        report.getLoadedTables().forEach((table, rows) -> out.println("-> Loaded " + rows + " rows into " + table));
        report.getFailedTables().forEach((table, e) -> err.println("ERROR: " + table + ": " + e.getMessage()));
        return report.isCompleteSuccess() ? EXIT_OK : EXIT_PARTIAL_LOAD;
    }

    private static XmlPiercerSettings settings(String[] args, int index) throws IOException {
        if (args.length <= index) {
            return XmlPiercerSettings.defaults();
        }
        String source = args[index];
        if ("env".equals(source)) {
            return XmlPiercerConfigLoader.fromEnvironment();
        }
        if (source.startsWith("classpath:")) {
            return XmlPiercerConfigLoader.fromClasspath(source.substring("classpath:".length()));
        }
        return XmlPiercerConfigLoader.fromFile(Paths.get(source));
    }

    static RowSetWriter writerFor(Path output) {
        String name = output.getFileName().toString().toLowerCase(Locale.ROOT);
        for (RowSetWriter writer : List.of(new CsvRowSetWriter(), new JsonLinesRowSetWriter(), new XlsxRowSetWriter())) {
            if (name.endsWith("." + writer.extension())) {
                return writer;
            }
        }
        return null;
    }

    private static void createParent(Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Table names are element tags and may carry a namespace prefix.
     */
    static String fileName(String tableName) {
        return tableName.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
