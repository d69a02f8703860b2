package io.github.pierce.xmlflat.export;

import io.github.pierce.xmlflat.RowSet;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CSV output with Apache Commons CSV. The header is the union of all row
 * keys; a row without a column gets an empty field.
 */
public class CsvRowSetWriter implements RowSetWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvRowSetWriter.class);

    private final CSVFormat format;

    public CsvRowSetWriter() {
        this(CSVFormat.DEFAULT);
    }

    public CsvRowSetWriter(CSVFormat format) {
        this.format = format;
    }

    @Override
    public void write(RowSet rows, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(rows, writer);
        }
        LOG.info("Wrote {} rows to {}", rows.size(), target);
    }

    public void write(RowSet rows, Writer writer) throws IOException {
        List<String> header = new ArrayList<>(rows.getColumns());
        CSVFormat withHeader = format.builder()
                .setHeader(header.toArray(new String[0]))
                .build();

        CSVPrinter printer = new CSVPrinter(writer, withHeader);
        List<String> record = new ArrayList<>(header.size());
        for (Map<String, String> row : rows.getRows()) {
            record.clear();
            for (String column : header) {
                record.add(row.getOrDefault(column, ""));
            }
            printer.printRecord(record);
        }
        printer.flush();
    }

    @Override
    public String extension() {
        return "csv";
    }
}
