package io.github.pierce.xmlflat.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.pierce.xmlflat.RowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes one JSON object per line. Keys keep row order and absent columns
 * are simply missing from the object.
 */
public class JsonLinesRowSetWriter implements RowSetWriter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesRowSetWriter.class);

    private final ObjectMapper mapper;

    public JsonLinesRowSetWriter() {
        this(new ObjectMapper());
    }

    public JsonLinesRowSetWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void write(RowSet rows, Path target) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (Map<String, String> row : rows.getRows()) {
                writer.write(mapper.writeValueAsString(row));
                writer.newLine();
            }
        }
        LOG.info("Wrote {} rows to {}", rows.size(), target);
    }

    @Override
    public String extension() {
        return "jsonl";
    }
}
