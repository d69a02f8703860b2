package io.github.pierce.xmlflat.config;

import io.github.pierce.xmlflat.XmlFlattenerConfig;
import io.github.pierce.xmlflat.warehouse.WarehouseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Reads {@link XmlPiercerSettings} from properties files, YAML files,
 * classpath resources or environment variables.
 *
 * <p>YAML documents are flattened to dotted keys, so
 * {@code xmlpiercer: {root: {node: data}}} and
 * {@code xmlpiercer.root.node=data} are equivalent. Environment variables use
 * the upper-cased key with dots replaced by underscores, e.g.
 * {@code XMLPIERCER_ROOT_NODE}. Values wrapped in matching single or double
 * quotes are unquoted.</p>
 */
public final class XmlPiercerConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(XmlPiercerConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "xml-piercer.properties";

    // Property keys
    public static final String ROOT_NODE = "xmlpiercer.root.node";
    public static final String ATTRIBUTE_MARKER = "xmlpiercer.attribute.marker";
    public static final String MAX_DEPTH = "xmlpiercer.max.depth";
    public static final String SEQUENCE_COLUMN = "xmlpiercer.sequence.column";
    public static final String TIMESTAMP_COLUMN = "xmlpiercer.timestamp.column";
    public static final String JDBC_URL = "warehouse.jdbc.url";
    public static final String USER = "warehouse.user";
    public static final String PASSWORD = "warehouse.password";
    public static final String SCHEMA = "warehouse.schema";
    public static final String TABLE_PREFIX = "warehouse.table.prefix";

    private static final List<String> KEYS = List.of(ROOT_NODE, ATTRIBUTE_MARKER, MAX_DEPTH, SEQUENCE_COLUMN,
            TIMESTAMP_COLUMN, JDBC_URL, USER, PASSWORD, SCHEMA, TABLE_PREFIX);

    private XmlPiercerConfigLoader() {
        // Utility class should not be instantiated
    }

    /**
     * Loads a {@code .properties}, {@code .yaml} or {@code .yml} file.
     *
     * @throws FileNotFoundException if the file does not exist
     */
    public static XmlPiercerSettings fromFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Configuration file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            Properties props = isYaml(file.getFileName().toString()) ? readYaml(is) : readProperties(is);
            LOG.info("Loaded configuration from {}", file);
            return fromProperties(props);
        }
    }

    /**
     * Loads a properties or YAML resource from the classpath.
     *
     * @throws FileNotFoundException if the resource does not exist
     */
    public static XmlPiercerSettings fromClasspath(String resource) throws IOException {
        try (InputStream is = XmlPiercerConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new FileNotFoundException("Configuration resource not found: " + resource);
            }
            Properties props = isYaml(resource) ? readYaml(is) : readProperties(is);
            LOG.info("Loaded configuration from classpath:{}", resource);
            return fromProperties(props);
        }
    }

    public static XmlPiercerSettings fromDefaultProperties() throws IOException {
        return fromClasspath(DEFAULT_CONFIG_FILE);
    }

    public static XmlPiercerSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static XmlPiercerSettings fromEnvironment(Map<String, String> environment) {
        Properties props = new Properties();
        for (String key : KEYS) {
            String value = environment.get(environmentName(key));
            if (value != null) {
                props.setProperty(key, value);
            }
        }
        return fromProperties(props);
    }

    /**
     * Environment variable consulted for a property key.
     */
    public static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    public static XmlPiercerSettings fromProperties(Properties props) {
        XmlFlattenerConfig.Builder flattener = XmlFlattenerConfig.builder();

        String rootNode = value(props, ROOT_NODE);
        if (rootNode != null && !rootNode.isEmpty()) {
            flattener.rootNodeTag(rootNode);
        }

        String marker = value(props, ATTRIBUTE_MARKER);
        if (marker != null) {
            flattener.attributeMarker(marker);
        }

        String maxDepth = value(props, MAX_DEPTH);
        if (maxDepth != null && !maxDepth.isEmpty()) {
            try {
                flattener.maxNestingDepth(Integer.parseInt(maxDepth));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + MAX_DEPTH + ": " + maxDepth, e);
            }
        }

        String sequenceColumn = value(props, SEQUENCE_COLUMN);
        if (sequenceColumn != null && !sequenceColumn.isEmpty()) {
            flattener.sequenceColumn(sequenceColumn);
        }

        String timestampColumn = value(props, TIMESTAMP_COLUMN);
        if (timestampColumn != null && !timestampColumn.isEmpty()) {
            flattener.loadTimestampColumn(timestampColumn);
        }

        WarehouseConfig warehouse = null;
        String jdbcUrl = value(props, JDBC_URL);
        if (jdbcUrl != null && !jdbcUrl.isEmpty()) {
            warehouse = WarehouseConfig.builder()
                    .jdbcUrl(jdbcUrl)
                    .user(value(props, USER))
                    .password(value(props, PASSWORD))
                    .schema(value(props, SCHEMA))
                    .tablePrefix(value(props, TABLE_PREFIX))
                    .build();
        }

        return new XmlPiercerSettings(flattener.build(), warehouse);
    }

    private static String value(Properties props, String key) {
        String raw = props.getProperty(key);
        return raw == null ? null : unquote(raw.trim());
    }

    /**
     * Strips one pair of matching single or double quotes.
     */
    static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static boolean isYaml(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }

    private static Properties readProperties(InputStream is) throws IOException {
        Properties props = new Properties();
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        return props;
    }

    private static Properties readYaml(InputStream is) {
        Object document;
        try {
            document = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML configuration: " + e.getMessage(), e);
        }
        Properties props = new Properties();
        if (document instanceof Map<?, ?> map) {
            flattenYaml("", map, props);
        } else if (document != null) {
            throw new IllegalArgumentException("YAML configuration must be a mapping, got "
                    + document.getClass().getSimpleName());
        }
        return props;
    }

    private static void flattenYaml(String prefix, Map<?, ?> map, Properties target) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                flattenYaml(key, nested, target);
            } else if (value instanceof List<?> list) {
                target.setProperty(key, list.stream().map(String::valueOf).collect(Collectors.joining(",")));
            } else if (value != null) {
                target.setProperty(key, String.valueOf(value));
            }
        }
    }
}
