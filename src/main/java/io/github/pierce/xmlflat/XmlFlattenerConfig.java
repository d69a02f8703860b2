package io.github.pierce.xmlflat;

import java.time.Clock;
import java.util.Objects;

/**
 * Configuration options for XML flattening.
 *
 * <p>This class uses the builder pattern for configuration and is immutable
 * once constructed.</p>
 */
public final class XmlFlattenerConfig {

    public static final String DEFAULT_ROOT_NODE = "data";
    public static final String DEFAULT_SEQUENCE_COLUMN = "_sequence_num";
    public static final String DEFAULT_TIMESTAMP_COLUMN = "_load_timestamp";
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    // Denormalization
    private final String rootNodeTag;
    private final String sequenceColumn;
    private final String loadTimestampColumn;
    private final Clock clock;

    // Naming
    private final String attributeMarker;

    // Limits
    private final int maxNestingDepth;

    private XmlFlattenerConfig(Builder builder) {
        this.rootNodeTag = builder.rootNodeTag;
        this.sequenceColumn = builder.sequenceColumn;
        this.loadTimestampColumn = builder.loadTimestampColumn;
        this.clock = builder.clock;
        this.attributeMarker = builder.attributeMarker;
        this.maxNestingDepth = builder.maxNestingDepth;
    }

    /**
     * Returns a builder with default settings.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration.
     */
    public static XmlFlattenerConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a builder initialized from this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .rootNodeTag(rootNodeTag)
                .sequenceColumn(sequenceColumn)
                .loadTimestampColumn(loadTimestampColumn)
                .clock(clock)
                .attributeMarker(attributeMarker)
                .maxNestingDepth(maxNestingDepth);
    }

    // Getters

    /**
     * Tag of the node whose children become tables when denormalizing.
     */
    public String getRootNodeTag() {
        return rootNodeTag;
    }

    public String getSequenceColumn() {
        return sequenceColumn;
    }

    public String getLoadTimestampColumn() {
        return loadTimestampColumn;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Marker placed between the separator and the attribute name, empty by default.
     */
    public String getAttributeMarker() {
        return attributeMarker;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public ColumnNamer columnNamer() {
        return new ColumnNamer(attributeMarker);
    }

    @Override
    public String toString() {
        return "XmlFlattenerConfig{" +
                "rootNodeTag='" + rootNodeTag + '\'' +
                ", sequenceColumn='" + sequenceColumn + '\'' +
                ", loadTimestampColumn='" + loadTimestampColumn + '\'' +
                ", attributeMarker='" + attributeMarker + '\'' +
                ", maxNestingDepth=" + maxNestingDepth +
                '}';
    }

    /**
     * Builder for XmlFlattenerConfig.
     */
    public static final class Builder {
        private String rootNodeTag = DEFAULT_ROOT_NODE;
        private String sequenceColumn = DEFAULT_SEQUENCE_COLUMN;
        private String loadTimestampColumn = DEFAULT_TIMESTAMP_COLUMN;
        private Clock clock = Clock.systemDefaultZone();
        private String attributeMarker = "";
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        private Builder() {
        }

        public Builder rootNodeTag(String tag) {
            this.rootNodeTag = Objects.requireNonNull(tag, "rootNodeTag");
            return this;
        }

        public Builder sequenceColumn(String column) {
            this.sequenceColumn = Objects.requireNonNull(column, "sequenceColumn");
            return this;
        }

        public Builder loadTimestampColumn(String column) {
            this.loadTimestampColumn = Objects.requireNonNull(column, "loadTimestampColumn");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder attributeMarker(String marker) {
            this.attributeMarker = marker != null ? marker : "";
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            if (depth <= 0) {
                throw new IllegalArgumentException("maxNestingDepth must be positive: " + depth);
            }
            this.maxNestingDepth = depth;
            return this;
        }

        public XmlFlattenerConfig build() {
            return new XmlFlattenerConfig(this);
        }
    }
}
