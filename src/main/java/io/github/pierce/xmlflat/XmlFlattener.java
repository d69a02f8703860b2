package io.github.pierce.xmlflat;

import java.nio.file.Path;

/**
 * Entry point for flattening XML documents.
 *
 * <p>Two policies are available:</p>
 * <ul>
 *   <li>{@link #flatten} - one row set with every repeating group expanded as
 *       a cartesian product and columns named by their full ancestor path.</li>
 *   <li>{@link #denormalize} - one table per level-1 child of the configured
 *       root node, repeats fanned out into rows with sequence numbers and an
 *       inferred schema per table.</li>
 * </ul>
 *
 * <pre>
 * XmlFlattener flattener = new XmlFlattener(XmlFlattenerConfig.builder()
 *         .rootNodeTag("data")
 *         .build());
 *
 * RowSet rows = flattener.flatten(xml);
 * DenormalizedResult tables = flattener.denormalize(xml);
 * </pre>
 */
public class XmlFlattener {

    private final XmlFlattenerConfig config;
    private final CartesianFlattener cartesian;
    private final DenormalizingFlattener denormalizing;

    public XmlFlattener() {
        this(XmlFlattenerConfig.defaults());
    }

    public XmlFlattener(XmlFlattenerConfig config) {
        this.config = config != null ? config : XmlFlattenerConfig.defaults();
        this.cartesian = new CartesianFlattener(this.config);
        this.denormalizing = new DenormalizingFlattener(this.config);
    }

    public RowSet flatten(XmlNode root) {
        return cartesian.flatten(root);
    }

    public RowSet flatten(String xml) {
        return cartesian.flatten(XmlNodeReader.read(xml));
    }

    public RowSet flatten(Path xmlFile) {
        return cartesian.flatten(XmlNodeReader.read(xmlFile));
    }

    public DenormalizedResult denormalize(XmlNode root) {
        return denormalizing.denormalize(root);
    }

    public DenormalizedResult denormalize(String xml) {
        return denormalizing.denormalize(XmlNodeReader.read(xml));
    }

    public DenormalizedResult denormalize(Path xmlFile) {
        return denormalizing.denormalize(XmlNodeReader.read(xmlFile));
    }

    public XmlFlattenerConfig getConfig() {
        return config;
    }
}
