package io.github.pierce.xmlflat;

import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a whole document into one row set by full cartesian expansion.
 *
 * <p>Every node's attributes become {@code path_tag_attr} columns and leaf
 * text becomes a {@code path_tag} column, where {@code path} is the complete
 * ancestor chain. Children are grouped by tag; each group's rows are the
 * concatenation of its members' rows, and the node's rows are the cartesian
 * product of its groups' rows merged onto the node's own columns. On key
 * collision the later group wins.</p>
 *
 * <p>Row count grows with the product of repeating group sizes at every
 * level. That is the price of full denormalization and is not treated as an
 * error unless the count no longer fits in an int.</p>
 */
public class CartesianFlattener {

    private static final Logger LOG = LoggerFactory.getLogger(CartesianFlattener.class);

    private final XmlFlattenerConfig config;
    private final ColumnNamer namer;

    public CartesianFlattener() {
        this(XmlFlattenerConfig.defaults());
    }

    public CartesianFlattener(XmlFlattenerConfig config) {
        this.config = config != null ? config : XmlFlattenerConfig.defaults();
        this.namer = this.config.columnNamer();
    }

    public RowSet flatten(XmlNode root) {
        Run run = new Run();
        List<Map<String, String>> rows = expand(root, new LinkedHashMap<>(), "", 1, run);
        LOG.debug("Flattened <{}> into {} rows", root.getTag(), rows.size());
        return new RowSet(rows);
    }

    private List<Map<String, String>> expand(XmlNode node, Map<String, String> context,
                                             String path, int depth, Run run) {
        Map<String, String> base = new LinkedHashMap<>(context);
        String prefix = namer.prefix(path, node.getTag());

        if (depth > config.getMaxNestingDepth()) {
            run.warnDepthOnce(prefix);
            base.put(prefix, node.toMarkup());
            return Collections.singletonList(base);
        }

        for (Map.Entry<String, String> attr : node.getAttributes().entrySet()) {
            base.put(namer.attribute(prefix, attr.getKey()), attr.getValue());
        }

        if (!node.hasChildren()) {
            if (node.hasText()) {
                base.put(prefix, node.getText());
            }
            return Collections.singletonList(base);
        }

        List<List<Map<String, String>>> groupRows = new ArrayList<>();
        for (List<XmlNode> members : ChildGroups.of(node).asMap().values()) {
            List<Map<String, String>> rows = new ArrayList<>();
            for (XmlNode member : members) {
                rows.addAll(expand(member, base, prefix, depth + 1, run));
            }
            groupRows.add(rows);
        }

        return combine(base, groupRows, prefix);
    }

    private List<Map<String, String>> combine(Map<String, String> base,
                                              List<List<Map<String, String>>> groupRows,
                                              String prefix) {
        List<List<Map<String, String>>> combinations;
        try {
            combinations = Lists.cartesianProduct(groupRows);
        } catch (IllegalArgumentException e) {
            throw new FlatteningException(prefix, "Cartesian expansion exceeds " + Integer.MAX_VALUE + " rows", e);
        }

        List<Map<String, String>> merged = new ArrayList<>(combinations.size());
        for (List<Map<String, String>> combination : combinations) {
            Map<String, String> row = new LinkedHashMap<>(base);
            for (Map<String, String> part : combination) {
                row.putAll(part);
            }
            merged.add(row);
        }
        return merged;
    }

    /**
     * State scoped to one {@link #flatten} call.
     */
    private final class Run {
        private boolean depthWarned;

        void warnDepthOnce(String prefix) {
            if (!depthWarned) {
                depthWarned = true;
                LOG.warn("Nesting deeper than {} at '{}'; collapsing subtree into one column",
                        config.getMaxNestingDepth(), prefix);
            }
        }
    }
}
