package io.github.pierce.xmlflat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Denormalizes the children of a designated root node into one table per tag.
 *
 * <p>For each level-1 child, structure without repeats is flattened inline
 * into a single row. Wherever a repeating group appears, each member starts
 * its own branch carrying the columns gathered so far plus a 1-based
 * sequence number, and every branch ends in one row. Repeating groups that
 * share a parent are fanned out one after the other, never multiplied with
 * each other.</p>
 *
 * <p>Inline flattening names columns by the path from the node being
 * inlined; fan-out steps write a node's own {@code tag} and {@code tag_attr}
 * columns without any ancestor path.</p>
 */
public class DenormalizingFlattener {

    private static final Logger LOG = LoggerFactory.getLogger(DenormalizingFlattener.class);

    private final XmlFlattenerConfig config;
    private final ColumnNamer namer;

    public DenormalizingFlattener() {
        this(XmlFlattenerConfig.defaults());
    }

    public DenormalizingFlattener(XmlFlattenerConfig config) {
        this.config = config != null ? config : XmlFlattenerConfig.defaults();
        this.namer = this.config.columnNamer();
    }

    public DenormalizedResult denormalize(XmlNode document) {
        XmlNode dataNode = findRootNode(document, config.getRootNodeTag());
        if (dataNode == null) {
            LOG.warn("Could not find '{}' node in XML", config.getRootNodeTag());
            return DenormalizedResult.empty();
        }

        Run run = new Run(LocalDateTime.now(config.getClock()).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        Map<String, FlattenedTable> tables = new LinkedHashMap<>();

        for (Map.Entry<String, List<XmlNode>> group : ChildGroups.of(dataNode).asMap().entrySet()) {
            String tableName = group.getKey();
            List<XmlNode> members = group.getValue();
            LOG.info("Processing Level 1 node: {}", tableName);

            List<Map<String, String>> collected = new ArrayList<>();
            boolean repeated = members.size() > 1;
            for (int i = 0; i < members.size(); i++) {
                Integer sequence = repeated ? i + 1 : null;
                denormalizeTableNode(members.get(i), sequence, collected, run);
            }

            if (!collected.isEmpty()) {
                tables.put(tableName, new FlattenedTable(tableName, collected));
                LOG.info("  -> Generated {} rows for {}", collected.size(), tableName);
            }
        }

        return new DenormalizedResult(tables);
    }

    /**
     * Returns the root itself when its tag matches, otherwise the first
     * matching descendant in document order, or null.
     */
    static XmlNode findRootNode(XmlNode root, String tag) {
        Deque<XmlNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            XmlNode node = stack.pop();
            if (node.getTag().equals(tag)) {
                return node;
            }
            List<XmlNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return null;
    }

    private void denormalizeTableNode(XmlNode node, Integer sequence, List<Map<String, String>> out, Run run) {
        InlineResult inline = flattenInline(node, "", 1, run);

        if (inline instanceof InlineResult.Flattened flattened) {
            if (!flattened.row().isEmpty()) {
                Map<String, String> row = new LinkedHashMap<>(flattened.row());
                if (sequence != null) {
                    row.put(config.getSequenceColumn(), String.valueOf(sequence));
                }
                finalizeRow(row, out, run);
            }
            return;
        }

        Map<String, String> parentData = new LinkedHashMap<>();
        writeLocalColumns(node, parentData);
        if (sequence != null) {
            parentData.put(config.getSequenceColumn(), String.valueOf(sequence));
        }
        extract(node, parentData, out, 1, run);
    }

    /**
     * Flattens a subtree into one row whose columns carry the path from
     * {@code node}, or reports that the subtree holds a repeating group.
     */
    private InlineResult flattenInline(XmlNode node, String path, int depth, Run run) {
        String prefix = namer.prefix(path, node.getTag());
        Map<String, String> row = new LinkedHashMap<>();

        if (depth > config.getMaxNestingDepth()) {
            run.warnDepthOnce(prefix);
            row.put(prefix, node.toMarkup());
            return InlineResult.flattened(row);
        }

        for (Map.Entry<String, String> attr : node.getAttributes().entrySet()) {
            row.put(namer.attribute(prefix, attr.getKey()), attr.getValue());
        }
        if (node.hasText()) {
            row.put(prefix, node.getText());
        }

        ChildGroups groups = ChildGroups.of(node);
        if (groups.hasRepeatingGroup()) {
            return InlineResult.requiresExtraction();
        }

        for (XmlNode child : groups.singles().values()) {
            InlineResult childResult = flattenInline(child, prefix, depth + 1, run);
            if (childResult instanceof InlineResult.Flattened flattened) {
                row.putAll(flattened.row());
            } else {
                return childResult;
            }
        }
        return InlineResult.flattened(row);
    }

    private void extract(XmlNode node, Map<String, String> parentData,
                         List<Map<String, String>> out, int depth, Run run) {
        Map<String, String> current = new LinkedHashMap<>(parentData);
        writeLocalColumns(node, current);

        if (depth > config.getMaxNestingDepth()) {
            run.warnDepthOnce(node.getTag());
            current.put(node.getTag(), node.toMarkup());
            finalizeRow(current, out, run);
            return;
        }

        ChildGroups groups = ChildGroups.of(node);

        List<XmlNode> needExtraction = new ArrayList<>();
        for (XmlNode single : groups.singles().values()) {
            InlineResult inline = flattenInline(single, "", depth + 1, run);
            if (inline instanceof InlineResult.Flattened flattened) {
                current.putAll(flattened.row());
            } else {
                needExtraction.add(single);
            }
        }

        Map<String, List<XmlNode>> repeating = groups.repeating();
        if (needExtraction.isEmpty() && repeating.isEmpty()) {
            if (!current.equals(parentData)) {
                finalizeRow(current, out, run);
            }
            return;
        }

        for (XmlNode single : needExtraction) {
            extract(single, current, out, depth + 1, run);
        }

        for (Map.Entry<String, List<XmlNode>> group : repeating.entrySet()) {
            List<XmlNode> members = group.getValue();
            LOG.debug("Fanning out {} <{}> elements under <{}>", members.size(), group.getKey(), node.getTag());
            for (int i = 0; i < members.size(); i++) {
                Map<String, String> branch = new LinkedHashMap<>(current);
                branch.put(config.getSequenceColumn(), String.valueOf(i + 1));
                extract(members.get(i), branch, out, depth + 1, run);
            }
        }
    }

    private void writeLocalColumns(XmlNode node, Map<String, String> target) {
        if (node.hasText()) {
            target.put(node.getTag(), node.getText());
        }
        for (Map.Entry<String, String> attr : node.getAttributes().entrySet()) {
            target.put(namer.attribute(node.getTag(), attr.getKey()), attr.getValue());
        }
    }

    private void finalizeRow(Map<String, String> row, List<Map<String, String>> out, Run run) {
        Map<String, String> finalized = new LinkedHashMap<>(row);
        finalized.put(config.getLoadTimestampColumn(), run.loadTimestamp);
        out.add(Collections.unmodifiableMap(finalized));
    }

    /**
     * State scoped to one {@link #denormalize} call.
     */
    private final class Run {
        private final String loadTimestamp;
        private boolean depthWarned;

        Run(String loadTimestamp) {
            this.loadTimestamp = loadTimestamp;
        }

        void warnDepthOnce(String column) {
            if (!depthWarned) {
                depthWarned = true;
                LOG.warn("Nesting deeper than {} at '{}'; collapsing subtree into one column",
                        config.getMaxNestingDepth(), column);
            }
        }
    }
}
