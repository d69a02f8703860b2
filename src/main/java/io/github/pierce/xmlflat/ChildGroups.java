package io.github.pierce.xmlflat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node's children partitioned by tag.
 *
 * <p>Tags keep the order in which they were first seen; children keep
 * document order within their tag. A group with two or more children is a
 * repeating group.</p>
 */
public final class ChildGroups {

    private final Map<String, List<XmlNode>> groups;

    private ChildGroups(Map<String, List<XmlNode>> groups) {
        this.groups = groups;
    }

    public static ChildGroups of(XmlNode node) {
        return of(node.getChildren());
    }

    public static ChildGroups of(List<XmlNode> children) {
        Map<String, List<XmlNode>> groups = new LinkedHashMap<>();
        for (XmlNode child : children) {
            groups.computeIfAbsent(child.getTag(), k -> new ArrayList<>()).add(child);
        }
        groups.replaceAll((tag, members) -> Collections.unmodifiableList(members));
        return new ChildGroups(Collections.unmodifiableMap(groups));
    }

    public Map<String, List<XmlNode>> asMap() {
        return groups;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public boolean hasRepeatingGroup() {
        for (List<XmlNode> members : groups.values()) {
            if (members.size() > 1) {
                return true;
            }
        }
        return false;
    }

    /**
     * Groups with exactly one child, keyed by tag, in first-seen order.
     */
    public Map<String, XmlNode> singles() {
        Map<String, XmlNode> singles = new LinkedHashMap<>();
        groups.forEach((tag, members) -> {
            if (members.size() == 1) {
                singles.put(tag, members.get(0));
            }
        });
        return singles;
    }

    /**
     * Groups with two or more children, keyed by tag, in first-seen order.
     */
    public Map<String, List<XmlNode>> repeating() {
        Map<String, List<XmlNode>> repeating = new LinkedHashMap<>();
        groups.forEach((tag, members) -> {
            if (members.size() > 1) {
                repeating.put(tag, members);
            }
        });
        return repeating;
    }
}
