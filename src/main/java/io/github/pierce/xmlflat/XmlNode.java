package io.github.pierce.xmlflat;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable element of a parsed XML document.
 *
 * <p>Holds the tag, the attributes in document order, the trimmed text that
 * precedes the first child element (or {@code null} when there is none) and
 * the child elements in document order.</p>
 */
public final class XmlNode {

    private final String tag;
    private final Map<String, String> attributes;
    private final String text;
    private final List<XmlNode> children;

    private XmlNode(String tag, Map<String, String> attributes, String text, List<XmlNode> children) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.text = normalizeText(text);
        this.children = List.copyOf(children);
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    private static String normalizeText(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getTag() {
        return tag;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * Returns the trimmed text, or null if the element carries none.
     */
    public String getText() {
        return text;
    }

    public boolean hasText() {
        return text != null;
    }

    public List<XmlNode> getChildren() {
        return children;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Serializes this subtree back to markup. Text is written before the
     * children, matching how it was captured.
     */
    public String toMarkup() {
        StringBuilder sb = new StringBuilder();
        // Pending entries are nodes to open or closing tags to emit
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Object next = pending.pop();
            if (next instanceof String closingTag) {
                sb.append(closingTag);
                continue;
            }
            XmlNode node = (XmlNode) next;
            sb.append('<').append(node.tag);
            for (Map.Entry<String, String> attr : node.attributes.entrySet()) {
                sb.append(' ').append(attr.getKey()).append("=\"").append(escape(attr.getValue(), true)).append('"');
            }
            if (node.text == null && node.children.isEmpty()) {
                sb.append("/>");
                continue;
            }
            sb.append('>');
            if (node.text != null) {
                sb.append(escape(node.text, false));
            }
            pending.push("</" + node.tag + ">");
            for (int i = node.children.size() - 1; i >= 0; i--) {
                pending.push(node.children.get(i));
            }
        }
        return sb.toString();
    }

    private static String escape(String value, boolean attribute) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append(attribute ? "&quot;" : "\"");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XmlNode other)) return false;
        return tag.equals(other.tag)
                && attributes.equals(other.attributes)
                && Objects.equals(text, other.text)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, attributes, text, children);
    }

    @Override
    public String toString() {
        return "XmlNode{" + tag + ", attributes=" + attributes.size() + ", children=" + children.size() + "}";
    }

    /**
     * Builder for {@link XmlNode}.
     */
    public static final class Builder {
        private final String tag;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private String text;
        private final List<XmlNode> children = new ArrayList<>();

        private Builder(String tag) {
            this.tag = tag;
        }

        public Builder attribute(String name, String value) {
            attributes.put(name, value);
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder child(XmlNode child) {
            children.add(child);
            return this;
        }

        public Builder child(Builder child) {
            return child(child.build());
        }

        public XmlNode build() {
            return new XmlNode(tag, attributes, text, children);
        }
    }
}
