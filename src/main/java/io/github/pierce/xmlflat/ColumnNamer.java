package io.github.pierce.xmlflat;

/**
 * Builds column names from path segments and attribute names.
 *
 * <p>Segments are joined with {@code _}. An attribute {@code k} on a node
 * whose column prefix is {@code P} becomes {@code P_k}, or {@code P_@k}
 * when the attribute marker is {@code @}.</p>
 */
public final class ColumnNamer {

    public static final String SEPARATOR = "_";

    private final String attributeMarker;

    public ColumnNamer(String attributeMarker) {
        this.attributeMarker = attributeMarker != null ? attributeMarker : "";
    }

    /**
     * Column prefix of a node reached through {@code path}; an empty path yields the tag itself.
     */
    public String prefix(String path, String tag) {
        return path == null || path.isEmpty() ? tag : path + SEPARATOR + tag;
    }

    public String attribute(String prefix, String attributeName) {
        return prefix + SEPARATOR + attributeMarker + attributeName;
    }

    public String getAttributeMarker() {
        return attributeMarker;
    }
}
