package io.github.pierce.xmlflat;

/**
 * Exception thrown when an XML source cannot be parsed into a node tree.
 */
public class XmlReadException extends FlatteningException {

    private final String source;

    public XmlReadException(String source, String message, Throwable cause) {
        super("Cannot read XML from " + source + ": " + message, cause);
        this.source = source;
    }

    /**
     * Returns a description of the source that failed to parse.
     */
    public String getSource() {
        return source;
    }
}
