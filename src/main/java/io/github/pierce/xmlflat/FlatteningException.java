package io.github.pierce.xmlflat;

/**
 * Base exception for all flattening errors.
 */
public class FlatteningException extends RuntimeException {

    private final String nodePath;

    public FlatteningException(String message) {
        super(message);
        this.nodePath = null;
    }

    public FlatteningException(String message, Throwable cause) {
        super(message, cause);
        this.nodePath = null;
    }

    public FlatteningException(String nodePath, String message) {
        super(message);
        this.nodePath = nodePath;
    }

    public FlatteningException(String nodePath, String message, Throwable cause) {
        super(message, cause);
        this.nodePath = nodePath;
    }

    /**
     * Returns the path of the node being processed when the error occurred.
     */
    public String getNodePath() {
        return nodePath;
    }

    @Override
    public String getMessage() {
        if (nodePath != null && !nodePath.isEmpty()) {
            return "Node '" + nodePath + "': " + super.getMessage();
        }
        return super.getMessage();
    }
}
