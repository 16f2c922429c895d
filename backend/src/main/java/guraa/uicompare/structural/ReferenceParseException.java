package guraa.uicompare.structural;

/**
 * Thrown when a reference node document cannot be turned into a node tree.
 */
public class ReferenceParseException extends Exception {

    public ReferenceParseException(String message) {
        super(message);
    }

    public ReferenceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
