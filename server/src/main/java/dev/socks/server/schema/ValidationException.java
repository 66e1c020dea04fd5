package dev.socks.server.schema;

/**
 * A request does not match its schema. {@link #path()} is the dotted path of the first
 * offending field, empty for the top-level value.
 */
public class ValidationException extends IllegalArgumentException {

    private final String path;
    private final String expected;
    private final String actual;

    public ValidationException(String message, String path, String expected, String actual) {
        super(message);
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }

    public String path() {
        return path;
    }

    /** Expected type description, or null when the field is missing. */
    public String expected() {
        return expected;
    }

    /** Actual type found, or null when the field is missing. */
    public String actual() {
        return actual;
    }
}
