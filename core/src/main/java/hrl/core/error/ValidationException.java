package hrl.core.error;

/**
 * Raised when caller input fails validation. Never reaches the backing store.
 */
public class ValidationException extends RateLimiterException {

    private static final int MAX_VALUE_LENGTH = 50;

    private final String field;
    private final String value;
    private final String reason;

    public ValidationException(String field, String value, String reason) {
        super("Invalid " + field + ": " + reason);
        this.field = field;
        this.value = truncate(value);
        this.reason = reason;
    }

    public String field() {
        return field;
    }

    /** The offending value, truncated to 50 characters. */
    public String value() {
        return value;
    }

    public String reason() {
        return reason;
    }

    private static String truncate(String value) {
        if (value == null) return null;
        return value.length() > MAX_VALUE_LENGTH ? value.substring(0, MAX_VALUE_LENGTH) + "..." : value;
    }
}
