package hrl.core.model;

/**
 * What to do when the backing store cannot be reached.
 */
public enum FailureMode {
    /** Admit the request with a no-op lease. */
    FAIL_OPEN("allow"),
    /** Reject with an unavailable error. */
    FAIL_CLOSED("block");

    private final String wireValue;

    FailureMode(String wireValue) {
        this.wireValue = wireValue;
    }

    /** Value stored in configuration records. */
    public String wireValue() {
        return wireValue;
    }

    public static FailureMode fromWire(String value) {
        for (FailureMode mode : values()) {
            if (mode.wireValue.equals(value)) return mode;
        }
        throw new IllegalArgumentException("Unknown failure mode: " + value);
    }
}
