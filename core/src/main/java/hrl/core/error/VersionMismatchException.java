package hrl.core.error;

/**
 * Raised when the client and the stored schema differ in a way that an upgrade
 * of the schema record would resolve.
 */
public class VersionMismatchException extends RateLimiterException {

    private final String clientVersion;
    private final String schemaVersion;

    public VersionMismatchException(String clientVersion, String schemaVersion, String message) {
        super("Version mismatch: client=" + clientVersion + ", schema=" + schemaVersion + ". " + message);
        this.clientVersion = clientVersion;
        this.schemaVersion = schemaVersion;
    }

    public String clientVersion() {
        return clientVersion;
    }

    public String schemaVersion() {
        return schemaVersion;
    }
}
