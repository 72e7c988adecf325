package hrl.core.error;

/**
 * Raised when the stored schema has a different major version than the client
 * and requires a manual migration.
 */
public class IncompatibleSchemaException extends RateLimiterException {

    private final String clientVersion;
    private final String schemaVersion;

    public IncompatibleSchemaException(String clientVersion, String schemaVersion, String message) {
        super("Incompatible schema: client " + clientVersion + " is not compatible with schema "
            + schemaVersion + ". " + message);
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
