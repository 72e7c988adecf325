package hrl.core.error;

public class EntityExistsException extends RateLimiterException {

    private final String entityId;

    public EntityExistsException(String entityId) {
        super("Entity already exists: " + entityId);
        this.entityId = entityId;
    }

    public String entityId() {
        return entityId;
    }
}
