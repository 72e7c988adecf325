package hrl.core.error;

public class EntityNotFoundException extends RateLimiterException {

    private final String entityId;

    public EntityNotFoundException(String entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public String entityId() {
        return entityId;
    }
}
