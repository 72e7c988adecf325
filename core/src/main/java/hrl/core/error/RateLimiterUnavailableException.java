package hrl.core.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Raised when the backing store cannot be reached and the effective failure mode
 * is fail-closed. This is an infrastructure condition, not a quota decision.
 */
public class RateLimiterUnavailableException extends RateLimiterException {

    private final String namespace;
    private final String entityId;
    private final String resource;

    public RateLimiterUnavailableException(String message, Throwable cause,
                                           String namespace, String entityId, String resource) {
        super(format(message, namespace, entityId, resource), cause);
        this.namespace = namespace;
        this.entityId = entityId;
        this.resource = resource;
    }

    public RateLimiterUnavailableException(String message, Throwable cause) {
        this(message, cause, null, null, null);
    }

    public String namespace() {
        return namespace;
    }

    public String entityId() {
        return entityId;
    }

    public String resource() {
        return resource;
    }

    private static String format(String message, String namespace, String entityId, String resource) {
        List<String> context = new ArrayList<>();
        if (namespace != null) context.add("namespace=" + namespace);
        if (entityId != null) context.add("entity=" + entityId);
        if (resource != null) context.add("resource=" + resource);
        if (context.isEmpty()) return message;
        return message + " [" + String.join(", ", context) + "]";
    }
}
