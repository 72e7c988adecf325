package hrl.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Something limits apply to. Entities form a forest: a child names its parent,
 * and with {@code cascade} set, its consumption is mirrored to the parent.
 */
public record Entity(
    String id,
    String name,
    String parentId,
    Map<String, String> metadata,
    boolean cascade,
    Instant createdAt
) {
    public Entity {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isParent() {
        return parentId == null;
    }

    public boolean isChild() {
        return parentId != null;
    }
}
