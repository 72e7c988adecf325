package hrl.core.model;

import java.util.List;

/**
 * One limit of one resource, summed across every entity holding a bucket for it.
 */
public record ResourceCapacity(
    String resource,
    String limitName,
    long totalCapacity,
    long totalAvailable,
    double utilizationPct,
    List<EntityCapacity> entities
) {
    public ResourceCapacity {
        entities = List.copyOf(entities);
    }
}
