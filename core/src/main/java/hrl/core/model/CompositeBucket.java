package hrl.core.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Every limit's state for one (entity, resource) pair. This is the typed view of
 * the single store record that packs all limits together; the refill timestamp
 * is shared by all of them.
 *
 * @param parentId parent entity, or {@code null}
 * @param cascade whether consumption is mirrored to the parent
 */
public record CompositeBucket(
    String entityId,
    String resource,
    long lastRefillMs,
    String parentId,
    boolean cascade,
    List<BucketState> limits
) {
    public CompositeBucket {
        limits = List.copyOf(limits);
    }

    public Optional<BucketState> limit(String name) {
        for (BucketState state : limits) {
            if (state.limitName().equals(name)) return Optional.of(state);
        }
        return Optional.empty();
    }

    public Set<String> limitNames() {
        return limits.stream().map(BucketState::limitName).collect(Collectors.toCollection(java.util.LinkedHashSet::new));
    }

    public boolean containsAll(Iterable<String> names) {
        Set<String> present = limitNames();
        for (String name : names) {
            if (!present.contains(name)) return false;
        }
        return true;
    }
}
