package hrl.java.engine;

import hrl.core.model.Amounts;
import hrl.core.model.ConfigSource;
import hrl.core.model.Limit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One bucket an admission writes to: the requesting entity, or its parent under
 * cascade. Carries the limits in force for that entity and where they came from.
 *
 * @param parentId denormalized onto a newly created bucket
 * @param cascade denormalized onto a newly created bucket
 */
record Target(String entityId, List<Limit> limits, ConfigSource source, String parentId, boolean cascade) {

    Target {
        limits = List.copyOf(limits);
    }

    Optional<Limit> limit(String name) {
        for (Limit limit : limits) {
            if (limit.name().equals(name)) return Optional.of(limit);
        }
        return Optional.empty();
    }

    /** The part of {@code amounts} that names one of this target's limits. */
    Amounts select(Amounts amounts) {
        Map<String, Long> selected = new LinkedHashMap<>();
        amounts.asMap().forEach((name, amount) -> {
            if (limit(name).isPresent()) selected.put(name, amount);
        });
        return selected.size() == amounts.size() ? amounts : Amounts.copyOf(selected);
    }

    /** Per-entity limits make the bucket permanent. */
    boolean hasCustomLimits() {
        return source == ConfigSource.ENTITY || source == ConfigSource.ENTITY_DEFAULT;
    }

    double maxTimeToFillSeconds() {
        double max = 0.0;
        for (Limit limit : limits) {
            max = Math.max(max, limit.timeToFillSeconds());
        }
        return max;
    }
}
